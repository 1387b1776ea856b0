package com.scholary.audioqc.storage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The raw bytes of an uploaded file.
 *
 * <p>The size is known before any bytes are copied, so the size limit can be enforced without
 * touching the content.
 */
public interface UploadSource {

  long size();

  void transferTo(Path target) throws IOException;
}
