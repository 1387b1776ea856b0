package com.scholary.audioqc.storage;

import java.io.IOException;
import java.nio.file.Path;
import org.springframework.web.multipart.MultipartFile;

/** {@link UploadSource} over a Spring multipart part. */
public class MultipartUploadSource implements UploadSource {

  private final MultipartFile file;

  public MultipartUploadSource(MultipartFile file) {
    this.file = file;
  }

  @Override
  public long size() {
    return file.getSize();
  }

  @Override
  public void transferTo(Path target) throws IOException {
    file.transferTo(target);
  }
}
