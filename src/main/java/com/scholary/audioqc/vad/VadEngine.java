package com.scholary.audioqc.vad;

import com.scholary.audioqc.metrics.VadSegment;
import java.util.List;

/**
 * Interface for voice activity detection.
 *
 * <p>This abstraction lets us swap the model server for a local engine or a test double. Callers
 * never invoke an engine directly; every call goes through the GPU gate.
 */
public interface VadEngine {

  /**
   * Detect speech in a mono sample buffer.
   *
   * @param samples normalised samples
   * @param sampleRate samples per second
   * @return raw speech segments in milliseconds, in whatever order the engine produced them
   * @throws VadException if inference fails
   */
  List<VadSegment> detect(float[] samples, int sampleRate);
}
