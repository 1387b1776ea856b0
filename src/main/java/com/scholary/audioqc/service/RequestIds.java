package com.scholary.audioqc.service;

import java.util.UUID;

/** Request identifier generation. */
public final class RequestIds {

  private RequestIds() {}

  /**
   * A dash-less random UUID, or {@code <audioId>_<8 hex>} when the caller supplied an id.
   *
   * @param audioId caller-supplied identifier, may be {@code null} or blank
   */
  public static String next(String audioId) {
    String hex = UUID.randomUUID().toString().replace("-", "");
    if (audioId == null || audioId.isBlank()) {
      return hex;
    }
    return audioId.strip() + "_" + hex.substring(0, 8);
  }
}
