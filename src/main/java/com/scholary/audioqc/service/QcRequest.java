package com.scholary.audioqc.service;

import com.scholary.audioqc.storage.UploadSource;

/**
 * One analysis request as received from the caller.
 *
 * @param audioId optional caller-supplied identifier
 * @param originalFilename filename as sent by the client, unsanitised
 * @param source the upload, or {@code null} when no file part was sent
 */
public record QcRequest(String audioId, String originalFilename, UploadSource source) {}
