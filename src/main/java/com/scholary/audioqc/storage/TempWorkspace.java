package com.scholary.audioqc.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A temp directory owned by exactly one request.
 *
 * <p>Everything the request writes (the staged upload, the decoded WAV, ffmpeg's log) lives here,
 * and {@link #close()} removes the whole tree. Closing twice is harmless.
 */
public final class TempWorkspace implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(TempWorkspace.class);

  static final String PREFIX = "aqc_req_";
  static final String DEFAULT_FILENAME = "upload.bin";

  private final Path directory;
  private volatile boolean closed;

  private TempWorkspace(Path directory) {
    this.directory = directory;
  }

  /**
   * Create a fresh workspace.
   *
   * @param parent where to create it, or {@code null} for the system temp directory
   */
  public static TempWorkspace create(Path parent) throws IOException {
    Path dir;
    if (parent == null) {
      dir = Files.createTempDirectory(PREFIX);
    } else {
      Files.createDirectories(parent);
      dir = Files.createTempDirectory(parent, PREFIX);
    }
    LOGGER.debug("Created workspace {}", dir);
    return new TempWorkspace(dir);
  }

  public Path directory() {
    return directory;
  }

  /** Copy an upload into the workspace under a sanitised name. */
  public Path stage(UploadSource source, String originalFilename) throws IOException {
    Path target = directory.resolve(sanitizeFilename(originalFilename));
    source.transferTo(target);
    return target;
  }

  /**
   * Reduce a client-supplied filename to a safe basename.
   *
   * <p>Directory components are dropped, and {@code ..}, separators and NUL become {@code _}.
   */
  public static String sanitizeFilename(String filename) {
    if (filename == null || filename.isBlank()) {
      return DEFAULT_FILENAME;
    }
    String name = filename.replace('\\', '/');
    name = name.substring(name.lastIndexOf('/') + 1);
    name = name.replace("..", "_").replace("\0", "_").strip();
    return name.isEmpty() ? DEFAULT_FILENAME : name;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    try (Stream<Path> paths = Files.walk(directory)) {
      paths
          .sorted(Comparator.reverseOrder())
          .forEach(
              path -> {
                try {
                  Files.deleteIfExists(path);
                } catch (IOException e) {
                  throw new UncheckedIOException(e);
                }
              });
      LOGGER.debug("Deleted workspace {}", directory);
    } catch (IOException | UncheckedIOException e) {
      LOGGER.warn("Failed to delete workspace {}: {}", directory, e.getMessage());
    }
  }
}
