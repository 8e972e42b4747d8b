package com.flamingo.ai.quotes.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.jpountz.xxhash.StreamingXXHash64;
import net.jpountz.xxhash.XXHashFactory;
import org.springframework.stereotype.Component;

/**
 * Keeps the two sidecar files of a dump: {@code <dump>.checkpoint} while a run is unfinished and
 * {@code <dump>.done} once it completed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CheckpointStore {

  static final String CHECKPOINT_SUFFIX = ".checkpoint";
  static final String DONE_SUFFIX = ".done";

  private static final int CHECKSUM_BUFFER_SIZE = 64 * 1024;
  private static final long CHECKSUM_SEED = 0L;

  private final ObjectMapper objectMapper;

  public boolean exists(Path dumpPath) {
    return Files.exists(checkpointPath(dumpPath));
  }

  /**
   * Reads the checkpoint of a dump.
   *
   * @return the checkpoint, or empty when the dump has none
   * @throws IOException if the checkpoint exists but cannot be read or parsed
   */
  public Optional<Checkpoint> load(Path dumpPath) throws IOException {
    Path checkpointPath = checkpointPath(dumpPath);
    if (!Files.exists(checkpointPath)) {
      return Optional.empty();
    }
    return Optional.of(objectMapper.readValue(checkpointPath.toFile(), Checkpoint.class));
  }

  /** Writes the checkpoint through a temporary sibling so a crash never leaves half a file. */
  public void save(Path dumpPath, Checkpoint checkpoint) throws IOException {
    Path checkpointPath = checkpointPath(dumpPath);
    Path tempPath = checkpointPath.resolveSibling(checkpointPath.getFileName() + ".tmp");
    objectMapper.writeValue(tempPath.toFile(), checkpoint);
    try {
      Files.move(
          tempPath,
          checkpointPath,
          StandardCopyOption.ATOMIC_MOVE,
          StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(tempPath, checkpointPath, StandardCopyOption.REPLACE_EXISTING);
    }
    log.info("Saved checkpoint at page '{}' to {}", checkpoint.lastPageTitle(), checkpointPath);
  }

  public void delete(Path dumpPath) throws IOException {
    if (Files.deleteIfExists(checkpointPath(dumpPath))) {
      log.info("Removed checkpoint of {}", dumpPath);
    }
  }

  public boolean isDone(Path dumpPath) {
    return Files.exists(donePath(dumpPath));
  }

  public void markDone(Path dumpPath) throws IOException {
    Path donePath = donePath(dumpPath);
    Files.write(donePath, new byte[0]);
    log.info("Marked {} as done", dumpPath);
  }

  /**
   * Computes the XXHash64 of a dump's bytes as 16 lowercase hex digits.
   *
   * @throws IOException if the dump cannot be read
   */
  public String computeChecksum(Path dumpPath) throws IOException {
    byte[] buffer = new byte[CHECKSUM_BUFFER_SIZE];
    try (InputStream in = Files.newInputStream(dumpPath);
        StreamingXXHash64 hash =
            XXHashFactory.fastestInstance().newStreamingHash64(CHECKSUM_SEED)) {
      int read;
      while ((read = in.read(buffer)) != -1) {
        hash.update(buffer, 0, read);
      }
      return String.format("%016x", hash.getValue());
    }
  }

  public Path checkpointPath(Path dumpPath) {
    return dumpPath.resolveSibling(dumpPath.getFileName() + CHECKPOINT_SUFFIX);
  }

  public Path donePath(Path dumpPath) {
    return dumpPath.resolveSibling(dumpPath.getFileName() + DONE_SUFFIX);
  }
}
