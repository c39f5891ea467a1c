package com.cario.insight.app.storage;

import com.cario.insight.app.exception.StorageException;
import com.cario.insight.app.exception.StorageNotFoundException;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;

/**
 * Filesystem backend rooted at a configured directory. Keys are relative paths below the root.
 *
 * <p>Writes go to a temp file in the target directory and are moved into place, so a reader never
 * observes a partially written object.
 */
@Log4j2
public class LocalFileImageStorage implements ImageStorage {

  private static final String DEFAULT_PREFIX = "images/";

  private final Path root;
  private final String publicBaseUrl;

  public LocalFileImageStorage(Path root, String publicBaseUrl) {
    this.root = Objects.requireNonNull(root, "root must not be null").toAbsolutePath().normalize();
    this.publicBaseUrl = publicBaseUrl;
    try {
      Files.createDirectories(this.root);
    } catch (IOException e) {
      throw new StorageException("Cannot create storage root " + this.root, e);
    }
    log.info("storage.local root={} publicBaseUrl={}", this.root, publicBaseUrl);
  }

  @Override
  public String save(byte[] bytes, String suggestedName) {
    String key = StorageKeys.generate(DEFAULT_PREFIX, suggestedName);
    write(key, bytes);
    return key;
  }

  @Override
  public void saveAs(String key, byte[] bytes, String contentType) {
    write(key, bytes);
  }

  @Override
  public byte[] fetch(String key) {
    Path path = resolve(key);
    try {
      return Files.readAllBytes(path);
    } catch (NoSuchFileException e) {
      throw new StorageNotFoundException(key);
    } catch (IOException e) {
      throw new StorageException("Failed to read " + key + ": " + e.getMessage(), e);
    }
  }

  @Override
  public void delete(String key) {
    try {
      boolean deleted = Files.deleteIfExists(resolve(key));
      log.info("storage.delete key={} existed={}", StorageKeys.logKey(key), deleted);
    } catch (IOException e) {
      throw new StorageException("Failed to delete " + key + ": " + e.getMessage(), e);
    }
  }

  @Override
  public Optional<String> publicUrl(String key) {
    if (publicBaseUrl == null || publicBaseUrl.isBlank()) {
      return Optional.empty();
    }
    String base =
        publicBaseUrl.endsWith("/")
            ? publicBaseUrl.substring(0, publicBaseUrl.length() - 1)
            : publicBaseUrl;
    return Optional.of(base + "/" + key);
  }

  @Override
  public boolean isAvailable() {
    return Files.isDirectory(root) && Files.isWritable(root);
  }

  // ------------------ Helpers ------------------

  private void write(String key, byte[] bytes) {
    Path target = resolve(key);
    try {
      Files.createDirectories(target.getParent());
      Path tmp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
      try {
        Files.write(tmp, bytes);
        try {
          Files.move(
              tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
          Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
      } finally {
        Files.deleteIfExists(tmp);
      }
      log.info("storage.save ok key={} size={}", StorageKeys.logKey(key), bytes.length);
    } catch (IOException e) {
      log.error("storage.save error key={} msg={}", key, e.getMessage(), e);
      throw new StorageException("Failed to write " + key + ": " + e.getMessage(), e);
    }
  }

  /** Resolves a key below the root, rejecting anything that escapes it. */
  private Path resolve(String key) {
    if (key == null || key.isBlank() || key.indexOf('\0') >= 0) {
      throw new StorageNotFoundException(String.valueOf(key));
    }
    Path path = root.resolve(key).normalize();
    if (!path.startsWith(root) || path.equals(root)) {
      throw new StorageNotFoundException(key);
    }
    return path;
  }
}
