package com.cario.insight.app.storage;

import java.time.Duration;
import java.util.Optional;

/**
 * Uniform access to stored images regardless of backing medium.
 *
 * <p>Implementations hold no per-call mutable state: concurrent saves with distinct keys and
 * concurrent reads of existing keys need no coordination.
 */
public interface ImageStorage {

  /**
   * Stores bytes under a freshly generated, collision-free key.
   *
   * @param bytes content to store
   * @param suggestedName client filename; only its extension is used
   * @return the generated key
   */
  String save(byte[] bytes, String suggestedName);

  /** Stores bytes under a caller-chosen key, overwriting any existing object. */
  void saveAs(String key, byte[] bytes, String contentType);

  /**
   * @throws com.cario.insight.app.exception.StorageNotFoundException if the key is absent
   */
  byte[] fetch(String key);

  void delete(String key);

  /**
   * Stable public link to the object, or empty when the backend only grants short-lived signed
   * access. Callers fall back to {@link #fetch(String)} when empty.
   */
  Optional<String> publicUrl(String key);

  /** Short-lived signed GET link; empty for backends without signed access. */
  default Optional<String> signedUrl(String key, Duration ttl) {
    return Optional.empty();
  }

  /** Cheap reachability check used by the health endpoint. */
  boolean isAvailable();
}
