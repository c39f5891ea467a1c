package com.cario.insight.app.storage;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.cario.insight.app.exception.StorageNotFoundException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalFileImageStorageTest {

  @TempDir Path root;

  @Test
  void saveThenFetchReturnsSameBytes() {
    LocalFileImageStorage storage = new LocalFileImageStorage(root, null);
    byte[] bytes = "png-bytes".getBytes(StandardCharsets.UTF_8);

    String key = storage.save(bytes, "photo.png");

    assertTrue(key.startsWith("images/") && key.endsWith(".png"), key);
    assertArrayEquals(bytes, storage.fetch(key));
    assertTrue(Files.exists(root.resolve(key)));
  }

  @Test
  void missingKeyIsNotFound() {
    LocalFileImageStorage storage = new LocalFileImageStorage(root, null);

    assertThrows(StorageNotFoundException.class, () -> storage.fetch("images/missing.png"));
  }

  @Test
  void keysCannotEscapeTheRoot() {
    LocalFileImageStorage storage = new LocalFileImageStorage(root.resolve("store"), null);

    assertThrows(StorageNotFoundException.class, () -> storage.fetch("../outside.png"));
    assertThrows(StorageNotFoundException.class, () -> storage.fetch(""));
  }

  @Test
  void saveAsOverwritesAndDeleteRemoves() {
    LocalFileImageStorage storage = new LocalFileImageStorage(root, null);
    storage.saveAs("images/a_annotated.png", new byte[] {1}, "image/png");
    storage.saveAs("images/a_annotated.png", new byte[] {2}, "image/png");

    assertArrayEquals(new byte[] {2}, storage.fetch("images/a_annotated.png"));

    storage.delete("images/a_annotated.png");
    assertThrows(
        StorageNotFoundException.class, () -> storage.fetch("images/a_annotated.png"));
  }

  @Test
  void publicUrlOnlyWithBaseUrl() {
    assertEquals(Optional.empty(), new LocalFileImageStorage(root, null).publicUrl("images/a.png"));
    assertEquals(
        Optional.of("http://localhost:8080/uploads/images/a.png"),
        new LocalFileImageStorage(root, "http://localhost:8080/uploads/").publicUrl("images/a.png"));
  }

  @Test
  void noTempFilesRemainAfterSave() throws Exception {
    LocalFileImageStorage storage = new LocalFileImageStorage(root, null);
    String key = storage.save(new byte[] {1, 2, 3}, "a.jpg");

    try (var files = Files.list(root.resolve(key).getParent())) {
      assertFalse(files.anyMatch(p -> p.getFileName().toString().endsWith(".tmp")));
    }
    assertTrue(storage.isAvailable());
  }
}
