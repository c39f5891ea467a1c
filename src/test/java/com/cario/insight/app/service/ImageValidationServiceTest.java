package com.cario.insight.app.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.cario.insight.app.TestImages;
import com.cario.insight.app.analyzer.ImageDecoder;
import com.cario.insight.app.exception.ValidationException;
import com.cario.insight.app.service.ImageValidationService.ValidatedUpload;
import java.nio.charset.StandardCharsets;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ImageValidationServiceTest {

  private final ImageValidationService service =
      new ImageValidationService(
          16L * 1024 * 1024,
          Set.of("png", "jpg", "jpeg", "gif", "bmp", "webp"),
          new ImageDecoder());

  @Test
  void validPngPasses() {
    byte[] png = TestImages.png(TestImages.solid(12, 8, 0x336699));

    ValidatedUpload upload = service.validate(png, "holiday photo.PNG");

    assertEquals("holiday_photo.PNG", upload.filename());
    assertEquals("png", upload.info().format());
    assertEquals(12, upload.info().width());
    assertEquals(8, upload.info().height());
  }

  @Test
  void emptyPayloadIsRejected() {
    assertThrows(ValidationException.class, () -> service.validate(new byte[0], "a.png"));
    assertThrows(ValidationException.class, () -> service.validate(null, "a.png"));
  }

  @Test
  void oversizedPayloadIsRejectedBeforeDecoding() {
    ImageValidationService small =
        new ImageValidationService(10, Set.of("png"), new ImageDecoder());

    ValidationException e =
        assertThrows(ValidationException.class, () -> small.validate(new byte[11], "a.png"));
    assertTrue(e.getMessage().contains("too large"));
  }

  @Test
  void hugeDimensionsAreRejectedFromTheHeader() {
    byte[] bomb = TestImages.oversizedPng();
    assertTrue(bomb.length < 1024 * 1024);

    ValidationException e =
        assertThrows(ValidationException.class, () -> service.validate(bomb, "tiny.png"));
    assertTrue(e.getMessage().contains("10000x9000"));
  }

  @Test
  void pixelLimitIsConfigurable() {
    ImageValidationService strict =
        new ImageValidationService(1024 * 1024, 100, Set.of("png"), new ImageDecoder());

    assertThrows(
        ValidationException.class,
        () -> strict.validate(TestImages.png(TestImages.solid(11, 10, 0)), "a.png"));
    assertEquals(
        10, strict.validate(TestImages.png(TestImages.solid(10, 10, 0)), "b.png").info().width());
  }

  @Test
  void disallowedExtensionIsRejected() {
    byte[] png = TestImages.png(TestImages.solid(4, 4, 0));

    assertThrows(ValidationException.class, () -> service.validate(png, "script.exe"));
    assertThrows(ValidationException.class, () -> service.validate(png, "noextension"));
  }

  @Test
  void nonImageContentIsRejected() {
    byte[] text = "just some text".getBytes(StandardCharsets.UTF_8);

    assertThrows(ValidationException.class, () -> service.validate(text, "fake.png"));
  }

  @Test
  void detectedFormatMustBeAllowed() {
    ImageValidationService pngOnly =
        new ImageValidationService(1024 * 1024, Set.of("png", "bmp"), new ImageDecoder());
    byte[] gif = TestImages.encode(TestImages.solid(4, 4, 0), "gif");

    assertThrows(ValidationException.class, () -> pngOnly.validate(gif, "renamed.png"));
  }

  @Test
  void sanitizeStripsDirectoriesAndTraversal() {
    assertEquals("passwd", ImageValidationService.sanitizeFilename("../../etc/passwd"));
    assertEquals("evil.png", ImageValidationService.sanitizeFilename("C:\\temp\\evil.png"));
    assertEquals("a_b_c.jpg", ImageValidationService.sanitizeFilename("a b$c.jpg"));
    assertEquals("hidden.png", ImageValidationService.sanitizeFilename(".hidden.png"));
  }

  @Test
  void sanitizeRejectsUnusableNames() {
    assertThrows(ValidationException.class, () -> ImageValidationService.sanitizeFilename(null));
    assertThrows(ValidationException.class, () -> ImageValidationService.sanitizeFilename("  "));
    assertThrows(
        ValidationException.class, () -> ImageValidationService.sanitizeFilename("a\0b.png"));
    assertThrows(ValidationException.class, () -> ImageValidationService.sanitizeFilename(".."));
  }

  @Test
  void sanitizeCapsLengthAndKeepsExtension() {
    String longName = "x".repeat(400) + ".jpeg";

    String cleaned = ImageValidationService.sanitizeFilename(longName);

    assertEquals(ImageValidationService.MAX_FILENAME_LENGTH, cleaned.length());
    assertTrue(cleaned.endsWith(".jpeg"));
  }
}
