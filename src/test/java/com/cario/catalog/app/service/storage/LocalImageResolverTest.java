package com.cario.catalog.app.service.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.cario.catalog.app.exception.ImageNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalImageResolverTest {

  @TempDir Path dir;

  @Test
  void resolvesExactName() throws IOException {
    Path file = Files.write(dir.resolve("img-1.png"), new byte[] {1});

    try (ResolvedImage img = new LocalImageResolver(dir).resolve("img-1.png")) {
      assertEquals(file.toAbsolutePath().normalize(), img.getPath());
      assertFalse(img.isTemporary());
      assertTrue(img.getUri().startsWith("file:"));
    }
    assertTrue(Files.exists(file), "stored images survive close()");
  }

  @Test
  void triesKnownExtensions() throws IOException {
    Files.write(dir.resolve("img-2.jpeg"), new byte[] {1});

    try (ResolvedImage img = new LocalImageResolver(dir).resolve("img-2")) {
      assertTrue(img.getPath().toString().endsWith("img-2.jpeg"));
    }
  }

  @Test
  void unknownIdIsNotFound() {
    ImageNotFoundException ex =
        assertThrows(
            ImageNotFoundException.class, () -> new LocalImageResolver(dir).resolve("missing"));
    assertEquals("missing", ex.getImageId());
  }

  @Test
  void pathTraversalIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new LocalImageResolver(dir.resolve("uploads")).resolve("../secret"));
  }

  @Test
  void temporaryCopiesAreDeletedOnClose() throws IOException {
    Path tmp = Files.write(dir.resolve("copy.jpg"), new byte[] {1});
    ResolvedImage img = ResolvedImage.temporaryCopy("x", tmp, "s3://bucket/x");
    img.close();
    assertFalse(Files.exists(tmp));
  }
}
