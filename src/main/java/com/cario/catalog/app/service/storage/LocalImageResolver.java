package com.cario.catalog.app.service.storage;

import com.cario.catalog.app.exception.ImageNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.log4j.Log4j2;

/** Resolves identifiers against a local upload directory, with or without a file extension. */
@Log4j2
public class LocalImageResolver implements ImageResolver {

  static final List<String> EXTENSIONS = List.of("", ".jpg", ".jpeg", ".png", ".webp");

  private final Path baseDir;

  public LocalImageResolver(Path baseDir) {
    this.baseDir = baseDir.toAbsolutePath().normalize();
  }

  @Override
  public ResolvedImage resolve(String imageId) {
    if (imageId == null || imageId.isBlank()) {
      throw new IllegalArgumentException("imageId must not be blank");
    }
    for (String ext : EXTENSIONS) {
      Path candidate = baseDir.resolve(imageId + ext).normalize();
      if (!candidate.startsWith(baseDir)) {
        log.warn("image.resolve.rejected imageId={} reason=outsideBaseDir", imageId);
        throw new IllegalArgumentException("Invalid image id: " + imageId);
      }
      if (Files.isRegularFile(candidate)) {
        log.debug("image.resolve.local imageId={} path={}", imageId, candidate);
        return ResolvedImage.existing(imageId, candidate);
      }
    }
    throw new ImageNotFoundException(imageId);
  }
}
