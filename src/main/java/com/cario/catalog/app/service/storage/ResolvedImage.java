package com.cario.catalog.app.service.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.log4j.Log4j2;

/** A local file for an image identifier. Temporary copies are deleted on {@link #close()}. */
@Log4j2
public final class ResolvedImage implements AutoCloseable {

  private final String imageId;
  private final Path path;
  private final String uri;
  private final boolean temporary;

  private ResolvedImage(String imageId, Path path, String uri, boolean temporary) {
    this.imageId = imageId;
    this.path = path;
    this.uri = uri;
    this.temporary = temporary;
  }

  /** A file owned by the store; closing leaves it in place. */
  public static ResolvedImage existing(String imageId, Path path) {
    return new ResolvedImage(imageId, path, path.toUri().toString(), false);
  }

  /** A copy made for this call only; closing deletes it. */
  public static ResolvedImage temporaryCopy(String imageId, Path path, String uri) {
    return new ResolvedImage(imageId, path, uri, true);
  }

  public String getImageId() {
    return imageId;
  }

  public Path getPath() {
    return path;
  }

  /** Where the image actually lives, e.g. {@code s3://bucket/key} or a {@code file:} URI. */
  public String getUri() {
    return uri;
  }

  public boolean isTemporary() {
    return temporary;
  }

  @Override
  public void close() {
    if (!temporary) {
      return;
    }
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      log.warn("image.cleanup.failed imageId={} path={} msg={}", imageId, path, e.getMessage());
    }
  }
}
