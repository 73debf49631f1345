package com.cario.catalog.app.service.image;

import lombok.extern.log4j.Log4j2;

/** Loads the bundled OpenCV natives once per JVM. */
@Log4j2
public final class OpenCvSupport {

  private static volatile boolean loaded;

  private OpenCvSupport() {}

  public static void ensureLoaded() {
    if (loaded) {
      return;
    }
    synchronized (OpenCvSupport.class) {
      if (loaded) {
        return;
      }
      try {
        nu.pattern.OpenCV.loadLocally();
        loaded = true;
        log.info("opencv.loaded version={}", org.opencv.core.Core.VERSION);
      } catch (Exception | LinkageError e) {
        throw new IllegalStateException(
            "OpenCV native library could not be loaded: " + e.getMessage(), e);
      }
    }
  }
}
