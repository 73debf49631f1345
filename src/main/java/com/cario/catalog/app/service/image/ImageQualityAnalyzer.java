package com.cario.catalog.app.service.image;

import com.cario.catalog.app.model.ImageQuality;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

/** Rates whether an image is large enough to read text from. Never throws. */
@Log4j2
public class ImageQualityAnalyzer {

  static final int MIN_WIDTH_PX = 800;
  static final long MIN_FILE_SIZE_BYTES = 100_000L;

  public ImageQuality analyze(Path image) {
    try {
      OpenCvSupport.ensureLoaded();
      long fileSize = Files.size(image);
      Mat mat = Imgcodecs.imread(image.toString(), Imgcodecs.IMREAD_UNCHANGED);
      int width;
      int height;
      try {
        if (mat.empty()) {
          return unknown();
        }
        width = mat.cols();
        height = mat.rows();
      } finally {
        mat.release();
      }
      return rate(width, height, fileSize);
    } catch (Exception e) {
      log.warn("imageQuality.failed image={} msg={}", image, e.getMessage());
      return unknown();
    }
  }

  static ImageQuality rate(int width, int height, long fileSize) {
    List<String> recommendations = new ArrayList<>();
    String quality = "good";
    if (width < MIN_WIDTH_PX) {
      quality = "low";
      recommendations.add(
          "Image resolution is low - consider higher resolution for better text extraction");
    }
    if (fileSize < MIN_FILE_SIZE_BYTES) {
      quality = "good".equals(quality) ? "medium" : "low";
      recommendations.add("Small file size may indicate compression artifacts");
    }
    return ImageQuality.builder()
        .quality(quality)
        .width(width)
        .height(height)
        .fileSize(fileSize)
        .recommendations(recommendations)
        .build();
  }

  private static ImageQuality unknown() {
    return ImageQuality.builder()
        .quality("unknown")
        .recommendations(List.of("Could not analyze image quality"))
        .build();
  }
}
