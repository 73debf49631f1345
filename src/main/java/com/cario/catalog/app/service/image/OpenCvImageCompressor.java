package com.cario.catalog.app.service.image;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.log4j.Log4j2;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.core.MatOfInt;
import org.opencv.core.Size;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;

@Log4j2
public class OpenCvImageCompressor implements ImageCompressor {

  public OpenCvImageCompressor() {
    OpenCvSupport.ensureLoaded();
  }

  @Override
  public CompressedImage compress(Path image, int maxDimension, int jpegQuality) {
    long originalSize;
    try {
      originalSize = Files.size(image);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read image " + image, e);
    }

    Mat src = Imgcodecs.imread(image.toString(), Imgcodecs.IMREAD_COLOR);
    Mat resized = new Mat();
    MatOfByte buffer = new MatOfByte();
    try {
      if (src.empty()) {
        throw new IllegalArgumentException("Unable to decode image: " + image);
      }
      Mat target = src;
      double scale =
          Math.min((double) maxDimension / src.cols(), (double) maxDimension / src.rows());
      if (scale < 1.0) {
        int w = Math.max(1, (int) Math.round(src.cols() * scale));
        int h = Math.max(1, (int) Math.round(src.rows() * scale));
        Imgproc.resize(src, resized, new Size(w, h), 0, 0, Imgproc.INTER_AREA);
        target = resized;
      }

      if (!Imgcodecs.imencode(
          ".jpg", target, buffer, new MatOfInt(Imgcodecs.IMWRITE_JPEG_QUALITY, jpegQuality))) {
        throw new IllegalStateException("JPEG encoding failed for " + image);
      }
      byte[] bytes = buffer.toArray();
      log.debug(
          "compress.done image={} {}x{} -> {}x{} bytes={} original={}",
          image.getFileName(),
          src.cols(),
          src.rows(),
          target.cols(),
          target.rows(),
          bytes.length,
          originalSize);
      return CompressedImage.builder()
          .bytes(bytes)
          .mimeType("image/jpeg")
          .width(target.cols())
          .height(target.rows())
          .originalSize(originalSize)
          .build();
    } finally {
      src.release();
      resized.release();
      buffer.release();
    }
  }
}
