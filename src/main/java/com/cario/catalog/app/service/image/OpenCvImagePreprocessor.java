package com.cario.catalog.app.service.image;

import com.cario.catalog.app.exception.OcrProcessingException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import lombok.extern.log4j.Log4j2;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;

/**
 * OpenCV implementation of {@link ImagePreprocessor}. Works on the grayscale version of the
 * source, which is what the OCR engine consumes anyway.
 */
@Log4j2
public class OpenCvImagePreprocessor implements ImagePreprocessor {

  static final double MIN_SKEW_DEGREES = 0.5;
  private static final double MAX_SKEW_DEGREES = 15.0;
  private static final int MAX_SKEW_LINES = 10;

  private final int upscaleTargetPx;
  private final double maxUpscaleFactor;

  public OpenCvImagePreprocessor(int upscaleTargetPx, double maxUpscaleFactor) {
    if (upscaleTargetPx <= 0 || maxUpscaleFactor < 1.0) {
      throw new IllegalArgumentException(
          "upscaleTargetPx must be > 0 and maxUpscaleFactor >= 1, got "
              + upscaleTargetPx
              + "/"
              + maxUpscaleFactor);
    }
    this.upscaleTargetPx = upscaleTargetPx;
    this.maxUpscaleFactor = maxUpscaleFactor;
    OpenCvSupport.ensureLoaded();
  }

  @Override
  public PreprocessedImage apply(Path image, List<String> steps) {
    Mat current = Imgcodecs.imread(image.toString(), Imgcodecs.IMREAD_GRAYSCALE);
    if (current.empty()) {
      throw new OcrProcessingException("Unable to decode image: " + image);
    }

    List<String> applied = new ArrayList<>();
    List<String> notes = new ArrayList<>();
    try {
      for (String name : steps) {
        Optional<PreprocessStep> step = PreprocessStep.fromName(name);
        if (step.isEmpty()) {
          log.warn("preprocess.unknownStep step={} image={}", name, image.getFileName());
          continue;
        }
        StepOutcome outcome = run(step.get(), current);
        if (outcome.image != current) {
          current.release();
          current = outcome.image;
        }
        applied.add(step.get().getStepName());
        notes.add(step.get().getStepName() + ": " + outcome.note);
      }

      Path out = Files.createTempFile("ocr-preprocess-", ".png");
      if (!Imgcodecs.imwrite(out.toString(), current)) {
        Files.deleteIfExists(out);
        throw new OcrProcessingException("Unable to write preprocessed image for " + image);
      }
      log.debug("preprocess.done image={} steps={} out={}", image.getFileName(), applied, out);
      return PreprocessedImage.builder().path(out).appliedSteps(applied).notes(notes).build();
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to create preprocessing temp file", e);
    } finally {
      current.release();
    }
  }

  private StepOutcome run(PreprocessStep step, Mat src) {
    switch (step) {
      case ENHANCE_CONTRAST:
        {
          Mat dst = new Mat();
          Core.normalize(src, dst, 0, 255, Core.NORM_MINMAX);
          return new StepOutcome(dst, "normalized to 0-255");
        }
      case DENOISE:
        {
          Mat dst = new Mat();
          Imgproc.medianBlur(src, dst, 3);
          return new StepOutcome(dst, "median filter k=3");
        }
      case SHARPEN:
        return new StepOutcome(sharpen(src), "unsharp mask");
      case UPSCALE:
        return upscale(src);
      case DESKEW:
        return deskew(src);
      default:
        throw new IllegalStateException("Unhandled step " + step);
    }
  }

  private static Mat sharpen(Mat src) {
    Mat blurred = new Mat();
    Mat dst = new Mat();
    try {
      Imgproc.GaussianBlur(src, blurred, new Size(0, 0), 3);
      Core.addWeighted(src, 1.5, blurred, -0.5, 0, dst);
      return dst;
    } finally {
      blurred.release();
    }
  }

  private StepOutcome upscale(Mat src) {
    int longest = Math.max(src.cols(), src.rows());
    if (longest >= upscaleTargetPx) {
      return new StepOutcome(src, "already " + longest + "px, unchanged");
    }
    double factor = Math.min((double) upscaleTargetPx / longest, maxUpscaleFactor);
    Mat dst = new Mat();
    Imgproc.resize(src, dst, new Size(), factor, factor, Imgproc.INTER_CUBIC);
    return new StepOutcome(dst, String.format(Locale.ROOT, "scaled x%.2f", factor));
  }

  private StepOutcome deskew(Mat src) {
    OptionalDouble angle = estimateSkewAngle(src);
    if (angle.isEmpty() || Math.abs(angle.getAsDouble()) < MIN_SKEW_DEGREES) {
      return new StepOutcome(src, "no reliable skew angle");
    }
    Point center = new Point(src.cols() / 2.0, src.rows() / 2.0);
    Mat rotation = Imgproc.getRotationMatrix2D(center, angle.getAsDouble(), 1.0);
    Mat dst = new Mat();
    try {
      Imgproc.warpAffine(
          src,
          dst,
          rotation,
          src.size(),
          Imgproc.INTER_CUBIC,
          Core.BORDER_REPLICATE,
          Scalar.all(255));
    } finally {
      rotation.release();
    }
    return new StepOutcome(
        dst, String.format(Locale.ROOT, "rotated by %.2f degrees", angle.getAsDouble()));
  }

  /** Mean angle of the strongest near-horizontal Hough lines, empty when none qualify. */
  static OptionalDouble estimateSkewAngle(Mat gray) {
    Mat edges = new Mat();
    Mat lines = new Mat();
    try {
      Imgproc.Canny(gray, edges, 50, 150, 3, false);
      Imgproc.HoughLines(edges, lines, 1, Math.PI / 180, 150);

      double sum = 0;
      int count = 0;
      for (int i = 0; i < Math.min(MAX_SKEW_LINES, lines.rows()); i++) {
        double theta = lines.get(i, 0)[1];
        double angle = Math.toDegrees(theta) - 90;
        if (Math.abs(angle) < MAX_SKEW_DEGREES) {
          sum += angle;
          count++;
        }
      }
      return count == 0 ? OptionalDouble.empty() : OptionalDouble.of(sum / count);
    } finally {
      edges.release();
      lines.release();
    }
  }

  private static final class StepOutcome {
    private final Mat image;
    private final String note;

    private StepOutcome(Mat image, String note) {
      this.image = image;
      this.note = note;
    }
  }
}
