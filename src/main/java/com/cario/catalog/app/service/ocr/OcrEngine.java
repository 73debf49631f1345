package com.cario.catalog.app.service.ocr;

import com.cario.catalog.app.model.OcrEngineParams;
import java.nio.file.Path;

/**
 * Raw text recognition over an image file.
 *
 * <p>Implementations throw {@link com.cario.catalog.app.exception.OcrEngineUnavailableException}
 * when the engine cannot run at all (missing native library or language data) and {@link
 * com.cario.catalog.app.exception.OcrProcessingException} for failures specific to the image.
 */
public interface OcrEngine {

  String recognize(Path image, OcrEngineParams params);
}
