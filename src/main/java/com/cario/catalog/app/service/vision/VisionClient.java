package com.cario.catalog.app.service.vision;

/**
 * A multimodal chat model that answers one prompt about one image.
 *
 * <p>Failures reaching or using the remote model are reported as {@link
 * com.cario.catalog.app.exception.VisionApiException}.
 */
public interface VisionClient {

  /** @return the raw text content of the model's answer */
  String complete(VisionRequest request);
}
