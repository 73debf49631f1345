package com.cario.catalog.app.repository;

import com.cario.catalog.app.model.OrchestrationResult;

/** Destination of processed image results, keyed by image identifier. */
public interface ResultSink {

  void save(String imageId, String imageUri, OrchestrationResult result);
}
