package com.cario.catalog.app.service.vision;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class VisionRequest {
  byte[] imageBytes;
  String mimeType;
  String systemPrompt;
  String userPrompt;
  String model;
  double temperature;
  int maxTokens;

  /** Strict JSON schema for structured output; null asks for free text. */
  Map<String, Object> responseSchema;
}
