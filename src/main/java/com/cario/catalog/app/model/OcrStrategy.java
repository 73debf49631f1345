package com.cario.catalog.app.model;

import java.util.List;
import lombok.Builder;
import lombok.Value;

/** A named (preprocessing, engine parameter) combination tuned for one kind of source text. */
@Value
@Builder
public class OcrStrategy {
  String name;
  OcrEngineParams params;
  List<String> preprocessingSteps;
  String description;
}
