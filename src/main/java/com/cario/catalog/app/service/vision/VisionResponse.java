package com.cario.catalog.app.service.vision;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Data;

/** Wire shape of the model answer. Also the source of the structured-output schema. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class VisionResponse {

  @JsonProperty("extracted_text")
  private String extractedText;

  @JsonProperty("detected_objects")
  private List<String> detectedObjects;

  @JsonProperty("description")
  private String description;

  @JsonProperty("confidence")
  private Double confidence;

  @JsonProperty("text_locations")
  private TextLocations textLocations;

  @JsonProperty("extraction_notes")
  private String extractionNotes;

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class TextLocations {
    @JsonProperty("brand")
    private String brand;

    @JsonProperty("model")
    private String model;

    @JsonProperty("barcode")
    private String barcode;

    @JsonProperty("specifications")
    private String specifications;
  }
}
