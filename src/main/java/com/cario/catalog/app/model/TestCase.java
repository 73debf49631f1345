package com.cario.catalog.app.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One labeled image of the quality corpus. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TestCase {

  public static final double DEFAULT_MIN_CONFIDENCE = 0.7;
  public static final String DEFAULT_CATEGORY = "general";

  @NotBlank private String id;

  /** Image identifier handed to the image resolver. */
  @NotBlank private String imageReference;

  /** Substrings expected (case-insensitive) in the final text. */
  @NotNull private List<String> expectedTextFragments;

  /** Labels expected (case-insensitive, exact) among the final objects. */
  @NotNull private List<String> expectedObjectLabels;

  @DecimalMin("0.0")
  @DecimalMax("1.0")
  private Double minConfidence;

  private String category;

  private String description;

  /** Copy with {@code minConfidence}, {@code category} and {@code description} defaulted. */
  public TestCase withDefaults() {
    return toBuilder()
        .minConfidence(minConfidence == null ? DEFAULT_MIN_CONFIDENCE : minConfidence)
        .category(category == null || category.isBlank() ? DEFAULT_CATEGORY : category)
        .description(description == null ? "" : description)
        .expectedTextFragments(
            expectedTextFragments == null ? List.of() : List.copyOf(expectedTextFragments))
        .expectedObjectLabels(
            expectedObjectLabels == null ? List.of() : List.copyOf(expectedObjectLabels))
        .build();
  }
}
