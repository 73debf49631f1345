package com.cario.catalog.app.service.pipeline;

import com.cario.catalog.app.model.ExtractionResult;
import com.cario.catalog.app.model.MergedResult;
import com.cario.catalog.app.model.VisionResult;
import java.util.Optional;

/** One reconciliation policy. Implementations are pure functions of their arguments. */
@FunctionalInterface
public interface MergeRule {

  MergedResult merge(Optional<ExtractionResult> bestOcr, VisionResult vision, double threshold);
}
