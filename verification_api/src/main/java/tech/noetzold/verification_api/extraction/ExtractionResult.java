package tech.noetzold.verification_api.extraction;

import tech.noetzold.verification_api.model.Assignment;

import java.util.List;

public record ExtractionResult(Assignment assignment, List<ExtractionWarning> warnings) {

    public ExtractionResult {
        warnings = List.copyOf(warnings);
    }
}
