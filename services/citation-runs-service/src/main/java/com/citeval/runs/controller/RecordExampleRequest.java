package com.citeval.runs.controller;

import com.citeval.runs.domain.CitationTally;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.util.Map;

public record RecordExampleRequest(
    @NotNull
    @Min(0)
    Integer citations,

    @NotNull
    @Min(0)
    Integer valid,

    @NotNull
    @Min(0)
    Integer misused,

    @NotNull
    @Min(0)
    Integer hallucinated,

    Map<String, Object> result
) {
    public CitationTally toTally() {
        return new CitationTally(citations, valid, misused, hallucinated);
    }
}
