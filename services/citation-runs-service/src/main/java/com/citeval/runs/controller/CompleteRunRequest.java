package com.citeval.runs.controller;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;

public record CompleteRunRequest(
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    Double overallAccuracy
) {
}
