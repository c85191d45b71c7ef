package com.delta.siteaudit.job.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

public record CreateJobRequest(
    @NotBlank @Size(max = 253) String targetDomain,
    List<@NotBlank @Size(max = 253) String> comparisonDomains,
    @Size(max = 32) String locale,
    @Size(max = 4000) String context
) {
}
