package com.csd.reqaudit.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

@Data
@Builder
public class ScanReport {
    private String repoName;
    private String location;
    private int requirementCount;
    private List<Finding> findings;
    private boolean success;
    private String error;
    private Instant scannedAt;

    /**
     * Advisory texts in finding order, each listed once even when several declared
     * constraints hit the same advisory.
     */
    public List<String> advisories() {
        if (findings == null) return List.of();
        return findings.stream()
                .map(Finding::getAdvisory)
                .filter(Objects::nonNull)
                .distinct()
                .collect(Collectors.toList());
    }

    public boolean isVulnerable() {
        return findings != null && !findings.isEmpty();
    }
}
