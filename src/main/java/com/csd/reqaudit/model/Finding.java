package com.csd.reqaudit.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.stream.Collectors;

@Data
@Builder
public class Finding {
    private String packageName;
    private String declared; // e.g. "django == 1.11.0"
    private String advisory;
    private String advisoryId;
    private String cve;
    private List<String> affectedRanges;

    public static Finding from(VulnerabilityMatch match) {
        VulnerabilityRecord record = match.getRecord();
        return Finding.builder()
                .packageName(record.getName())
                .declared(match.getDeclared().toString())
                .advisory(record.getAdvisory())
                .advisoryId(record.getAdvisoryId())
                .cve(record.getCve())
                .affectedRanges(record.getRanges().stream().map(BoundedRange::toString).collect(Collectors.toList()))
                .build();
    }
}
