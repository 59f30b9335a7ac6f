package com.csd.reqaudit.service;

import com.csd.reqaudit.model.Requirement;
import com.csd.reqaudit.model.VulnerabilityMatch;
import com.csd.reqaudit.model.VulnerabilityRecord;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Cross-checks declared requirements against vulnerability records.
 */
@Service
public class MatchEngine {

    private final IntersectionEngine intersectionEngine;

    public MatchEngine(IntersectionEngine intersectionEngine) {
        this.intersectionEngine = intersectionEngine;
    }

    /**
     * Emits one pair per (declared requirement, record) that intersect, in the order of the
     * declared requirements and then of the records. Nothing is de-duplicated: a record hit
     * by two constraints of the same package appears twice.
     */
    public List<VulnerabilityMatch> findVulnerabilities(List<Requirement> declaredRequirements,
                                                        List<VulnerabilityRecord> catalogueRecords) {
        Map<String, List<VulnerabilityRecord>> byName = new HashMap<>();
        for (VulnerabilityRecord record : catalogueRecords) {
            byName.computeIfAbsent(Requirement.normalizeName(record.getName()), k -> new ArrayList<>()).add(record);
        }

        List<VulnerabilityMatch> matches = new ArrayList<>();
        for (Requirement declared : declaredRequirements) {
            List<VulnerabilityRecord> candidates = byName.getOrDefault(declared.getName(), List.of());
            for (VulnerabilityRecord record : candidates) {
                if (intersectionEngine.matchesRecord(declared, record)) {
                    matches.add(new VulnerabilityMatch(declared, record));
                }
            }
        }
        return matches;
    }
}
