package com.csd.reqaudit.service;

import com.csd.reqaudit.exception.FetchException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Serves canned requirement lines for {@code stub://name} locations.
 */
class StubRequirementsSource implements RequirementsSource {

    final Map<String, List<String>> manifests = new HashMap<>();

    @Override
    public boolean supports(String location) {
        return location.startsWith("stub://");
    }

    @Override
    public List<String> fetchRequirementLines(String location) throws FetchException {
        List<String> lines = manifests.get(repoName(location));
        if (lines == null) {
            throw new FetchException("GET " + location + " failed with HTTP 404", 404);
        }
        return lines;
    }
}
