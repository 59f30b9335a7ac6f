package com.csd.reqaudit.service;

import com.csd.reqaudit.exception.FetchException;

import java.util.ArrayList;
import java.util.List;

/**
 * Retrieves the requirement lines of one repository. One implementation per hosting
 * platform; the matching core never depends on a concrete source.
 */
public interface RequirementsSource {

    /** Whether this source knows how to read the given repository location. */
    boolean supports(String location);

    /**
     * Returns every non-blank line across all files whose name contains
     * {@code requirements}, plus the {@code .txt} files of directories whose name
     * contains {@code requirements}.
     */
    List<String> fetchRequirementLines(String location) throws FetchException;

    /** Display name for the repository; by default the last path segment of the location. */
    default String repoName(String location) {
        String clean = location;
        while (clean.endsWith("/")) {
            clean = clean.substring(0, clean.length() - 1);
        }
        return clean.substring(clean.lastIndexOf('/') + 1);
    }

    static boolean isRequirementsName(String name) {
        return name != null && name.contains("requirements");
    }

    static List<String> toLines(String content) {
        List<String> lines = new ArrayList<>();
        if (content == null) return lines;
        for (String line : content.split("\n")) {
            String stripped = line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
            if (!stripped.isBlank()) {
                lines.add(stripped);
            }
        }
        return lines;
    }
}
