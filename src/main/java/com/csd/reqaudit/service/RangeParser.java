package com.csd.reqaudit.service;

import com.csd.reqaudit.exception.CatalogueFormatException;
import com.csd.reqaudit.exception.RequirementParseException;
import com.csd.reqaudit.model.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns manifest lines and catalogue spec strings into {@link Requirement}s and
 * {@link BoundedRange}s. Stateless; one instance may be shared between threads.
 */
@Slf4j
@Service
public class RangeParser {

    private static final String OPERATOR = "(==|!=|<=|>=|<|>)";
    private static final String VERSION = "(\\d+(?:\\.\\d+)*)";

    // name, operator, version; anything after the version is looked at separately
    private static final Pattern LIB_STRING_PATTERN = Pattern.compile("(.+?)\\s*" + OPERATOR + "\\s*" + VERSION);
    private static final Pattern EXTRA_CONSTRAINT_PATTERN = Pattern.compile("\\s*,\\s*" + OPERATOR + "\\s*" + VERSION);
    private static final Pattern SPEC_PATTERN = Pattern.compile("\\s*" + OPERATOR + "\\s*" + VERSION);

    /**
     * Parses one manifest line into its first constraint. A line without an operator and
     * version is a bare package name and yields {@code name > 0}.
     *
     * @throws RequirementParseException if the line is blank
     */
    public Requirement parseRequirementLine(String line) {
        return parseRequirementConstraints(line).get(0);
    }

    /**
     * Parses one manifest line into every constraint it declares, so
     * {@code flask>=1.0,<2.0} gives two requirements on {@code flask}.
     */
    public List<Requirement> parseRequirementConstraints(String line) {
        String trimmed = line == null ? "" : line.trim();
        if (trimmed.isEmpty()) {
            throw new RequirementParseException(line, "Empty requirement line");
        }

        Matcher m = LIB_STRING_PATTERN.matcher(trimmed);
        if (!m.lookingAt()) {
            return List.of(Requirement.anyVersion(trimmed));
        }

        String name = m.group(1).trim();
        if (name.isEmpty()) {
            throw new RequirementParseException(line, "Requirement has no package name: '" + line + "'");
        }

        List<Requirement> constraints = new ArrayList<>();
        constraints.add(toRequirement(line, name, m.group(2), m.group(3)));

        Matcher extra = EXTRA_CONSTRAINT_PATTERN.matcher(trimmed);
        extra.region(m.end(), trimmed.length());
        while (extra.lookingAt()) {
            constraints.add(toRequirement(line, name, extra.group(1), extra.group(2)));
            extra.region(extra.end(), trimmed.length());
        }
        return constraints;
    }

    /**
     * Parses all lines of one or more manifests. Comments, pip options and environment
     * markers are stripped; lines that do not parse are skipped.
     */
    public List<Requirement> parseRequirementLines(List<String> lines) {
        List<Requirement> requirements = new ArrayList<>();
        for (String raw : lines) {
            String line = stripManifestNoise(raw);
            if (line.isEmpty()) {
                continue;
            }
            try {
                requirements.addAll(parseRequirementConstraints(line));
            } catch (RequirementParseException | IllegalArgumentException e) {
                log.debug("Skipping requirement line '{}': {}", raw, e.getMessage());
            }
        }
        return requirements;
    }

    /**
     * Parses a catalogue spec such as {@code >=1.0,<2.0}. The first sub-spec is the lower
     * bound, the second the upper; a single sub-spec is paired with {@code > 0}.
     *
     * @throws CatalogueFormatException if the spec is empty, has more than two sub-specs,
     *                                  or a sub-spec is not {@code <operator><version>}
     */
    public BoundedRange parseSpecString(String name, String spec) {
        if (spec == null || spec.isBlank()) {
            throw new CatalogueFormatException(spec, "Empty vulnerability spec for " + name);
        }
        String[] parts = spec.split(",", -1);
        if (parts.length > 2) {
            throw new CatalogueFormatException(spec, "Spec '" + spec + "' has more than two bounds");
        }
        Requirement lower = parseBound(name, spec, parts[0]);
        if (parts.length == 1) {
            return BoundedRange.single(lower);
        }
        return BoundedRange.of(lower, parseBound(name, spec, parts[1]));
    }

    /**
     * Converts one catalogue advisory. Any unparseable spec drops the whole advisory.
     */
    public Optional<VulnerabilityRecord> parseCatalogueEntry(String name, CatalogueEntry entry) {
        if (entry == null || entry.getAdvisory() == null) {
            log.warn("Dropping advisory for {}: missing advisory text", name);
            return Optional.empty();
        }
        List<String> specs = entry.getSpecs() == null ? List.of() : entry.getSpecs();
        try {
            VulnerabilityRecord.VulnerabilityRecordBuilder builder = VulnerabilityRecord.builder()
                    .name(Requirement.normalizeName(name))
                    .advisory(entry.getAdvisory())
                    .advisoryId(entry.getId())
                    .cve(entry.getCve());
            for (String spec : specs) {
                builder.range(parseSpecString(name, spec));
            }
            return Optional.of(builder.build());
        } catch (CatalogueFormatException e) {
            log.warn("Dropping advisory {} for {}: {}", entry.getId(), name, e.getMessage());
            return Optional.empty();
        }
    }

    public List<VulnerabilityRecord> parseCatalogue(Map<String, List<CatalogueEntry>> catalogue) {
        return parseCatalogue(catalogue, null);
    }

    /**
     * Converts the catalogue, optionally restricted to the given (lowercase) package names.
     * Order follows the catalogue's iteration order, then entry order.
     */
    public List<VulnerabilityRecord> parseCatalogue(Map<String, List<CatalogueEntry>> catalogue, Set<String> names) {
        List<VulnerabilityRecord> records = new ArrayList<>();
        for (Map.Entry<String, List<CatalogueEntry>> pkg : catalogue.entrySet()) {
            String name = Requirement.normalizeName(pkg.getKey());
            if (names != null && !names.contains(name)) {
                continue;
            }
            if (pkg.getValue() == null) {
                continue;
            }
            for (CatalogueEntry entry : pkg.getValue()) {
                parseCatalogueEntry(name, entry).ifPresent(records::add);
            }
        }
        return records;
    }

    private Requirement parseBound(String name, String spec, String subSpec) {
        Matcher m = SPEC_PATTERN.matcher(subSpec);
        if (!m.lookingAt()) {
            throw new CatalogueFormatException(spec, "Bound '" + subSpec.trim() + "' in spec '" + spec + "' is not <operator><version>");
        }
        try {
            return new Requirement(name, Operator.fromSymbol(m.group(1)), VersionValue.parse(m.group(2)));
        } catch (IllegalArgumentException e) {
            throw new CatalogueFormatException(spec, e.getMessage(), e);
        }
    }

    private static Requirement toRequirement(String line, String name, String operator, String version) {
        try {
            return new Requirement(name, Operator.fromSymbol(operator), VersionValue.parse(version));
        } catch (IllegalArgumentException e) {
            throw new RequirementParseException(line, e.getMessage(), e);
        }
    }

    static String stripManifestNoise(String raw) {
        if (raw == null) return "";
        String line = raw.trim();
        if (line.startsWith("#") || line.startsWith("-")) {
            return "";
        }
        // '#' never appears in a name, version or operator
        int comment = line.indexOf('#');
        if (comment >= 0) {
            line = line.substring(0, comment);
        }
        int marker = line.indexOf(';');
        if (marker >= 0) {
            line = line.substring(0, marker);
        }
        return line.trim();
    }
}
