package com.csd.reqaudit.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A catalogue advisory for one package. The package is affected when a declared
 * requirement intersects any of the ranges.
 */
@Value
@Builder
public class VulnerabilityRecord {

    @NonNull String name;

    @NonNull String advisory;

    @Singular List<BoundedRange> ranges;

    /** Catalogue identifier, e.g. {@code pyup.io-25713}; may be null. */
    String advisoryId;

    /** May be null when the advisory has no CVE assigned. */
    String cve;

    @Override
    public String toString() {
        return advisory;
    }
}
