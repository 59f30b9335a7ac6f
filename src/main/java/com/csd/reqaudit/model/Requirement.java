package com.csd.reqaudit.model;

import lombok.NonNull;
import lombok.Value;

import java.util.Locale;

/**
 * A single constraint on a package: {@code name operator version}.
 * The name is trimmed and lowercased so it can be joined against catalogue keys.
 */
@Value
public class Requirement {

    @NonNull String name;

    @NonNull Operator operator;

    @NonNull VersionValue version;

    public Requirement(@NonNull String name, @NonNull Operator operator, @NonNull VersionValue version) {
        this.name = normalizeName(name);
        this.operator = operator;
        this.version = version;
    }

    public static Requirement of(String name, Operator operator, String version) {
        return new Requirement(name, operator, VersionValue.parse(version));
    }

    /**
     * The always-satisfied constraint {@code > 0}, used for unpinned packages and
     * for the missing side of a single-bound catalogue spec.
     */
    public static Requirement anyVersion(String name) {
        return new Requirement(name, Operator.GT, VersionValue.ZERO);
    }

    public static String normalizeName(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return name + " " + operator.getSymbol() + " " + version;
    }
}
