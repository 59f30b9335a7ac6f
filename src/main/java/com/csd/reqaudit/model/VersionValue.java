package com.csd.reqaudit.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Dotted numeric version, e.g. {@code 1.11.9}.
 * <p>
 * Ordering is component-wise and numeric; the shorter value is padded with zeros,
 * so {@code 1.9 < 1.10} and {@code 1.0} equals {@code 1.0.0}.
 */
public final class VersionValue implements Comparable<VersionValue> {

    public static final VersionValue ZERO = new VersionValue(List.of(0L));

    private static final Pattern DOTTED_NUMERIC = Pattern.compile("\\d+(\\.\\d+)*");

    private final List<Long> components;

    private VersionValue(List<Long> components) {
        this.components = Collections.unmodifiableList(components);
    }

    public static VersionValue parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Version must not be null");
        }
        String trimmed = text.trim();
        if (!DOTTED_NUMERIC.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("Not a dotted numeric version: '" + text + "'");
        }
        List<Long> parts = new ArrayList<>();
        for (String part : trimmed.split("\\.")) {
            try {
                parts.add(Long.parseLong(part));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Version component out of range in '" + text + "'", e);
            }
        }
        return new VersionValue(parts);
    }

    public static VersionValue of(long... parts) {
        if (parts.length == 0) {
            throw new IllegalArgumentException("A version needs at least one component");
        }
        List<Long> list = new ArrayList<>(parts.length);
        for (long part : parts) {
            if (part < 0) {
                throw new IllegalArgumentException("Version components must be non-negative");
            }
            list.add(part);
        }
        return new VersionValue(list);
    }

    public List<Long> getComponents() {
        return components;
    }

    @Override
    public int compareTo(VersionValue other) {
        int length = Math.max(components.size(), other.components.size());
        for (int i = 0; i < length; i++) {
            long a = i < components.size() ? components.get(i) : 0L;
            long b = i < other.components.size() ? other.components.get(i) : 0L;
            if (a != b) {
                return Long.compare(a, b);
            }
        }
        return 0;
    }

    public boolean isBefore(VersionValue other) {
        return compareTo(other) < 0;
    }

    public boolean isAfter(VersionValue other) {
        return compareTo(other) > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VersionValue)) return false;
        return compareTo((VersionValue) o) == 0;
    }

    @Override
    public int hashCode() {
        // trailing zeros do not take part in equality
        int end = components.size();
        while (end > 1 && components.get(end - 1) == 0L) {
            end--;
        }
        return components.subList(0, end).hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < components.size(); i++) {
            if (i > 0) sb.append('.');
            sb.append(components.get(i));
        }
        return sb.toString();
    }
}
