package com.csd.reqaudit.model;

import lombok.NonNull;
import lombok.Value;

/**
 * One contiguous vulnerable interval: both bounds must hold at once.
 */
@Value
public class BoundedRange {

    @NonNull Requirement lower;

    @NonNull Requirement upper;

    public static BoundedRange of(Requirement lower, Requirement upper) {
        return new BoundedRange(lower, upper);
    }

    /** Single-sided range; the other side is the neutral {@code > 0} bound. */
    public static BoundedRange single(Requirement bound) {
        return new BoundedRange(bound, Requirement.anyVersion(bound.getName()));
    }

    @Override
    public String toString() {
        return lower.getOperator().getSymbol() + lower.getVersion()
                + "," + upper.getOperator().getSymbol() + upper.getVersion();
    }
}
