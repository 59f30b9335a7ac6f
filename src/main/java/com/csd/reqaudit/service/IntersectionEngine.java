package com.csd.reqaudit.service;

import com.csd.reqaudit.model.BoundedRange;
import com.csd.reqaudit.model.Operator;
import com.csd.reqaudit.model.Requirement;
import com.csd.reqaudit.model.VulnerabilityRecord;
import org.springframework.stereotype.Service;

/**
 * Decides whether a declared requirement can describe a version that also lies inside a
 * catalogue bound, a bounded range, or any range of a vulnerability record.
 * <p>
 * Both sides are directional constraints on the same unknown version {@code v}. A declared
 * {@code ==} pins {@code v} and is checked against the bound directly; two constraints that
 * point the same way always overlap; opposite constraints overlap only when the interval
 * between them is non-empty. Pairings involving {@code !=} on the declared side, or a
 * directional declaration against a {@code ==}/{@code !=} bound, are reported as not
 * consistent.
 */
@Service
public class IntersectionEngine {

    public boolean consistent(Requirement declared, Requirement bound) {
        Operator d = declared.getOperator();
        Operator b = bound.getOperator();
        int cmp = declared.getVersion().compareTo(bound.getVersion());

        if (d == Operator.EQ) {
            switch (b) {
                case GE: return cmp >= 0;
                case GT: return cmp > 0;
                case LE: return cmp <= 0;
                case LT: return cmp < 0;
                case EQ: return cmp == 0;
                case NE: return cmp != 0;
                default: return false;
            }
        }

        if (d == Operator.NE || b == Operator.EQ || b == Operator.NE) {
            return false;
        }

        if (d.isLowerBound() && b.isLowerBound()) {
            return true;
        }
        if (d.isUpperBound() && b.isUpperBound()) {
            return true;
        }

        // opposite directions
        switch (d) {
            case GE:
                return b == Operator.LE ? cmp <= 0 : cmp < 0;
            case GT:
                return cmp < 0;
            case LE:
                return b == Operator.GE ? cmp >= 0 : cmp > 0;
            case LT:
                return cmp > 0;
            default:
                return false;
        }
    }

    public boolean intersectsRange(Requirement declared, BoundedRange range) {
        return consistent(declared, range.getLower()) && consistent(declared, range.getUpper());
    }

    public boolean matchesRecord(Requirement declared, VulnerabilityRecord record) {
        if (!declared.getName().equalsIgnoreCase(record.getName())) {
            return false;
        }
        for (BoundedRange range : record.getRanges()) {
            if (intersectsRange(declared, range)) {
                return true;
            }
        }
        return false;
    }
}
