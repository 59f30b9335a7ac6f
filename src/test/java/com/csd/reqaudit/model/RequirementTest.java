package com.csd.reqaudit.model;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

public class RequirementTest {

    @Test
    void nameIsNormalized() {
        Requirement requirement = Requirement.of("  Django ", Operator.EQ, "1.11.0");
        assertEquals("django", requirement.getName());
        assertEquals("django == 1.11.0", requirement.toString());
    }

    @Test
    void structuralEquality() {
        assertEquals(Requirement.of("flask", Operator.GE, "1.0"), Requirement.of("Flask", Operator.GE, "1.0.0"));
        assertNotEquals(Requirement.of("flask", Operator.GE, "1.0"), Requirement.of("flask", Operator.GT, "1.0"));
    }

    @Test
    void anyVersionIsGreaterThanZero() {
        Requirement any = Requirement.anyVersion("requests");
        assertEquals(Operator.GT, any.getOperator());
        assertEquals(VersionValue.ZERO, any.getVersion());
    }

    @Test
    void operatorSymbols() {
        assertEquals(Operator.LE, Operator.fromSymbol("<="));
        assertEquals(Operator.NE, Operator.fromSymbol(" != "));
        assertThrows(IllegalArgumentException.class, () -> Operator.fromSymbol("~="));
    }
}
