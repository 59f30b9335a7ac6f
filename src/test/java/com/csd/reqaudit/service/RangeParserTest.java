package com.csd.reqaudit.service;

import com.csd.reqaudit.exception.CatalogueFormatException;
import com.csd.reqaudit.exception.RequirementParseException;
import com.csd.reqaudit.model.*;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class RangeParserTest {

    private final RangeParser parser = new RangeParser();

    @Test
    void pinnedRequirement() {
        Requirement requirement = parser.parseRequirementLine("Flask==2.0.1");
        assertEquals("flask", requirement.getName());
        assertEquals(Operator.EQ, requirement.getOperator());
        assertEquals(List.of(2L, 0L, 1L), requirement.getVersion().getComponents());
    }

    @Test
    void whitespaceAroundTokens() {
        Requirement requirement = parser.parseRequirementLine("  PyYAML  >=  5.1 ");
        assertEquals(Requirement.of("pyyaml", Operator.GE, "5.1"), requirement);
    }

    @Test
    void bareNameFallsBackToAnyVersion() {
        Requirement requirement = parser.parseRequirementLine("requests");
        assertEquals("requests", requirement.getName());
        assertEquals(Operator.GT, requirement.getOperator());
        assertEquals(VersionValue.ZERO, requirement.getVersion());
    }

    @Test
    void everyOperatorIsRecognised() {
        assertEquals(Operator.NE, parser.parseRequirementLine("a!=1").getOperator());
        assertEquals(Operator.LT, parser.parseRequirementLine("a<1").getOperator());
        assertEquals(Operator.LE, parser.parseRequirementLine("a<=1").getOperator());
        assertEquals(Operator.GT, parser.parseRequirementLine("a>1").getOperator());
        assertEquals(Operator.GE, parser.parseRequirementLine("a>=1").getOperator());
        assertEquals(Operator.EQ, parser.parseRequirementLine("a==1").getOperator());
    }

    @Test
    void blankLineIsRejected() {
        assertThrows(RequirementParseException.class, () -> parser.parseRequirementLine("   "));
    }

    @Test
    void rangedLineYieldsEveryConstraint() {
        List<Requirement> constraints = parser.parseRequirementConstraints("flask>=1.0, <2.0");
        assertEquals(List.of(
                Requirement.of("flask", Operator.GE, "1.0"),
                Requirement.of("flask", Operator.LT, "2.0")), constraints);
        assertEquals(constraints.get(0), parser.parseRequirementLine("flask>=1.0, <2.0"));
    }

    @Test
    void manifestNoiseIsSkipped() {
        List<Requirement> requirements = parser.parseRequirementLines(List.of(
                "# pinned for prod",
                "-r base.txt",
                "Django==1.11.0  # LTS",
                "pywin32==227; sys_platform == 'win32'",
                "   ",
                "requests"));
        assertEquals(List.of(
                Requirement.of("django", Operator.EQ, "1.11.0"),
                Requirement.of("pywin32", Operator.EQ, "227"),
                Requirement.anyVersion("requests")), requirements);
    }

    @Test
    void inlineCommentsAreStrippedWhateverPrecedesThem() {
        List<Requirement> requirements = parser.parseRequirementLines(List.of(
                "requests\t# pin",
                "flask#pin",
                "urllib3==1.26.5\t#security"));
        assertEquals(List.of(
                Requirement.anyVersion("requests"),
                Requirement.anyVersion("flask"),
                Requirement.of("urllib3", Operator.EQ, "1.26.5")), requirements);
    }

    @Test
    void singleBoundSpecGetsNeutralUpper() {
        BoundedRange range = parser.parseSpecString("django", "<1.11.9");
        assertEquals(Requirement.of("django", Operator.LT, "1.11.9"), range.getLower());
        assertEquals(Requirement.anyVersion("django"), range.getUpper());
    }

    @Test
    void twoBoundSpec() {
        BoundedRange range = parser.parseSpecString("django", ">=2.0, <2.0.2");
        assertEquals(Requirement.of("django", Operator.GE, "2.0"), range.getLower());
        assertEquals(Requirement.of("django", Operator.LT, "2.0.2"), range.getUpper());
    }

    @Test
    void parsingIsIdempotent() {
        assertEquals(parser.parseSpecString("x", ">=1.0,<2.0"), parser.parseSpecString("x", ">=1.0,<2.0"));
    }

    @Test
    void malformedSpecsAreRejected() {
        assertThrows(CatalogueFormatException.class, () -> parser.parseSpecString("x", ""));
        assertThrows(CatalogueFormatException.class, () -> parser.parseSpecString("x", "1.0"));
        assertThrows(CatalogueFormatException.class, () -> parser.parseSpecString("x", ">=1.0,"));
        assertThrows(CatalogueFormatException.class, () -> parser.parseSpecString("x", ">1,<2,<3"));
        assertThrows(CatalogueFormatException.class, () -> parser.parseSpecString("x", "~=1.0"));
    }

    @Test
    void catalogueEntryKeepsRangesInOrder() {
        CatalogueEntry entry = CatalogueEntry.builder()
                .advisory("CVE-X")
                .id("pyup.io-1")
                .cve("CVE-2018-0001")
                .specs(List.of("<1.0", ">=2.0,<3.0"))
                .build();
        Optional<VulnerabilityRecord> record = parser.parseCatalogueEntry("Django", entry);
        assertTrue(record.isPresent());
        assertEquals("django", record.get().getName());
        assertEquals("CVE-X", record.get().getAdvisory());
        assertEquals("pyup.io-1", record.get().getAdvisoryId());
        assertEquals(2, record.get().getRanges().size());
        assertEquals(">=2.0,<3.0", record.get().getRanges().get(1).toString());
    }

    @Test
    void malformedEntryIsDroppedButCatalogueSurvives() {
        Map<String, List<CatalogueEntry>> catalogue = new LinkedHashMap<>();
        catalogue.put("django", List.of(
                CatalogueEntry.builder().advisory("bad").specs(List.of("<1.0", "garbage")).build(),
                CatalogueEntry.builder().advisory("good").specs(List.of("<1.11.9")).build()));
        catalogue.put("flask", List.of(CatalogueEntry.builder().advisory("flask-adv").specs(List.of("<0.12.3")).build()));

        List<VulnerabilityRecord> records = parser.parseCatalogue(catalogue);
        assertEquals(2, records.size());
        assertEquals("good", records.get(0).getAdvisory());
        assertEquals("flask-adv", records.get(1).getAdvisory());

        List<VulnerabilityRecord> onlyFlask = parser.parseCatalogue(catalogue, Set.of("flask"));
        assertEquals(1, onlyFlask.size());
        assertEquals("flask", onlyFlask.get(0).getName());
    }
}
