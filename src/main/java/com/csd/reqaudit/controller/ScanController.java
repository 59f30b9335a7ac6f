package com.csd.reqaudit.controller;

import com.csd.reqaudit.model.BoundedRange;
import com.csd.reqaudit.model.Requirement;
import com.csd.reqaudit.model.ScanReport;
import com.csd.reqaudit.service.IntersectionEngine;
import com.csd.reqaudit.service.RangeParser;
import com.csd.reqaudit.service.ScanReportFormatter;
import com.csd.reqaudit.service.VulnerabilityScanService;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Slf4j
public class ScanController {

    private final VulnerabilityScanService scanService;
    private final ScanReportFormatter formatter;
    private final RangeParser rangeParser;
    private final IntersectionEngine intersectionEngine;

    public ScanController(VulnerabilityScanService scanService,
                          ScanReportFormatter formatter,
                          RangeParser rangeParser,
                          IntersectionEngine intersectionEngine) {
        this.scanService = scanService;
        this.formatter = formatter;
        this.rangeParser = rangeParser;
        this.intersectionEngine = intersectionEngine;
    }

    @PostMapping("/scan")
    public ResponseEntity<?> scan(@RequestBody ScanRequest request) {
        if (request.getRepos() == null || request.getRepos().isEmpty()) {
            throw new IllegalArgumentException("At least one repository is required");
        }
        log.info("Scan request for {} repositories", request.getRepos().size());
        List<ScanReport> results = scanService.scan(request.getRepos());
        Map<String, Integer> summary = new LinkedHashMap<>();
        for (ScanReport report : results) {
            summary.put(report.getRepoName(), report.isSuccess() ? report.getFindings().size() : -1);
        }
        return ResponseEntity.ok(Map.of("results", results, "summary", summary));
    }

    @GetMapping("/reports")
    public Map<String, ScanReport> reports() {
        return scanService.getLatestReports();
    }

    @GetMapping(value = "/report/{repo}/text", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> reportText(@PathVariable String repo) {
        return scanService.latestReport(repo)
                .map(report -> ResponseEntity.ok(formatter.formatReport(report)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /** GitHub reports are keyed {@code owner/repo}. */
    @GetMapping(value = "/report/{owner}/{repo}/text", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> reportText(@PathVariable String owner, @PathVariable String repo) {
        return reportText(owner + "/" + repo);
    }

    /**
     * Checks one requirement line against one catalogue spec, without touching the catalogue.
     */
    @GetMapping("/check")
    public Map<String, Object> check(@RequestParam String line, @RequestParam String spec) {
        Requirement declared = rangeParser.parseRequirementLine(line);
        BoundedRange range = rangeParser.parseSpecString(declared.getName(), spec);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("requirement", declared.toString());
        result.put("range", range.toString());
        result.put("intersects", intersectionEngine.intersectsRange(declared, range));
        return result;
    }

    @Data
    public static class ScanRequest {
        private List<String> repos;
    }
}
