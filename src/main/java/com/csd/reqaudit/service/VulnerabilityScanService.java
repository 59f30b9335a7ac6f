package com.csd.reqaudit.service;

import com.csd.reqaudit.exception.CatalogueUnavailableException;
import com.csd.reqaudit.exception.FetchException;
import com.csd.reqaudit.model.Finding;
import com.csd.reqaudit.model.Requirement;
import com.csd.reqaudit.model.ScanReport;
import com.csd.reqaudit.model.VulnerabilityMatch;
import com.csd.reqaudit.model.VulnerabilityRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Slf4j
@Service
public class VulnerabilityScanService {

    private final List<RequirementsSource> sources;
    private final RangeParser rangeParser;
    private final CatalogueService catalogueService;
    private final MatchEngine matchEngine;

    private final Map<String, ScanReport> latestReports = new ConcurrentHashMap<>();

    public VulnerabilityScanService(List<RequirementsSource> sources,
                                    RangeParser rangeParser,
                                    CatalogueService catalogueService,
                                    MatchEngine matchEngine) {
        this.sources = sources;
        this.rangeParser = rangeParser;
        this.catalogueService = catalogueService;
        this.matchEngine = matchEngine;
    }

    public Map<String, ScanReport> getLatestReports() {
        return latestReports;
    }

    public Optional<ScanReport> latestReport(String repoName) {
        return Optional.ofNullable(latestReports.get(repoName));
    }

    /**
     * Scans several repositories concurrently and waits for all of them.
     *
     * @throws CatalogueUnavailableException if no catalogue has been loaded
     */
    public List<ScanReport> scan(List<String> locations) {
        if (!catalogueService.isLoaded()) {
            throw new CatalogueUnavailableException("Load the vulnerability catalogue before scanning");
        }
        List<CompletableFuture<ScanReport>> futures = locations.stream()
                .map(this::scanRepo)
                .collect(Collectors.toList());
        return futures.stream().map(CompletableFuture::join).collect(Collectors.toList());
    }

    public CompletableFuture<ScanReport> scanRepo(String location) {
        return CompletableFuture.supplyAsync(() -> doScan(location));
    }

    /**
     * Matches already-fetched requirement lines against the loaded catalogue.
     */
    public ScanReport scanLines(String repoName, String location, List<String> lines) {
        List<Requirement> declared = rangeParser.parseRequirementLines(lines);
        Set<String> names = declared.stream().map(Requirement::getName).collect(Collectors.toSet());
        List<VulnerabilityRecord> records = catalogueService.recordsFor(names);
        List<VulnerabilityMatch> matches = matchEngine.findVulnerabilities(declared, records);

        return ScanReport.builder()
                .repoName(repoName)
                .location(location)
                .requirementCount(declared.size())
                .findings(matches.stream().map(Finding::from).collect(Collectors.toList()))
                .success(true)
                .scannedAt(Instant.now())
                .build();
    }

    private ScanReport doScan(String location) {
        RequirementsSource source;
        String repoName;
        try {
            Optional<RequirementsSource> supported = sources.stream().filter(s -> s.supports(location)).findFirst();
            if (supported.isEmpty()) {
                log.error("No requirements source supports location: {}", location);
                return failed(location, location, "Unsupported repository location");
            }
            source = supported.get();
            repoName = source.repoName(location);
        } catch (RuntimeException e) {
            log.error("Invalid repository location {}: {}", location, e.getMessage());
            return failed(location, location, "Invalid repository location: " + e.getMessage());
        }
        log.info("=== Starting scan for repository: {} ===", repoName);

        List<String> lines;
        try {
            lines = source.fetchRequirementLines(location);
        } catch (FetchException e) {
            log.error("Failed to fetch requirement files for {}: {}", repoName, e.getMessage());
            return remember(failed(repoName, location, "Fetch error: " + e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Unexpected error reading requirement files for {}", repoName, e);
            return remember(failed(repoName, location, "Fetch error: " + e.getMessage()));
        }

        ScanReport report;
        try {
            report = scanLines(repoName, location, lines);
        } catch (CatalogueUnavailableException e) {
            return remember(failed(repoName, location, e.getMessage()));
        }
        log.info("=== Scan completed for {}: {} requirements, {} findings ===",
                repoName, report.getRequirementCount(), report.getFindings().size());
        return remember(report);
    }

    private ScanReport remember(ScanReport report) {
        latestReports.put(report.getRepoName(), report);
        return report;
    }

    private static ScanReport failed(String repoName, String location, String error) {
        return ScanReport.builder()
                .repoName(repoName)
                .location(location)
                .findings(List.of())
                .success(false)
                .error(error)
                .scannedAt(Instant.now())
                .build();
    }
}
