package com.csd.reqaudit.controller;

import com.csd.reqaudit.model.ScanReport;
import com.csd.reqaudit.service.ExportService;
import com.csd.reqaudit.service.VulnerabilityScanService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.Collection;
import java.util.List;

/**
 * REST API for exporting scan findings
 */
@Slf4j
@RestController
@RequestMapping("/api/export")
public class ExportController {

    private final VulnerabilityScanService scanService;
    private final ExportService exportService;

    public ExportController(VulnerabilityScanService scanService, ExportService exportService) {
        this.scanService = scanService;
        this.exportService = exportService;
    }

    /**
     * @param repo repository name; all latest reports when omitted
     */
    @GetMapping(value = "/csv", produces = "text/csv")
    public ResponseEntity<String> exportCsv(@RequestParam(required = false) String repo) {
        log.info("Export CSV request: repo={}", repo);
        String csv = exportService.exportCsv(selectReports(repo));
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"vulnerabilities.csv\"")
                .contentType(MediaType.parseMediaType("text/csv"))
                .body(csv);
    }

    @GetMapping("/xlsx")
    public ResponseEntity<byte[]> exportExcel(@RequestParam(required = false) String repo) throws IOException {
        log.info("Export Excel request: repo={}", repo);
        byte[] data = exportService.exportExcel(selectReports(repo));
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"vulnerabilities.xlsx\"")
                .contentType(MediaType.parseMediaType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet"))
                .body(data);
    }

    private Collection<ScanReport> selectReports(String repo) {
        if (repo == null || repo.isBlank()) {
            return scanService.getLatestReports().values();
        }
        return scanService.latestReport(repo)
                .map(List::of)
                .orElseThrow(() -> new IllegalArgumentException("No scan report for repository: " + repo));
    }
}
