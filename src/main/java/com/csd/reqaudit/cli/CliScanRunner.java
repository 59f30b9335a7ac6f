package com.csd.reqaudit.cli;

import com.csd.reqaudit.exception.FetchException;
import com.csd.reqaudit.model.ScanReport;
import com.csd.reqaudit.service.CatalogueService;
import com.csd.reqaudit.service.ScanReportFormatter;
import com.csd.reqaudit.service.VulnerabilityScanService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;

/**
 * One-shot scan from the command line:
 * {@code --reqaudit.cli.repo=https://github.com/PyGithub/PyGithub}.
 * Prints every distinct advisory; the exit code is 1 when something was found and 2 when
 * the scan failed. Run with {@code --spring.main.web-application-type=none}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "reqaudit.cli.repo")
public class CliScanRunner implements CommandLineRunner, ExitCodeGenerator {

    private final CatalogueService catalogueService;
    private final VulnerabilityScanService scanService;
    private final ScanReportFormatter formatter;
    private final String repo;
    private final PrintStream out;

    private int exitCode;

    public CliScanRunner(CatalogueService catalogueService,
                         VulnerabilityScanService scanService,
                         ScanReportFormatter formatter,
                         @Value("${reqaudit.cli.repo}") String repo) {
        this(catalogueService, scanService, formatter, repo, System.out);
    }

    CliScanRunner(CatalogueService catalogueService,
                  VulnerabilityScanService scanService,
                  ScanReportFormatter formatter,
                  String repo,
                  PrintStream out) {
        this.catalogueService = catalogueService;
        this.scanService = scanService;
        this.formatter = formatter;
        this.repo = repo;
        this.out = out;
    }

    @Override
    public void run(String... args) throws Exception {
        if (!catalogueService.isLoaded()) {
            try {
                catalogueService.refresh();
            } catch (FetchException e) {
                log.error("Could not load the vulnerability catalogue: {}", e.getMessage());
                exitCode = 2;
                return;
            }
        }
        List<ScanReport> reports = scanService.scan(List.of(repo));
        ScanReport report = reports.get(0);
        if (!report.isSuccess()) {
            log.error("Scan of {} failed: {}", repo, report.getError());
            exitCode = 2;
            return;
        }
        out.print(formatter.formatAdvisories(report));
        exitCode = report.isVulnerable() ? 1 : 0;
        log.info("{} advisories reported for {}", report.advisories().size(), report.getRepoName());
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
