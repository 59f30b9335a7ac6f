package com.csd.reqaudit.service;

import com.csd.reqaudit.model.Finding;
import com.csd.reqaudit.model.ScanReport;
import org.springframework.stereotype.Service;

/**
 * Plain-text rendering of scan reports for the console and the text endpoint.
 */
@Service
public class ScanReportFormatter {

    public String formatReport(ScanReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("Repository: ").append(report.getRepoName()).append("\n");
        if (!report.isSuccess()) {
            sb.append("Scan failed: ").append(report.getError()).append("\n");
            return sb.toString();
        }
        sb.append(String.format("Requirements checked: %d, findings: %d\n\n",
                report.getRequirementCount(), report.getFindings().size()));

        if (report.getFindings().isEmpty()) {
            sb.append("No known vulnerabilities found.\n");
            return sb.toString();
        }

        sb.append(String.format("%-25s | %-25s | %-16s | %s\n", "Package", "Declared", "CVE", "Affected"));
        sb.append("-".repeat(100)).append("\n");
        for (Finding finding : report.getFindings()) {
            sb.append(String.format("%-25s | %-25s | %-16s | %s\n",
                    truncate(finding.getPackageName(), 25),
                    truncate(finding.getDeclared(), 25),
                    finding.getCve() != null ? finding.getCve() : "-",
                    String.join(" or ", finding.getAffectedRanges())));
        }
        sb.append("\n");
        sb.append(formatAdvisories(report));
        return sb.toString();
    }

    /**
     * Each distinct advisory followed by a blank line.
     */
    public String formatAdvisories(ScanReport report) {
        StringBuilder sb = new StringBuilder();
        for (String advisory : report.advisories()) {
            sb.append(advisory.strip()).append("\n\n");
        }
        return sb.toString();
    }

    private String truncate(String text, int maxLength) {
        if (text == null) return "";
        if (text.length() <= maxLength) return text;
        return text.substring(0, maxLength - 3) + "...";
    }
}
