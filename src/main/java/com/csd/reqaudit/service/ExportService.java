package com.csd.reqaudit.service;

import com.csd.reqaudit.model.Finding;
import com.csd.reqaudit.model.ScanReport;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Service to export scan findings as CSV or Excel
 */
@Slf4j
@Service
public class ExportService {

    private static final String[] HEADERS = {"Repository", "Package", "Declared", "Advisory ID", "CVE", "Affected", "Advisory"};

    public String exportCsv(Collection<ScanReport> reports) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.join(",", HEADERS)).append("\n");
        for (ScanReport report : reports) {
            for (Finding finding : report.getFindings()) {
                sb.append(escapeCsv(report.getRepoName())).append(",");
                sb.append(escapeCsv(finding.getPackageName())).append(",");
                sb.append(escapeCsv(finding.getDeclared())).append(",");
                sb.append(escapeCsv(finding.getAdvisoryId())).append(",");
                sb.append(escapeCsv(finding.getCve())).append(",");
                sb.append(escapeCsv(String.join(" | ", finding.getAffectedRanges()))).append(",");
                sb.append(escapeCsv(finding.getAdvisory())).append("\n");
            }
        }
        return sb.toString();
    }

    /**
     * One sheet per repository.
     */
    public byte[] exportExcel(Collection<ScanReport> reports) throws IOException {
        try (Workbook workbook = new XSSFWorkbook()) {
            CellStyle headerStyle = workbook.createCellStyle();
            Font headerFont = workbook.createFont();
            headerFont.setBold(true);
            headerStyle.setFont(headerFont);

            Set<String> usedNames = new HashSet<>();
            for (ScanReport report : reports) {
                Sheet sheet = workbook.createSheet(uniqueSheetName(sanitizeSheetName(report.getRepoName()), usedNames));

                Row headerRow = sheet.createRow(0);
                for (int i = 1; i < HEADERS.length; i++) {
                    Cell cell = headerRow.createCell(i - 1);
                    cell.setCellValue(HEADERS[i]);
                    cell.setCellStyle(headerStyle);
                }

                int rowNum = 1;
                for (Finding finding : report.getFindings()) {
                    Row row = sheet.createRow(rowNum++);
                    row.createCell(0).setCellValue(finding.getPackageName());
                    row.createCell(1).setCellValue(finding.getDeclared());
                    row.createCell(2).setCellValue(nullToEmpty(finding.getAdvisoryId()));
                    row.createCell(3).setCellValue(nullToEmpty(finding.getCve()));
                    row.createCell(4).setCellValue(String.join(" | ", finding.getAffectedRanges()));
                    row.createCell(5).setCellValue(finding.getAdvisory());
                }

                // fixed widths, autoSizeColumn needs AWT fonts on the host
                for (int i = 0; i < HEADERS.length - 1; i++) {
                    sheet.setColumnWidth(i, (i == HEADERS.length - 2 ? 80 : 24) * 256);
                }
            }

            ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
            workbook.write(outputStream);
            log.debug("Exported {} reports to xlsx ({} bytes)", reports.size(), outputStream.size());
            return outputStream.toByteArray();
        }
    }

    private String escapeCsv(String value) {
        if (value == null) return "";
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    // sheet names are compared case-insensitively by Excel
    private static String uniqueSheetName(String name, Set<String> usedNames) {
        String candidate = name;
        for (int n = 2; !usedNames.add(candidate.toLowerCase(Locale.ROOT)); n++) {
            String suffix = "~" + n;
            candidate = name.substring(0, Math.min(name.length(), 31 - suffix.length())) + suffix;
        }
        return candidate;
    }

    private String sanitizeSheetName(String name) {
        // Excel sheet names can't contain: \ / ? * [ ] :
        String sanitized = name == null || name.isBlank() ? "report" : name.replaceAll("[\\\\/:*?\\[\\]]", "_");
        if (sanitized.length() > 31) {
            sanitized = sanitized.substring(0, 31);
        }
        return sanitized;
    }
}
