/*
 * PDF-Preflight - Print-Readiness Analysis for PDF Documents
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.preflight.ui;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import net.boyechko.pdf.preflight.document.Format;
import net.boyechko.pdf.preflight.document.PaperSizes;
import net.boyechko.pdf.preflight.issue.IssueCategory;
import net.boyechko.pdf.preflight.issue.IssueList;
import net.boyechko.pdf.preflight.issue.IssueType;
import net.boyechko.pdf.preflight.issue.PreflightIssue;
import net.boyechko.pdf.preflight.report.FontInfo;
import net.boyechko.pdf.preflight.report.PageInfo;
import net.boyechko.pdf.preflight.report.PreflightReport;

/**
 * Generates a plain-text print-readiness report. The output depends only on the report, so the
 * same document always produces the same text.
 */
public final class PreflightReportWriter {
    static final String READY = "READY FOR PRINT";
    static final String NOT_READY = "NOT READY FOR PRINT";

    private final PaperSizes paperSizes;

    public PreflightReportWriter(PaperSizes paperSizes) {
        this.paperSizes = paperSizes;
    }

    /** Writes the report to the given path, creating parent directories as needed. */
    public void write(PreflightReport report, Path reportPath) throws IOException {
        Path reportParent = reportPath.getParent();
        if (reportParent != null) {
            Files.createDirectories(reportParent);
        }
        try (PrintWriter out =
                new PrintWriter(Files.newBufferedWriter(reportPath, StandardCharsets.UTF_8))) {
            write(report, out);
        }
    }

    public String toText(PreflightReport report) {
        StringWriter buffer = new StringWriter();
        try (PrintWriter out = new PrintWriter(buffer)) {
            write(report, out);
        }
        return buffer.toString();
    }

    public void write(PreflightReport report, PrintWriter out) {
        writeHeader(out, report);
        writeSummary(out, report);
        writePages(out, report.pages());
        writeFonts(out, report.fonts());

        if (report.issues().isEmpty()) {
            out.println("No print-readiness issues were detected.");
        } else {
            IssueList issues = report.issueList();
            for (IssueCategory category : IssueCategory.values()) {
                IssueList inCategory = issues.ofCategory(category);
                if (!inCategory.isEmpty()) {
                    writeSection(out, category.heading(), inCategory);
                }
            }
        }
        out.flush();
    }

    private void writeHeader(PrintWriter out, PreflightReport report) {
        out.println("PDF Preflight Report");
        out.println("====================");
        out.println("File:      " + report.fileName() + " (" + Format.size(report.fileSize()) + ")");
        out.println("Version:   PDF " + report.version());
        out.println("Pages:     " + report.pageCount());
        out.println("Encrypted: " + (report.encrypted() ? "yes" : "no"));
        out.println();
    }

    private void writeSummary(PrintWriter out, PreflightReport report) {
        out.println("Summary");
        out.println("-------");
        out.println("Verdict:   " + (report.isReady() ? READY : NOT_READY));
        out.println("Errors:    " + report.errorCount());
        out.println("Warnings:  " + report.warningCount());
        out.println("Info:      " + report.infoCount());
        out.println();
    }

    private void writePages(PrintWriter out, List<PageInfo> pages) {
        if (pages.isEmpty()) {
            return;
        }
        out.println("Pages");
        out.println("-----");
        for (PageInfo page : pages) {
            StringBuilder line = new StringBuilder();
            line.append("  ").append(Format.page(page.pageNumber())).append("  ");
            line.append(Format.dimensions(page.mediaBox()));
            paperSizes.nameFor(page.width(), page.height()).ifPresent(n -> line.append(" ").append(n));
            line.append("  trim: ").append(page.trim().map(Format::dimensions).orElse("none"));
            line.append("  bleed: ").append(page.bleed().map(Format::dimensions).orElse("none"));
            out.println(line);
        }
        out.println();
    }

    private void writeFonts(PrintWriter out, List<FontInfo> fonts) {
        if (fonts.isEmpty()) {
            return;
        }
        out.println("Fonts");
        out.println("-----");
        for (FontInfo font : fonts) {
            out.println(
                    "  "
                            + font.name()
                            + " ("
                            + font.subtype()
                            + ") "
                            + (font.embedded() ? "embedded" : "NOT EMBEDDED"));
        }
        out.println();
    }

    /** Writes one category, grouping its issues by type in order of first appearance. */
    private void writeSection(PrintWriter out, String heading, IssueList issues) {
        out.println(heading);
        out.println("-".repeat(heading.length()));

        Map<IssueType, List<PreflightIssue>> grouped =
                issues.stream()
                        .collect(
                                Collectors.groupingBy(
                                        PreflightIssue::type,
                                        LinkedHashMap::new,
                                        Collectors.toList()));

        for (var entry : grouped.entrySet()) {
            List<PreflightIssue> group = entry.getValue();
            out.println(group.size() + " " + entry.getKey().groupLabel());
            for (PreflightIssue issue : group) {
                out.println(
                        "  - ["
                                + issue.severity().label()
                                + "] "
                                + issue.message()
                                + Format.loc(issue));
                if (issue.details() != null) {
                    out.println("      " + issue.details());
                }
            }
        }
        out.println();
    }
}
