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
package net.boyechko.pdf.preflight.report;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.stream.Collectors;
import net.boyechko.pdf.preflight.document.FormatVersion;
import net.boyechko.pdf.preflight.issue.IssueSev;
import net.boyechko.pdf.preflight.issue.IssueType;
import net.boyechko.pdf.preflight.issue.PreflightIssue;
import org.junit.jupiter.api.Test;

class ReportAggregatorTest {

    private static StructuralFindings findings(boolean encrypted, int pageCount) {
        List<PageInfo> pages =
                pageCount == 0
                        ? List.of()
                        : List.of(new PageInfo(1, PageBox.US_LETTER, null, null, null));
        return new StructuralFindings(
                "sample.pdf",
                2048,
                FormatVersion.PDF_1_4,
                pageCount,
                encrypted,
                pages,
                List.of(new FontInfo("CustomSans", "TrueType", false)),
                List.of(
                        PreflightIssue.atPage(
                                IssueType.BLEED_BOX_MISSING, IssueSev.WARNING, 1, "No bleed")),
                List.of(
                        PreflightIssue.atPage(
                                IssueType.FONT_NOT_EMBEDDED, IssueSev.ERROR, 1, "Not embedded")),
                List.of(
                        PreflightIssue.atPage(
                                IssueType.TRANSPARENCY_GROUP, IssueSev.INFO, 1, "Group")));
    }

    private static List<IssueType> types(PreflightReport report) {
        return report.issues().stream().map(PreflightIssue::type).collect(Collectors.toList());
    }

    @Test
    void completeReportKeepsPhaseOrder() {
        PreflightReport report =
                ReportAggregator.complete(
                        findings(true, 1),
                        List.of(
                                PreflightIssue.atPage(
                                        IssueType.RGB_COLOUR, IssueSev.WARNING, 1, "RGB")));

        assertEquals(
                List.of(
                        IssueType.BLEED_BOX_MISSING,
                        IssueType.FONT_NOT_EMBEDDED,
                        IssueType.TRANSPARENCY_GROUP,
                        IssueType.RGB_COLOUR,
                        IssueType.DOCUMENT_ENCRYPTED),
                types(report));
        assertEquals("sample.pdf", report.fileName());
        assertEquals(2048, report.fileSize());
        assertEquals(1, report.fonts().size());
        assertFalse(report.isReady());
    }

    @Test
    void structuralReportHasNoContentIssues() {
        PreflightReport report = ReportAggregator.structural(findings(false, 1));

        assertEquals(3, report.issues().size());
        assertTrue(report.issueList().ofType(IssueType.RGB_COLOUR).isEmpty());
    }

    @Test
    void degradedReportEndsWithUnavailableWarning() {
        PreflightReport report = ReportAggregator.degraded(findings(false, 1), "render failed");

        PreflightIssue last = report.issues().get(report.issues().size() - 1);
        assertEquals(IssueType.CONTENT_ANALYSIS_UNAVAILABLE, last.type());
        assertEquals(IssueSev.WARNING, last.severity());
        assertNull(last.page());
        assertEquals(ReportAggregator.CONTENT_UNAVAILABLE_MESSAGE, last.message());
        assertEquals("render failed", last.details());
        assertEquals(
                types(ReportAggregator.structural(findings(false, 1))),
                types(report).subList(0, report.issues().size() - 1),
                "Degraded report is the structural report plus one warning");
    }

    @Test
    void emptyDocumentIsNotReady() {
        PreflightReport report = ReportAggregator.complete(findings(false, 0), List.of());

        assertEquals(1, report.issueList().ofType(IssueType.NO_PAGES).size());
        assertTrue(report.pages().isEmpty());
        assertTrue(report.page(1).isEmpty());
    }
}
