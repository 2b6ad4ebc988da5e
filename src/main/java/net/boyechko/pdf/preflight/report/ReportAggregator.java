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

import java.util.List;
import net.boyechko.pdf.preflight.checks.DocumentChecks;
import net.boyechko.pdf.preflight.issue.IssueList;
import net.boyechko.pdf.preflight.issue.IssueSev;
import net.boyechko.pdf.preflight.issue.IssueType;
import net.boyechko.pdf.preflight.issue.PreflightIssue;

/**
 * Merges the findings of both phases into a report. Issues appear in a fixed order: geometry,
 * fonts, transparency, content, then document-level checks.
 */
public final class ReportAggregator {
    static final String CONTENT_UNAVAILABLE_MESSAGE =
            "Preview and image analysis unavailable; report covers document structure only";

    private ReportAggregator() {}

    /** Builds the report from the structural phase alone. */
    public static PreflightReport structural(StructuralFindings findings) {
        return assemble(findings, List.of(), null);
    }

    /** Builds the full report from both phases. */
    public static PreflightReport complete(
            StructuralFindings findings, List<PreflightIssue> contentIssues) {
        return assemble(findings, contentIssues, null);
    }

    /**
     * Builds the structural report with one extra warning stating that content analysis failed.
     *
     * @param reason short description of the failure, kept in the issue details
     */
    public static PreflightReport degraded(StructuralFindings findings, String reason) {
        PreflightIssue unavailable =
                new PreflightIssue(
                        IssueType.CONTENT_ANALYSIS_UNAVAILABLE,
                        IssueSev.WARNING,
                        null,
                        CONTENT_UNAVAILABLE_MESSAGE,
                        reason);
        return assemble(findings, List.of(), unavailable);
    }

    private static PreflightReport assemble(
            StructuralFindings findings,
            List<PreflightIssue> contentIssues,
            PreflightIssue degradation) {
        IssueList issues = new IssueList();
        issues.addAll(findings.geometryIssues());
        issues.addAll(findings.fontIssues());
        issues.addAll(findings.transparencyIssues());
        issues.addAll(contentIssues);
        issues.addAll(
                DocumentChecks.check(
                        findings.encrypted(), findings.pageCount(), findings.version()));
        if (degradation != null) {
            issues.add(degradation);
        }
        return new PreflightReport(
                findings.fileName(),
                findings.fileSize(),
                findings.version(),
                findings.pageCount(),
                findings.encrypted(),
                findings.pages(),
                findings.fonts(),
                issues);
    }
}
