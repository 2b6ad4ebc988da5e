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
package net.boyechko.pdf.preflight.core;

import java.util.List;
import net.boyechko.pdf.preflight.issue.PreflightIssue;
import net.boyechko.pdf.preflight.preview.PagePreview;
import net.boyechko.pdf.preflight.report.PreflightReport;
import net.boyechko.pdf.preflight.report.ReportAggregator;
import net.boyechko.pdf.preflight.report.StructuralFindings;

/** Result of the content phase: either its findings, or the reason it could not run. */
sealed interface ContentOutcome permits ContentOutcome.Available, ContentOutcome.Unavailable {

    /** Combines this outcome with the structural findings into the final report. */
    PreflightReport toReport(StructuralFindings findings);

    /** The preview produced by the phase, or null. */
    PagePreview preview();

    record Available(List<PreflightIssue> issues, PagePreview preview) implements ContentOutcome {
        public Available {
            issues = List.copyOf(issues);
        }

        @Override
        public PreflightReport toReport(StructuralFindings findings) {
            return ReportAggregator.complete(findings, issues);
        }
    }

    record Unavailable(ContentAnalysisUnavailableException error) implements ContentOutcome {
        @Override
        public PreflightReport toReport(StructuralFindings findings) {
            return ReportAggregator.degraded(findings, error.getMessage());
        }

        @Override
        public PagePreview preview() {
            return null;
        }
    }
}
