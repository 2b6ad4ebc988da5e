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
import net.boyechko.pdf.preflight.report.PreflightReport;

/**
 * Interface for reporting progress and results of an analysis. All callbacks arrive on the
 * analysis thread.
 */
public interface PreflightListener {
    void onPhaseStart(String phaseName);

    void onSuccess(String message);

    void onWarning(String message);

    default void onError(String message) {}

    default void onInfo(String message) {}

    default void onVerboseOutput(String message) {}

    default void onPageAnalysed(AnalysisState phase, int pageNum, int pageCount) {}

    /** The structural phase finished; the report does not include content findings yet. */
    default void onStructuralReport(PreflightReport report) {}

    /** The run finished and its report became the service's current report. */
    default void onReport(PreflightReport report) {
        onSuccess(
                report.fileName()
                        + (report.isReady() ? " is ready for print" : " is not ready for print"));
    }

    default void onFailure(PreflightFailure failure) {
        onError(failure.userMessage());
    }

    default void onCancelled(String fileName) {}

    default void onIssueGroup(String groupLabel, List<PreflightIssue> issues) {
        for (PreflightIssue issue : issues) {
            onWarning(issue.message());
        }
    }
}
