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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards every callback to a caller-supplied listener. A fault thrown by that listener is logged
 * and never reaches the analysis task.
 */
final class GuardedListener implements PreflightListener {
    private static final Logger logger = LoggerFactory.getLogger(GuardedListener.class);

    private final PreflightListener delegate;

    GuardedListener(PreflightListener delegate) {
        this.delegate = delegate;
    }

    private void dispatch(String callback, Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            logger.warn("Listener {} failed: {}", callback, e.toString(), e);
        }
    }

    @Override
    public void onPhaseStart(String phaseName) {
        dispatch("onPhaseStart", () -> delegate.onPhaseStart(phaseName));
    }

    @Override
    public void onSuccess(String message) {
        dispatch("onSuccess", () -> delegate.onSuccess(message));
    }

    @Override
    public void onWarning(String message) {
        dispatch("onWarning", () -> delegate.onWarning(message));
    }

    @Override
    public void onError(String message) {
        dispatch("onError", () -> delegate.onError(message));
    }

    @Override
    public void onInfo(String message) {
        dispatch("onInfo", () -> delegate.onInfo(message));
    }

    @Override
    public void onVerboseOutput(String message) {
        dispatch("onVerboseOutput", () -> delegate.onVerboseOutput(message));
    }

    @Override
    public void onPageAnalysed(AnalysisState phase, int pageNum, int pageCount) {
        dispatch("onPageAnalysed", () -> delegate.onPageAnalysed(phase, pageNum, pageCount));
    }

    @Override
    public void onStructuralReport(PreflightReport report) {
        dispatch("onStructuralReport", () -> delegate.onStructuralReport(report));
    }

    @Override
    public void onReport(PreflightReport report) {
        dispatch("onReport", () -> delegate.onReport(report));
    }

    @Override
    public void onFailure(PreflightFailure failure) {
        dispatch("onFailure", () -> delegate.onFailure(failure));
    }

    @Override
    public void onCancelled(String fileName) {
        dispatch("onCancelled", () -> delegate.onCancelled(fileName));
    }

    @Override
    public void onIssueGroup(String groupLabel, List<PreflightIssue> issues) {
        dispatch("onIssueGroup", () -> delegate.onIssueGroup(groupLabel, issues));
    }
}
