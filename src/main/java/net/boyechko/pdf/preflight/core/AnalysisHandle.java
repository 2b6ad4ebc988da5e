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

import java.util.concurrent.CompletableFuture;
import net.boyechko.pdf.preflight.report.PreflightReport;

/**
 * Handle to one analysis started by {@link PreflightService#analyse}. The result completes with
 * the report, completes exceptionally with a {@link PreflightException} on a fatal failure, or is
 * cancelled when the run is cancelled or superseded by newer input.
 */
public final class AnalysisHandle {
    private final AnalysisRun run;
    private final PreflightService service;

    AnalysisHandle(AnalysisRun run, PreflightService service) {
        this.run = run;
        this.service = service;
    }

    public String fileName() {
        return run.fileName();
    }

    public CompletableFuture<PreflightReport> result() {
        return run.result();
    }

    public AnalysisProgress progress() {
        return run.progress();
    }

    public boolean isCancelled() {
        return run.isCancelled();
    }

    /** Cancels the run. Has no effect once the run has finished. */
    public void cancel() {
        service.cancel(run);
    }
}
