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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import net.boyechko.pdf.preflight.document.ContentStreamReader;
import net.boyechko.pdf.preflight.document.OperatorListSource;
import net.boyechko.pdf.preflight.document.PageRasterizer;
import net.boyechko.pdf.preflight.document.PdfBoxRasterizer;
import net.boyechko.pdf.preflight.issue.IssueType;
import net.boyechko.pdf.preflight.issue.PreflightIssue;
import net.boyechko.pdf.preflight.preview.PagePreview;
import net.boyechko.pdf.preflight.report.PreflightReport;
import net.boyechko.pdf.preflight.report.ReportAggregator;
import net.boyechko.pdf.preflight.report.StructuralFindings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates the two-phase analysis of PDF documents.
 *
 * <p>All analysis runs on a single background thread. Starting a new analysis cancels the one in
 * flight; a cancelled run never commits its report or preview, and releases its document handles on
 * the analysis thread. Every run ends done, failed or cancelled, even when a listener callback
 * throws.
 */
public class PreflightService implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PreflightService.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final PreflightListener listener;
    private final String password;
    private final StructuralPass structuralPass;
    private final ContentPass contentPass;
    private final ExecutorService executor;
    private final AtomicLong runIds = new AtomicLong();

    private final Object lock = new Object();
    // Guarded by lock
    private AnalysisState state = AnalysisState.IDLE;
    private AnalysisRun currentRun;
    private PreflightReport currentReport;
    private PagePreview currentPreview;
    private PreflightFailure failure;
    private boolean closed;

    public static class PreflightServiceBuilder {
        private PreflightListener listener;
        private PreflightSettings settings;
        private OperatorListSource operatorListSource;
        private PageRasterizer rasterizer;
        private String password;

        public PreflightServiceBuilder withListener(PreflightListener listener) {
            this.listener = listener;
            return this;
        }

        public PreflightServiceBuilder withSettings(PreflightSettings settings) {
            this.settings = settings;
            return this;
        }

        public PreflightServiceBuilder withOperatorListSource(OperatorListSource source) {
            this.operatorListSource = source;
            return this;
        }

        public PreflightServiceBuilder withRasterizer(PageRasterizer rasterizer) {
            this.rasterizer = rasterizer;
            return this;
        }

        /** Sets the user password used to open encrypted documents. */
        public PreflightServiceBuilder withPassword(String password) {
            this.password = password;
            return this;
        }

        public PreflightService build() {
            return new PreflightService(this);
        }
    }

    public static PreflightServiceBuilder builder() {
        return new PreflightServiceBuilder();
    }

    private PreflightService(PreflightServiceBuilder builder) {
        PreflightSettings settings =
                builder.settings != null ? builder.settings : PreflightSettings.loadDefault();
        this.listener =
                new GuardedListener(
                        builder.listener != null ? builder.listener : new SilentListener());
        this.password = builder.password;
        OperatorListSource source =
                builder.operatorListSource != null
                        ? builder.operatorListSource
                        : new ContentStreamReader(
                                settings.maxFormDepth(), settings.maxResolveDepth());
        PageRasterizer rasterizer =
                builder.rasterizer != null ? builder.rasterizer : new PdfBoxRasterizer();

        this.structuralPass = new StructuralPass(settings, listener);
        this.contentPass = new ContentPass(settings, source, rasterizer, listener);
        this.executor =
                Executors.newSingleThreadExecutor(
                        runnable -> {
                            Thread thread = new Thread(runnable, "preflight-analysis");
                            thread.setDaemon(true);
                            return thread;
                        });
    }

    /**
     * Starts analysing a document, cancelling any analysis in flight. The current report and
     * preview are cleared immediately.
     *
     * @param bytes the complete file contents; copied before returning
     * @param fileName name shown in the report
     */
    public AnalysisHandle analyse(byte[] bytes, String fileName) {
        Objects.requireNonNull(bytes, "bytes");
        Objects.requireNonNull(fileName, "fileName");
        AnalysisRun run = new AnalysisRun(runIds.incrementAndGet(), bytes.clone(), fileName);
        AnalysisRun previous;
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException("PreflightService is closed");
            }
            previous = currentRun;
            currentRun = run;
            state = AnalysisState.ANALYSING_STRUCTURE;
            currentReport = null;
            currentPreview = null;
            failure = null;
        }
        if (previous != null) {
            discard(previous);
        }
        logger.info("Starting analysis of {} ({} bytes)", fileName, bytes.length);
        run.progress().update(AnalysisState.ANALYSING_STRUCTURE, 0, 0);
        executor.execute(() -> runStructural(run));
        return new AnalysisHandle(run, this);
    }

    public AnalysisState state() {
        synchronized (lock) {
            return state;
        }
    }

    /** Returns the report of the last completed run, or null while analysing or after failure. */
    public PreflightReport currentReport() {
        synchronized (lock) {
            return currentReport;
        }
    }

    /** Returns the preview of the last completed run, or null when none could be rendered. */
    public PagePreview currentPreview() {
        synchronized (lock) {
            return currentPreview;
        }
    }

    /** Returns the failure of the last run when it ended in {@link AnalysisState#FAILED}. */
    public PreflightFailure failure() {
        synchronized (lock) {
            return failure;
        }
    }

    /**
     * Cancels any analysis in flight, releases its resources and stops the analysis thread. Must
     * not be called from a listener callback.
     */
    @Override
    public void close() {
        AnalysisRun run;
        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            run = currentRun;
            currentRun = null;
            if (state.isAnalysing()) {
                state = AnalysisState.IDLE;
            }
        }
        if (run != null) {
            discard(run);
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Analysis thread did not stop within {}s", SHUTDOWN_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    void cancel(AnalysisRun run) {
        synchronized (lock) {
            if (currentRun == run && state.isAnalysing()) {
                currentRun = null;
                state = AnalysisState.IDLE;
            }
        }
        discard(run);
    }

    /** Flags a run as cancelled and schedules the release of its resources. */
    private void discard(AnalysisRun run) {
        if (run.result().isDone() || !run.cancel()) {
            return;
        }
        run.result().cancel(false);
        logger.info("Cancelled analysis of {}", run.fileName());
        try {
            executor.execute(
                    () -> {
                        run.release();
                        listener.onCancelled(run.fileName());
                    });
        } catch (RejectedExecutionException e) {
            logger.debug("Analysis thread already stopped; {} released by its last task", run);
        }
    }

    private boolean isCurrent(AnalysisRun run) {
        return currentRun == run && !run.isCancelled();
    }

    private void runStructural(AnalysisRun run) {
        boolean handedOff = false;
        try {
            if (run.isCancelled()) {
                return;
            }
            listener.onPhaseStart("Analysing structure of " + run.fileName());
            StructuralFindings findings = structuralPass.run(run, password);

            synchronized (lock) {
                if (!isCurrent(run)) {
                    return;
                }
                state = AnalysisState.ANALYSING_CONTENT;
            }
            logger.info(
                    "Structure of {} analysed: {} pages, {} fonts",
                    run.fileName(),
                    findings.pageCount(),
                    findings.fonts().size());
            listener.onStructuralReport(ReportAggregator.structural(findings));

            executor.execute(() -> runContent(run, findings));
            handedOff = true;
        } catch (CancellationException | RejectedExecutionException e) {
            logger.debug("Structural phase of {} stopped: {}", run, e.toString());
        } catch (PreflightException e) {
            fail(run, e);
        } catch (RuntimeException e) {
            fail(run, new AnalysisException("Unexpected fault: " + e.getMessage(), e));
        } finally {
            if (!handedOff) {
                run.release();
            }
        }
    }

    private void runContent(AnalysisRun run, StructuralFindings findings) {
        try {
            if (run.isCancelled()) {
                return;
            }
            listener.onPhaseStart("Analysing content of " + run.fileName());
            ContentOutcome outcome = contentOutcome(run, findings);
            PreflightReport report = outcome.toReport(findings);
            run.release();

            synchronized (lock) {
                if (!isCurrent(run)) {
                    return;
                }
                state = AnalysisState.DONE;
                currentReport = report;
                currentPreview = outcome.preview();
                run.progress()
                        .update(AnalysisState.DONE, findings.pageCount(), findings.pageCount());
                run.result().complete(report);
            }
            logger.info(
                    "Analysis of {} done: {} errors, {} warnings, {} info",
                    run.fileName(),
                    report.errorCount(),
                    report.warningCount(),
                    report.infoCount());
            listener.onInfo("Found " + report.issues().size() + " issue(s) in " + run.fileName());
            reportIssueGroups(report);
            listener.onReport(report);
        } catch (CancellationException e) {
            logger.debug("Content phase of {} stopped: {}", run, e.toString());
        } catch (RuntimeException e) {
            fail(run, new AnalysisException("Unexpected fault: " + e.getMessage(), e));
        } finally {
            run.release();
        }
    }

    private void reportIssueGroups(PreflightReport report) {
        Map<IssueType, List<PreflightIssue>> grouped =
                report.issues().stream()
                        .collect(
                                Collectors.groupingBy(
                                        PreflightIssue::type,
                                        LinkedHashMap::new,
                                        Collectors.toList()));
        for (Map.Entry<IssueType, List<PreflightIssue>> entry : grouped.entrySet()) {
            listener.onIssueGroup(entry.getKey().groupLabel(), entry.getValue());
        }
    }

    /**
     * Runs the content phase. A failure does not fail the run: it becomes an outcome that adds one
     * warning to the structural report.
     */
    private ContentOutcome contentOutcome(AnalysisRun run, StructuralFindings findings) {
        try {
            return contentPass.run(run, findings, password);
        } catch (ContentAnalysisUnavailableException e) {
            logger.warn("Content analysis of {} unavailable: {}", run.fileName(), e.getMessage());
            listener.onWarning("Content analysis unavailable: " + e.getMessage());
            return new ContentOutcome.Unavailable(e);
        }
    }

    private void fail(AnalysisRun run, PreflightException error) {
        PreflightFailure classified = PreflightFailure.from(error, run.fileName());
        run.release();
        synchronized (lock) {
            if (!isCurrent(run) || run.result().isDone()) {
                return;
            }
            state = AnalysisState.FAILED;
            failure = classified;
            run.progress().update(AnalysisState.FAILED, 0, 0);
            run.result().completeExceptionally(error);
        }
        logger.error("Analysis of {} failed: {}", run.fileName(), classified.detail());
        listener.onFailure(classified);
    }

    private static final class SilentListener implements PreflightListener {
        @Override
        public void onPhaseStart(String phaseName) {}

        @Override
        public void onSuccess(String message) {}

        @Override
        public void onWarning(String message) {}
    }
}
