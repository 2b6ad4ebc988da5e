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

import com.itextpdf.kernel.pdf.PdfDocument;
import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import net.boyechko.pdf.preflight.document.RenderSession;
import net.boyechko.pdf.preflight.report.PreflightReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State of a single analysis run: its input, cancellation flag, result and the document handles it
 * owns. Handles are only touched on the analysis thread.
 */
final class AnalysisRun {
    private static final Logger logger = LoggerFactory.getLogger(AnalysisRun.class);

    private final long id;
    private final byte[] bytes;
    private final String fileName;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final CompletableFuture<PreflightReport> result = new CompletableFuture<>();
    private final AnalysisProgress progress = new AnalysisProgress();

    private PdfDocument document;
    private RenderSession renderSession;

    AnalysisRun(long id, byte[] bytes, String fileName) {
        this.id = id;
        this.bytes = bytes;
        this.fileName = fileName;
    }

    byte[] bytes() {
        return bytes;
    }

    String fileName() {
        return fileName;
    }

    CompletableFuture<PreflightReport> result() {
        return result;
    }

    AnalysisProgress progress() {
        return progress;
    }

    boolean isCancelled() {
        return cancelled.get();
    }

    /** Sets the cancellation flag. Returns false if it was already set. */
    boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    PdfDocument document() {
        return document;
    }

    void attach(PdfDocument document) {
        this.document = document;
    }

    void attach(RenderSession renderSession) {
        this.renderSession = renderSession;
    }

    /** Closes the document handles this run holds. Safe to call more than once. */
    void release() {
        if (renderSession != null) {
            try {
                renderSession.close();
            } catch (IOException e) {
                logger.warn("Failed to close render session for {}: {}", fileName, e.getMessage());
            }
            renderSession = null;
        }
        if (document != null) {
            try {
                document.close();
            } catch (RuntimeException e) {
                logger.warn("Failed to close document {}: {}", fileName, e.getMessage());
            }
            document = null;
        }
    }

    @Override
    public String toString() {
        return "run #" + id + " (" + fileName + ")";
    }
}
