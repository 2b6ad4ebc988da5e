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
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.CancellationException;
import net.boyechko.pdf.preflight.checks.ColourImageScan;
import net.boyechko.pdf.preflight.document.OperatorListSource;
import net.boyechko.pdf.preflight.document.PageRasterizer;
import net.boyechko.pdf.preflight.document.PaintOperation;
import net.boyechko.pdf.preflight.document.RenderSession;
import net.boyechko.pdf.preflight.issue.IssueList;
import net.boyechko.pdf.preflight.preview.OverlayMapper;
import net.boyechko.pdf.preflight.preview.PagePreview;
import net.boyechko.pdf.preflight.report.PageInfo;
import net.boyechko.pdf.preflight.report.StructuralFindings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Phase 2: scans page content for colour spaces and images, and renders the preview page. */
final class ContentPass {
    private static final Logger logger = LoggerFactory.getLogger(ContentPass.class);

    private final PreflightSettings settings;
    private final OperatorListSource operatorListSource;
    private final PageRasterizer rasterizer;
    private final PreflightListener listener;

    ContentPass(
            PreflightSettings settings,
            OperatorListSource operatorListSource,
            PageRasterizer rasterizer,
            PreflightListener listener) {
        this.settings = settings;
        this.operatorListSource = operatorListSource;
        this.rasterizer = rasterizer;
        this.listener = listener;
    }

    /**
     * Runs the phase against the document opened by the structural phase.
     *
     * @throws ContentAnalysisUnavailableException if operator lists or the preview cannot be built
     * @throws CancellationException if the run is cancelled between pages
     */
    ContentOutcome.Available run(AnalysisRun run, StructuralFindings findings, String password)
            throws ContentAnalysisUnavailableException {
        try {
            IssueList issues = scanPages(run, run.document());
            PagePreview preview = renderPreview(run, findings, password);
            return new ContentOutcome.Available(issues, preview);
        } catch (CancellationException e) {
            throw e;
        } catch (IOException e) {
            throw new ContentAnalysisUnavailableException(e.getMessage(), e);
        } catch (RuntimeException e) {
            AnalysisException fault =
                    new AnalysisException("Content analysis failed: " + e.getMessage(), e);
            throw new ContentAnalysisUnavailableException(fault.getMessage(), fault);
        }
    }

    private IssueList scanPages(AnalysisRun run, PdfDocument pdfDoc) throws IOException {
        ColourImageScan scan = new ColourImageScan();
        IssueList issues = new IssueList();
        int pageCount = pdfDoc.getNumberOfPages();
        run.progress().update(AnalysisState.ANALYSING_CONTENT, 0, pageCount);
        for (int pageNum = 1; pageNum <= pageCount; pageNum++) {
            StructuralPass.checkCancelled(run);
            List<PaintOperation> ops = operatorListSource.operatorList(pdfDoc.getPage(pageNum));
            listener.onVerboseOutput("Page " + pageNum + ": " + ops.size() + " operations");
            issues.addAll(scan.scan(ops, pageNum));

            run.progress().update(AnalysisState.ANALYSING_CONTENT, pageNum, pageCount);
            listener.onPageAnalysed(AnalysisState.ANALYSING_CONTENT, pageNum, pageCount);
        }
        return issues;
    }

    private PagePreview renderPreview(AnalysisRun run, StructuralFindings findings, String password)
            throws IOException {
        int pageNum = settings.previewPage();
        PageInfo page = findings.page(pageNum);
        if (page == null) {
            logger.debug("No page {} to preview in {}", pageNum, run.fileName());
            return null;
        }
        StructuralPass.checkCancelled(run);
        RenderSession session = rasterizer.open(run.bytes(), password);
        run.attach(session);
        float scale = settings.previewScale();
        BufferedImage image = session.render(pageNum, scale);
        return new PagePreview(
                pageNum, image, scale, OverlayMapper.overlay(page, scale, image.getHeight()));
    }
}
