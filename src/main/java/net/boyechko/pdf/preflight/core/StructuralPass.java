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

import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfPage;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import net.boyechko.pdf.preflight.checks.FontInventory;
import net.boyechko.pdf.preflight.checks.PageGeometryCheck;
import net.boyechko.pdf.preflight.checks.TransparencyCheck;
import net.boyechko.pdf.preflight.document.FormatVersion;
import net.boyechko.pdf.preflight.document.PageBoxes;
import net.boyechko.pdf.preflight.document.PdfCustodian;
import net.boyechko.pdf.preflight.document.PdfValues;
import net.boyechko.pdf.preflight.issue.IssueList;
import net.boyechko.pdf.preflight.report.PageInfo;
import net.boyechko.pdf.preflight.report.StructuralFindings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Phase 1: opens the document and resolves page geometry, fonts and transparency. */
final class StructuralPass {
    private static final Logger logger = LoggerFactory.getLogger(StructuralPass.class);

    private final PreflightSettings settings;
    private final PreflightListener listener;

    StructuralPass(PreflightSettings settings, PreflightListener listener) {
        this.settings = settings;
        this.listener = listener;
    }

    /**
     * Runs the phase. The opened document is attached to the run, which owns it from then on.
     *
     * @throws CancellationException if the run is cancelled between pages
     */
    StructuralFindings run(AnalysisRun run, String password) throws PreflightException {
        PdfDocument pdfDoc =
                new PdfCustodian(run.bytes(), run.fileName(), password).openForReading();
        run.attach(pdfDoc);
        try {
            return inspect(run, pdfDoc);
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AnalysisException("Structural analysis failed: " + e.getMessage(), e);
        }
    }

    private StructuralFindings inspect(AnalysisRun run, PdfDocument pdfDoc) {
        boolean encrypted = PdfCustodian.isEncrypted(pdfDoc);
        FormatVersion version = PdfCustodian.version(pdfDoc);
        int pageCount = pdfDoc.getNumberOfPages();
        logger.debug("{}: PDF {}, {} pages, encrypted {}", run.fileName(), version, pageCount, encrypted);

        PageGeometryCheck geometry = new PageGeometryCheck(settings);
        FontInventory fonts = new FontInventory(settings.maxResolveDepth());
        TransparencyCheck transparency = new TransparencyCheck(settings.maxResolveDepth());

        List<PageInfo> pages = new ArrayList<>();
        IssueList geometryIssues = new IssueList();
        IssueList transparencyIssues = new IssueList();

        run.progress().update(AnalysisState.ANALYSING_STRUCTURE, 0, pageCount);
        for (int pageNum = 1; pageNum <= pageCount; pageNum++) {
            checkCancelled(run);
            PdfPage page = pdfDoc.getPage(pageNum);
            PageInfo info = PageBoxes.describe(page, pageNum);
            pages.add(info);
            geometryIssues.addAll(geometry.checkBoxes(info));
            fonts.add(resources(page), pageNum);
            transparencyIssues.addAll(transparency.check(page, pageNum, version));

            run.progress().update(AnalysisState.ANALYSING_STRUCTURE, pageNum, pageCount);
            listener.onPageAnalysed(AnalysisState.ANALYSING_STRUCTURE, pageNum, pageCount);
        }
        geometryIssues.addAll(geometry.checkPageSizes(pages));

        return new StructuralFindings(
                run.fileName(),
                run.bytes().length,
                version,
                pageCount,
                encrypted,
                pages,
                fonts.fonts(),
                geometryIssues,
                fonts.issues(),
                transparencyIssues);
    }

    private PdfDictionary resources(PdfPage page) {
        PdfObject resources =
                PdfValues.resolve(
                        PdfValues.inherited(page.getPdfObject(), PdfName.Resources),
                        settings.maxResolveDepth());
        return resources instanceof PdfDictionary dict ? dict : null;
    }

    static void checkCancelled(AnalysisRun run) {
        if (run.isCancelled()) {
            throw new CancellationException("Analysis of " + run.fileName() + " was cancelled");
        }
    }
}
