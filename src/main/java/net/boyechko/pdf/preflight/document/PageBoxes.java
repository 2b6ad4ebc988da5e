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
package net.boyechko.pdf.preflight.document;

import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfPage;
import net.boyechko.pdf.preflight.report.PageBox;
import net.boyechko.pdf.preflight.report.PageInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Normalizes the raw box arrays of a page into {@link PageBox} values. */
public final class PageBoxes {
    private static final Logger logger = LoggerFactory.getLogger(PageBoxes.class);

    private PageBoxes() {}

    /**
     * Resolves a raw box value. Returns null when the box is absent. A value that is not an array
     * of at least four entries falls back to US Letter rather than failing the page; entries that
     * are not numbers count as 0.
     */
    public static PageBox resolve(PdfObject raw) {
        if (raw == null) {
            return null;
        }
        if (!(PdfValues.resolve(raw) instanceof PdfArray array) || array.size() < 4) {
            logger.debug("Unusable box value {}, falling back to US Letter", raw);
            return PageBox.US_LETTER;
        }
        double x1 = BoxEntry.of(array.get(0, false)).coerce();
        double y1 = BoxEntry.of(array.get(1, false)).coerce();
        double x2 = BoxEntry.of(array.get(2, false)).coerce();
        double y2 = BoxEntry.of(array.get(3, false)).coerce();
        return PageBox.fromCorners(x1, y1, x2, y2);
    }

    /** Resolves all four boxes of a page. MediaBox and CropBox are inherited from the page tree. */
    public static PageInfo describe(PdfPage page, int pageNumber) {
        PdfDictionary pageDict = page.getPdfObject();
        PageBox media = resolve(PdfValues.inherited(pageDict, PdfName.MediaBox));
        if (media == null) {
            logger.debug("Page {} has no MediaBox, assuming US Letter", pageNumber);
            media = PageBox.US_LETTER;
        }
        PageBox trim = resolve(PdfValues.raw(pageDict, PdfName.TrimBox));
        PageBox bleed = resolve(PdfValues.raw(pageDict, PdfName.BleedBox));
        PageBox crop = resolve(PdfValues.inherited(pageDict, PdfName.CropBox));
        return new PageInfo(pageNumber, media, trim, bleed, crop);
    }
}
