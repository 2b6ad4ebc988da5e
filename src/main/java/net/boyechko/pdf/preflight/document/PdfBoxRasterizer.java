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

import java.awt.image.BufferedImage;
import java.io.IOException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Renders pages with Apache PDFBox. */
public final class PdfBoxRasterizer implements PageRasterizer {
    private static final Logger logger = LoggerFactory.getLogger(PdfBoxRasterizer.class);

    @Override
    public RenderSession open(byte[] bytes, String password) throws IOException {
        PDDocument document = PDDocument.load(bytes, password != null ? password : "");
        logger.debug("Opened render session for {} pages", document.getNumberOfPages());
        return new Session(document);
    }

    private static final class Session implements RenderSession {
        private final PDDocument document;
        private final PDFRenderer renderer;

        Session(PDDocument document) {
            this.document = document;
            this.renderer = new PDFRenderer(document);
        }

        @Override
        public int pageCount() {
            return document.getNumberOfPages();
        }

        @Override
        public BufferedImage render(int pageNumber, float scale) throws IOException {
            if (pageNumber < 1 || pageNumber > pageCount()) {
                throw new IOException(
                        "Page " + pageNumber + " out of range (1-" + pageCount() + ")");
            }
            return renderer.renderImage(pageNumber - 1, scale, ImageType.RGB);
        }

        @Override
        public void close() throws IOException {
            document.close();
        }
    }
}
