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
package net.boyechko.pdf.preflight.preview;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * A rendered page with its box overlay. Display only; nothing here feeds back into the report.
 *
 * @param pageNumber 1-based number of the rendered page
 * @param scale pixels per point
 */
public record PagePreview(int pageNumber, BufferedImage image, float scale, PageOverlay overlay) {

    public PagePreview {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(overlay, "overlay");
    }

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }
}
