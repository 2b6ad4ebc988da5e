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
package net.boyechko.pdf.preflight.report;

import java.util.Objects;
import java.util.Optional;

/**
 * Resolved geometry of one page. The trim, bleed and crop boxes are null when the page does not
 * define them; the MediaBox is always present.
 */
public record PageInfo(
        int pageNumber, PageBox mediaBox, PageBox trimBox, PageBox bleedBox, PageBox cropBox) {

    public PageInfo {
        if (pageNumber < 1) {
            throw new IllegalArgumentException("Page numbers start at 1: " + pageNumber);
        }
        Objects.requireNonNull(mediaBox, "mediaBox");
    }

    public double width() {
        return mediaBox.width();
    }

    public double height() {
        return mediaBox.height();
    }

    public Optional<PageBox> trim() {
        return Optional.ofNullable(trimBox);
    }

    public Optional<PageBox> bleed() {
        return Optional.ofNullable(bleedBox);
    }

    public Optional<PageBox> crop() {
        return Optional.ofNullable(cropBox);
    }
}
