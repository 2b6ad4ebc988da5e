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

import java.util.Optional;

/** Screen-space outlines of a page's boxes. Boxes the page does not define are null. */
public record PageOverlay(ScreenRect media, ScreenRect trim, ScreenRect bleed, ScreenRect crop) {

    public Optional<ScreenRect> trimRect() {
        return Optional.ofNullable(trim);
    }

    public Optional<ScreenRect> bleedRect() {
        return Optional.ofNullable(bleed);
    }

    public Optional<ScreenRect> cropRect() {
        return Optional.ofNullable(crop);
    }
}
