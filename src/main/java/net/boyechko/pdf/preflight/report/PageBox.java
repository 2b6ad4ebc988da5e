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

/**
 * Axis-aligned page box in document units (points), with the origin at the lower left. Width and
 * height are never negative.
 */
public record PageBox(double x, double y, double width, double height) {

    /** US Letter, used whenever a page does not define a usable MediaBox. */
    public static final PageBox US_LETTER = new PageBox(0, 0, 612, 792);

    public PageBox {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException(
                    "Page box has negative size: " + width + " x " + height);
        }
    }

    /** Builds a box from two opposite corners given in any order. */
    public static PageBox fromCorners(double x1, double y1, double x2, double y2) {
        return new PageBox(Math.min(x1, x2), Math.min(y1, y2), Math.abs(x2 - x1), Math.abs(y2 - y1));
    }

    public double right() {
        return x + width;
    }

    public double top() {
        return y + height;
    }
}
