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

/** The content-stream operations the colour and image scan distinguishes. */
public enum OperationKind {
    PAINT_IMAGE,
    PAINT_INLINE_IMAGE,
    SET_FILL_COLOUR_SPACE,
    SET_STROKE_COLOUR_SPACE,
    BEGIN_FORM,
    END_FORM,
    OTHER;

    public boolean paintsImage() {
        return this == PAINT_IMAGE || this == PAINT_INLINE_IMAGE;
    }

    public boolean setsColourSpace() {
        return this == SET_FILL_COLOUR_SPACE || this == SET_STROKE_COLOUR_SPACE;
    }
}
