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
 * A distinct font used by the document.
 *
 * @param name base font name with any subset prefix removed
 * @param subtype font subtype, e.g. {@code Type1}, {@code TrueType}, {@code Type0}, {@code Type3}
 * @param embedded whether the glyph program travels with the file
 */
public record FontInfo(String name, String subtype, boolean embedded) {

    /** Returns the deduplication key; two fonts with the same key are the same inventory entry. */
    public String key() {
        return name + "/" + subtype;
    }
}
