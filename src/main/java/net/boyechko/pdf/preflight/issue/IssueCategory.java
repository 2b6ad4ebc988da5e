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
package net.boyechko.pdf.preflight.issue;

/** Broad area of the document a preflight issue belongs to. */
public enum IssueCategory {
    DOCUMENT("Document"),
    GEOMETRY("Page geometry"),
    FONTS("Fonts"),
    COLOUR("Colour"),
    IMAGES("Images"),
    TRANSPARENCY("Transparency");

    private final String heading;

    IssueCategory(String heading) {
        this.heading = heading;
    }

    public String heading() {
        return heading;
    }
}
