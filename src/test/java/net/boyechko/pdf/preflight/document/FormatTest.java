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

import static org.junit.jupiter.api.Assertions.*;

import net.boyechko.pdf.preflight.issue.IssueSev;
import net.boyechko.pdf.preflight.issue.IssueType;
import net.boyechko.pdf.preflight.issue.PreflightIssue;
import org.junit.jupiter.api.Test;

class FormatTest {

    @Test
    void sizesUseBinaryUnitsWithOneDecimal() {
        assertEquals("512 B", Format.size(512));
        assertEquals("1.5 KB", Format.size(1536));
        assertEquals("3.0 MB", Format.size(3L * 1024 * 1024));
    }

    @Test
    void lengthsShowPointsAndMillimetres() {
        assertEquals("8.50pt", Format.pt(8.5));
        assertEquals("3.00mm", Format.mm(8.5));
        assertEquals("8.50pt (3.00mm)", Format.length(8.5));
        assertEquals(25.4, Format.toMm(72), 0.01);
    }

    @Test
    void decimalsGrowUntilLengthsPrintDifferently() {
        assertEquals(2, Format.decimalsToDistinguish(8.4, 8.5));
        assertEquals(3, Format.decimalsToDistinguish(8.497, 8.5));
        assertEquals(-1, Format.decimalsToDistinguish(8.5, 8.5));
        assertEquals("8.497pt (3.00mm)", Format.length(8.497, 3));
    }

    @Test
    void dimensionsUseOneDecimal() {
        assertEquals("612.0 x 792.0pt", Format.dimensions(612, 792));
    }

    @Test
    void locationOnlyForPageIssues() {
        PreflightIssue onPage =
                PreflightIssue.atPage(IssueType.RGB_COLOUR, IssueSev.WARNING, 3, "RGB");
        PreflightIssue docLevel =
                PreflightIssue.document(IssueType.NO_PAGES, IssueSev.ERROR, "No pages");
        assertEquals(" (p. 3)", Format.loc(onPage));
        assertEquals("", Format.loc(docLevel));
    }
}
