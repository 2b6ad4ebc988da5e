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

import java.util.List;
import net.boyechko.pdf.preflight.document.FormatVersion;
import net.boyechko.pdf.preflight.issue.PreflightIssue;

/**
 * Everything the structural phase learns about a document, before content analysis.
 *
 * @param geometryIssues box issues in page order, followed by page-size mismatches
 */
public record StructuralFindings(
        String fileName,
        long fileSize,
        FormatVersion version,
        int pageCount,
        boolean encrypted,
        List<PageInfo> pages,
        List<FontInfo> fonts,
        List<PreflightIssue> geometryIssues,
        List<PreflightIssue> fontIssues,
        List<PreflightIssue> transparencyIssues) {

    public StructuralFindings {
        pages = List.copyOf(pages);
        fonts = List.copyOf(fonts);
        geometryIssues = List.copyOf(geometryIssues);
        fontIssues = List.copyOf(fontIssues);
        transparencyIssues = List.copyOf(transparencyIssues);
    }

    /** Returns the page with the given 1-based number, or null when there is none. */
    public PageInfo page(int pageNumber) {
        if (pageNumber < 1 || pageNumber > pages.size()) {
            return null;
        }
        return pages.get(pageNumber - 1);
    }
}
