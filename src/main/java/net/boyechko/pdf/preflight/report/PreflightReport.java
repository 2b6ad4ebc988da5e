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
import java.util.Optional;
import net.boyechko.pdf.preflight.document.FormatVersion;
import net.boyechko.pdf.preflight.issue.IssueList;
import net.boyechko.pdf.preflight.issue.IssueSev;
import net.boyechko.pdf.preflight.issue.PreflightIssue;

/**
 * Result of one analysis run. A report is never patched: a new run produces a new report.
 *
 * <p>Readiness is derived from the issues rather than stored; a report is ready for print when it
 * contains no error-severity issue, however many warnings it has.
 */
public record PreflightReport(
        String fileName,
        long fileSize,
        FormatVersion version,
        int pageCount,
        boolean encrypted,
        List<PageInfo> pages,
        List<FontInfo> fonts,
        List<PreflightIssue> issues) {

    public PreflightReport {
        pages = List.copyOf(pages);
        fonts = List.copyOf(fonts);
        issues = List.copyOf(issues);
    }

    public boolean isReady() {
        return errorCount() == 0;
    }

    public long errorCount() {
        return count(IssueSev.ERROR);
    }

    public long warningCount() {
        return count(IssueSev.WARNING);
    }

    public long infoCount() {
        return count(IssueSev.INFO);
    }

    private long count(IssueSev severity) {
        return issues.stream().filter(issue -> issue.severity() == severity).count();
    }

    /** Returns the page with the given 1-based number. */
    public Optional<PageInfo> page(int pageNumber) {
        if (pageNumber < 1 || pageNumber > pages.size()) {
            return Optional.empty();
        }
        PageInfo page = pages.get(pageNumber - 1);
        return page.pageNumber() == pageNumber ? Optional.of(page) : Optional.empty();
    }

    /** Returns the issues as a mutable copy for filtering. */
    public IssueList issueList() {
        return new IssueList(issues);
    }
}
