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

import java.util.ArrayList;
import java.util.Collection;
import java.util.stream.Collectors;

/** Ordered list of preflight issues. Appending is the only supported way to grow it. */
public class IssueList extends ArrayList<PreflightIssue> {

    public IssueList() {
        super();
    }

    public IssueList(Collection<PreflightIssue> issues) {
        super(issues != null ? issues : new ArrayList<>());
    }

    public IssueList(PreflightIssue issue) {
        super();
        if (issue != null) {
            add(issue);
        }
    }

    /** Returns true if any issue has ERROR severity, which makes the document not print-ready. */
    public boolean hasErrors() {
        return stream().anyMatch(PreflightIssue::isError);
    }

    public long count(IssueSev severity) {
        return stream().filter(issue -> issue.severity() == severity).count();
    }

    /** Returns the subset of this list with the given category, in original order. */
    public IssueList ofCategory(IssueCategory category) {
        return stream()
                .filter(issue -> issue.category() == category)
                .collect(Collectors.toCollection(IssueList::new));
    }

    /** Returns the subset of this list with the given type, in original order. */
    public IssueList ofType(IssueType type) {
        return stream()
                .filter(issue -> issue.type() == type)
                .collect(Collectors.toCollection(IssueList::new));
    }

    /** Returns the subset of this list reported against the given page. */
    public IssueList onPage(int pageNum) {
        return stream()
                .filter(issue -> issue.page() != null && issue.page() == pageNum)
                .collect(Collectors.toCollection(IssueList::new));
    }
}
