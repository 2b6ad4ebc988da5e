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
package net.boyechko.pdf.preflight.checks;

import net.boyechko.pdf.preflight.document.FormatVersion;
import net.boyechko.pdf.preflight.issue.IssueList;
import net.boyechko.pdf.preflight.issue.IssueSev;
import net.boyechko.pdf.preflight.issue.IssueType;
import net.boyechko.pdf.preflight.issue.PreflightIssue;

/** Document-level checks: encryption, empty page tree and legacy format versions. */
public final class DocumentChecks {
    private DocumentChecks() {}

    public static IssueList check(boolean encrypted, int pageCount, FormatVersion version) {
        IssueList issues = new IssueList();
        if (encrypted) {
            issues.add(
                    PreflightIssue.document(
                            IssueType.DOCUMENT_ENCRYPTED,
                            IssueSev.WARNING,
                            "Document is encrypted; some print workflows may refuse it"));
        }
        if (pageCount == 0) {
            issues.add(
                    PreflightIssue.document(
                            IssueType.NO_PAGES, IssueSev.ERROR, "Document has no pages"));
        }
        if (version != null && version.isBefore(FormatVersion.PDF_1_3)) {
            issues.add(
                    PreflightIssue.document(
                            IssueType.LEGACY_VERSION,
                            IssueSev.INFO,
                            "Document uses legacy format version PDF " + version));
        }
        return issues;
    }
}
