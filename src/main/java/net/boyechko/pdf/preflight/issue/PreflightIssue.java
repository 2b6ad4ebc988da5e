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

import java.util.Objects;

/**
 * A printing hazard found in a PDF document. Issues are immutable; a report accumulates them
 * without merging, so the same type may appear once per affected page.
 *
 * @param type fine-grained issue type, which also fixes the category
 * @param severity how much the hazard matters for print
 * @param page 1-based page number, or null for document-wide issues
 * @param message short human-readable description
 * @param details optional supporting detail, e.g. the measured values; may be null
 */
public record PreflightIssue(
        IssueType type, IssueSev severity, Integer page, String message, String details) {

    public PreflightIssue {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
    }

    public static PreflightIssue document(IssueType type, IssueSev severity, String message) {
        return new PreflightIssue(type, severity, null, message, null);
    }

    public static PreflightIssue atPage(
            IssueType type, IssueSev severity, int page, String message) {
        return new PreflightIssue(type, severity, page, message, null);
    }

    public static PreflightIssue atPage(
            IssueType type, IssueSev severity, int page, String message, String details) {
        return new PreflightIssue(type, severity, page, message, details);
    }

    public IssueCategory category() {
        return type.category();
    }

    public boolean hasPage() {
        return page != null;
    }

    public boolean isError() {
        return severity == IssueSev.ERROR;
    }
}
