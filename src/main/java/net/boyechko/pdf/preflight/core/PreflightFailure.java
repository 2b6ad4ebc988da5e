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
package net.boyechko.pdf.preflight.core;

/**
 * A fatal analysis failure, surfaced instead of a report.
 *
 * @param kind the failure class
 * @param fileName the file whose analysis failed
 * @param detail technical detail for logs; the user sees {@link FailureKind#userMessage()}
 */
public record PreflightFailure(FailureKind kind, String fileName, String detail) {

    /** Classifies a fatal exception raised by the structural phase. */
    public static PreflightFailure from(Throwable error, String fileName) {
        FailureKind kind;
        if (error instanceof DocumentParseException) {
            kind = FailureKind.PARSE_ERROR;
        } else if (error instanceof EncryptedDocumentException) {
            kind = FailureKind.ENCRYPTED_UNREADABLE;
        } else {
            kind = FailureKind.ANALYSIS_FAULT;
        }
        String detail = error.getMessage();
        if (error.getCause() != null && error.getCause().getMessage() != null) {
            detail = detail + ": " + error.getCause().getMessage();
        }
        return new PreflightFailure(kind, fileName, detail);
    }

    public String userMessage() {
        return kind.userMessage();
    }
}
