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

/** Classification of a fatal analysis failure. */
public enum FailureKind {
    PARSE_ERROR("The file could not be read as a PDF."),
    ENCRYPTED_UNREADABLE("The PDF is password protected and could not be opened."),
    ANALYSIS_FAULT("The PDF could not be analysed.");

    private final String userMessage;

    FailureKind(String userMessage) {
        this.userMessage = userMessage;
    }

    /** Single short message suitable for showing to the user. */
    public String userMessage() {
        return userMessage;
    }
}
