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

/** Lifecycle of a {@link PreflightService}. */
public enum AnalysisState {
    IDLE("Idle"),
    ANALYSING_STRUCTURE("Analysing structure"),
    ANALYSING_CONTENT("Analysing content"),
    DONE("Done"),
    FAILED("Failed");

    private final String label;

    AnalysisState(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isAnalysing() {
        return this == ANALYSING_STRUCTURE || this == ANALYSING_CONTENT;
    }

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
