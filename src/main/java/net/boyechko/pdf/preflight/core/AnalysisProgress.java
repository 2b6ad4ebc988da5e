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
 * Page progress of one analysis run. Written by the analysis thread, readable from any thread.
 * Each update publishes one immutable {@link Snapshot}, so phase and page counts are always read
 * together.
 */
public final class AnalysisProgress {
    /** Phase and page counts as of a single update. */
    public record Snapshot(AnalysisState phase, int completedPages, int totalPages) {
        /** Returns the completed share of the phase, from 0.0 to 1.0. */
        public double fraction() {
            if (totalPages <= 0) {
                return phase.isTerminal() ? 1.0 : 0.0;
            }
            return Math.min(1.0, completedPages / (double) totalPages);
        }

        @Override
        public String toString() {
            return phase.label() + " " + completedPages + "/" + totalPages;
        }
    }

    private volatile Snapshot snapshot = new Snapshot(AnalysisState.IDLE, 0, 0);

    void update(AnalysisState phase, int completedPages, int totalPages) {
        this.snapshot = new Snapshot(phase, completedPages, totalPages);
    }

    public Snapshot snapshot() {
        return snapshot;
    }

    public AnalysisState phase() {
        return snapshot.phase();
    }

    public int completedPages() {
        return snapshot.completedPages();
    }

    public int totalPages() {
        return snapshot.totalPages();
    }

    public double fraction() {
        return snapshot.fraction();
    }

    @Override
    public String toString() {
        return snapshot.toString();
    }
}
