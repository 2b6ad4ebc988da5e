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

import java.util.List;
import java.util.Optional;

/** Catalog of named paper sizes, matched in either orientation. */
public final class PaperSizes {
    /** Catalog sizes are whole millimetres; inch-based sizes round to within a millimetre. */
    private static final double MATCH_TOLERANCE_MM = 1.0;

    public record Paper(String label, double widthMm, double heightMm) {}

    private final List<Paper> papers;

    public PaperSizes(List<Paper> papers) {
        this.papers = List.copyOf(papers);
    }

    public static PaperSizes none() {
        return new PaperSizes(List.of());
    }

    public List<Paper> papers() {
        return papers;
    }

    /** Returns the label of the paper size matching the given size in points, if any. */
    public Optional<String> nameFor(double widthPt, double heightPt) {
        double widthMm = Format.toMm(widthPt);
        double heightMm = Format.toMm(heightPt);
        for (Paper paper : papers) {
            if (matches(widthMm, heightMm, paper.widthMm(), paper.heightMm())
                    || matches(widthMm, heightMm, paper.heightMm(), paper.widthMm())) {
                return Optional.of(paper.label());
            }
        }
        return Optional.empty();
    }

    private static boolean matches(double w, double h, double paperW, double paperH) {
        return Math.abs(w - paperW) <= MATCH_TOLERANCE_MM && Math.abs(h - paperH) <= MATCH_TOLERANCE_MM;
    }
}
