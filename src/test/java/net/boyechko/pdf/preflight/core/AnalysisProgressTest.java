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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class AnalysisProgressTest {

    @Test
    void snapshotKeepsPhaseAndCountsTogether() {
        AnalysisProgress progress = new AnalysisProgress();
        progress.update(AnalysisState.ANALYSING_STRUCTURE, 2, 2);
        AnalysisProgress.Snapshot structural = progress.snapshot();

        progress.update(AnalysisState.ANALYSING_CONTENT, 0, 2);
        AnalysisProgress.Snapshot content = progress.snapshot();

        assertEquals(
                new AnalysisProgress.Snapshot(AnalysisState.ANALYSING_STRUCTURE, 2, 2), structural);
        assertEquals(new AnalysisProgress.Snapshot(AnalysisState.ANALYSING_CONTENT, 0, 2), content);
        assertEquals(1.0, structural.fraction(), 0.0001);
        assertEquals(0.0, content.fraction(), 0.0001);
    }

    @Test
    void fractionOfEmptyPhaseDependsOnWhetherItIsOver() {
        AnalysisProgress progress = new AnalysisProgress();
        assertEquals(0.0, progress.fraction(), 0.0001);

        progress.update(AnalysisState.DONE, 0, 0);
        assertEquals(1.0, progress.fraction(), 0.0001);
    }
}
