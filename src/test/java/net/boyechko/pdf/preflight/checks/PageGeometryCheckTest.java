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

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.pdf.preflight.core.PreflightSettings;
import net.boyechko.pdf.preflight.issue.IssueList;
import net.boyechko.pdf.preflight.issue.IssueSev;
import net.boyechko.pdf.preflight.issue.IssueType;
import net.boyechko.pdf.preflight.issue.PreflightIssue;
import net.boyechko.pdf.preflight.report.PageBox;
import net.boyechko.pdf.preflight.report.PageInfo;
import org.junit.jupiter.api.Test;

class PageGeometryCheckTest {
    private static final PageBox A4 = new PageBox(0, 0, 595.28, 841.89);
    private static final PageBox TRIM = PageBox.fromCorners(18, 18, 594, 774);

    private final PageGeometryCheck check = new PageGeometryCheck(PreflightSettings.loadDefault());

    private static PageBox bleed(double margin) {
        return PageBox.fromCorners(18 - margin, 18 - margin, 594 + margin, 774 + margin);
    }

    private static PageInfo page(int n, PageBox trim, PageBox bleed) {
        return new PageInfo(n, PageBox.US_LETTER, trim, bleed, null);
    }

    @Test
    void noBoxesGivesBleedWarningThenTrimInfo() {
        IssueList issues = check.checkBoxes(page(1, null, null));

        assertEquals(2, issues.size());
        assertEquals(IssueType.BLEED_BOX_MISSING, issues.get(0).type());
        assertEquals(IssueSev.WARNING, issues.get(0).severity());
        assertEquals(IssueType.TRIM_BOX_MISSING, issues.get(1).type());
        assertEquals(IssueSev.INFO, issues.get(1).severity());
        assertEquals(1, (int) issues.get(0).page());
    }

    @Test
    void trimWithoutBleedOnlyWarnsAboutBleed() {
        IssueList issues = check.checkBoxes(page(2, TRIM, null));

        assertEquals(1, issues.size());
        assertEquals(IssueType.BLEED_BOX_MISSING, issues.get(0).type());
    }

    @Test
    void bleedWithoutTrimOnlyNotesTrim() {
        IssueList issues = check.checkBoxes(page(3, null, bleed(9)));

        assertEquals(1, issues.size());
        assertEquals(IssueType.TRIM_BOX_MISSING, issues.get(0).type());
    }

    @Test
    void sufficientBleedHasNoIssues() {
        assertTrue(check.checkBoxes(page(1, TRIM, bleed(9))).isEmpty());
    }

    @Test
    void bleedAtExactlyTheMinimumIsAccepted() {
        assertTrue(check.checkBoxes(page(1, TRIM, bleed(8.5))).isEmpty());
    }

    @Test
    void bleedJustBelowTheMinimumIsFlagged() {
        IssueList issues = check.checkBoxes(page(4, TRIM, bleed(8.49)));

        assertEquals(1, issues.size());
        PreflightIssue issue = issues.get(0);
        assertEquals(IssueType.BLEED_MARGIN_INSUFFICIENT, issue.type());
        assertEquals(IssueSev.WARNING, issue.severity());
        assertEquals(4, (int) issue.page());
        assertTrue(issue.message().contains("8.49pt"), issue.message());
        assertTrue(issue.message().contains("8.50pt (3.00mm)"), issue.message());
        assertTrue(issue.details().contains("trim [18.00pt"), issue.details());
    }

    @Test
    void marginThatRoundsToTheMinimumIsShownWithMoreDecimals() {
        IssueList issues = check.checkBoxes(page(1, TRIM, bleed(8.497)));

        assertEquals(1, issues.size());
        String message = issues.get(0).message();
        assertTrue(message.startsWith("Bleed margin of 8.497pt "), message);
        assertTrue(message.endsWith("below the required 8.50pt (3.00mm)"), message);
    }

    @Test
    void marginIndistinguishableFromTheMinimumIsJustBelow() {
        IssueList issues = check.checkBoxes(page(1, TRIM, bleed(8.49999999)));

        assertEquals(1, issues.size());
        assertEquals(
                "Bleed margin is just below the required 8.50pt (3.00mm)",
                issues.get(0).message());
    }

    @Test
    void smallestSideDecidesTheMargin() {
        PageBox lopsided = PageBox.fromCorners(0, 0, 612, 792);
        assertEquals(18, PageGeometryCheck.minBleedMargin(TRIM, lopsided), 0.0001);
        PageBox narrowTop = PageBox.fromCorners(0, 0, 612, 776);
        assertEquals(2, PageGeometryCheck.minBleedMargin(TRIM, narrowTop), 0.0001);
    }

    @Test
    void pagesWithinToleranceMatch() {
        PageInfo first = new PageInfo(1, PageBox.US_LETTER, null, null, null);
        PageInfo close = new PageInfo(2, new PageBox(0, 0, 612.9, 791.2), null, null, null);

        assertTrue(check.checkPageSizes(List.of(first, close)).isEmpty());
        assertTrue(check.checkPageSizes(List.of()).isEmpty());
    }

    @Test
    void differingPageIsNamedWithPaperSizes() {
        PageInfo first = new PageInfo(1, PageBox.US_LETTER, null, null, null);
        PageInfo second = new PageInfo(2, A4, null, null, null);
        PageInfo third = new PageInfo(3, PageBox.US_LETTER, null, null, null);

        IssueList issues = check.checkPageSizes(List.of(first, second, third));

        assertEquals(1, issues.size());
        PreflightIssue issue = issues.get(0);
        assertEquals(IssueType.PAGE_SIZE_MISMATCH, issue.type());
        assertEquals(2, (int) issue.page());
        assertEquals(
                "Page size 595.3 x 841.9pt, A4 differs from page 1 (612.0 x 792.0pt, Letter)",
                issue.message());
    }
}
