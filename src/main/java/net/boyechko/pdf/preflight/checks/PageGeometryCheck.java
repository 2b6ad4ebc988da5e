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

import java.util.List;
import net.boyechko.pdf.preflight.core.PreflightSettings;
import net.boyechko.pdf.preflight.document.Format;
import net.boyechko.pdf.preflight.document.PaperSizes;
import net.boyechko.pdf.preflight.issue.IssueList;
import net.boyechko.pdf.preflight.issue.IssueSev;
import net.boyechko.pdf.preflight.issue.IssueType;
import net.boyechko.pdf.preflight.issue.PreflightIssue;
import net.boyechko.pdf.preflight.report.PageBox;
import net.boyechko.pdf.preflight.report.PageInfo;

/** Checks page boxes for bleed and trim definitions and pages for consistent size. */
public class PageGeometryCheck {
    private final double minBleedMarginPt;
    private final double sizeTolerancePt;
    private final PaperSizes paperSizes;

    public PageGeometryCheck(double minBleedMarginPt, double sizeTolerancePt, PaperSizes paperSizes) {
        this.minBleedMarginPt = minBleedMarginPt;
        this.sizeTolerancePt = sizeTolerancePt;
        this.paperSizes = paperSizes;
    }

    public PageGeometryCheck(PreflightSettings settings) {
        this(settings.minBleedMarginPt(), settings.pageSizeTolerancePt(), settings.paperSizes());
    }

    public String name() {
        return "Page Geometry Check";
    }

    /** Checks the trim and bleed definitions of a single page. */
    public IssueList checkBoxes(PageInfo page) {
        IssueList issues = new IssueList();
        int pageNum = page.pageNumber();

        if (page.bleedBox() == null) {
            issues.add(
                    PreflightIssue.atPage(
                            IssueType.BLEED_BOX_MISSING,
                            IssueSev.WARNING,
                            pageNum,
                            "No BleedBox defined; artwork may not extend past the trim"));
        }
        if (page.trimBox() == null) {
            issues.add(
                    PreflightIssue.atPage(
                            IssueType.TRIM_BOX_MISSING,
                            IssueSev.INFO,
                            pageNum,
                            "No TrimBox defined; the MediaBox is used as the finished size"));
        }
        if (page.bleedBox() != null && page.trimBox() != null) {
            double margin = minBleedMargin(page.trimBox(), page.bleedBox());
            if (margin < minBleedMarginPt) {
                issues.add(
                        PreflightIssue.atPage(
                                IssueType.BLEED_MARGIN_INSUFFICIENT,
                                IssueSev.WARNING,
                                pageNum,
                                shortfallMessage(margin),
                                "trim " + describe(page.trimBox())
                                        + ", bleed " + describe(page.bleedBox())));
            }
        }
        return issues;
    }

    private String shortfallMessage(double margin) {
        int decimals = Format.decimalsToDistinguish(margin, minBleedMarginPt);
        if (decimals < 0) {
            return "Bleed margin is just below the required " + Format.length(minBleedMarginPt);
        }
        return "Bleed margin of "
                + Format.length(margin, decimals)
                + " is below the required "
                + Format.length(minBleedMarginPt);
    }

    /** Compares every page's size to the first page's. Returns one issue per differing page. */
    public IssueList checkPageSizes(List<PageInfo> pages) {
        IssueList issues = new IssueList();
        if (pages.isEmpty()) {
            return issues;
        }
        PageInfo first = pages.get(0);
        for (PageInfo page : pages) {
            if (Math.abs(page.width() - first.width()) <= sizeTolerancePt
                    && Math.abs(page.height() - first.height()) <= sizeTolerancePt) {
                continue;
            }
            issues.add(
                    PreflightIssue.atPage(
                            IssueType.PAGE_SIZE_MISMATCH,
                            IssueSev.WARNING,
                            page.pageNumber(),
                            "Page size "
                                    + sizeLabel(page.width(), page.height())
                                    + " differs from page 1 ("
                                    + sizeLabel(first.width(), first.height())
                                    + ")"));
        }
        return issues;
    }

    /** Returns the page size with its paper name when it matches a known paper size. */
    public String sizeLabel(double width, double height) {
        String dims = Format.dimensions(width, height);
        return paperSizes.nameFor(width, height).map(name -> dims + ", " + name).orElse(dims);
    }

    /** Returns the smallest of the four distances by which the bleed box extends past the trim. */
    public static double minBleedMargin(PageBox trim, PageBox bleed) {
        double left = trim.x() - bleed.x();
        double bottom = trim.y() - bleed.y();
        double right = bleed.right() - trim.right();
        double top = bleed.top() - trim.top();
        return Math.min(Math.min(left, right), Math.min(bottom, top));
    }

    private static String describe(PageBox box) {
        return "[" + Format.pt(box.x()) + ", " + Format.pt(box.y()) + ", "
                + Format.pt(box.right()) + ", " + Format.pt(box.top()) + "]";
    }
}
