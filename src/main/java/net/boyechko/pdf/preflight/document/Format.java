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

import java.util.Locale;
import net.boyechko.pdf.preflight.issue.PreflightIssue;
import net.boyechko.pdf.preflight.report.PageBox;

/**
 * Formatting utilities for lengths, sizes and locations in log messages and reports.
 *
 * <p>All numbers are formatted with {@link Locale#ROOT} so reports are identical across machines.
 */
public final class Format {
    /** Millimetres per PDF point. */
    public static final double MM_PER_PT = 0.352778;

    private static final int MIN_DECIMALS = 2;
    private static final int MAX_DECIMALS = 6;

    private static final long KB = 1024;
    private static final long MB = KB * 1024;

    private Format() {}

    public static double toMm(double pt) {
        return pt * MM_PER_PT;
    }

    /** Returns a file size such as {@code "512 B"}, {@code "12.5 KB"} or {@code "3.2 MB"}. */
    public static String size(long bytes) {
        if (bytes < KB) return bytes + " B";
        if (bytes < MB) return String.format(Locale.ROOT, "%.1f KB", bytes / (double) KB);
        return String.format(Locale.ROOT, "%.1f MB", bytes / (double) MB);
    }

    /** Returns a length in points, e.g. {@code "8.50pt"}. */
    public static String pt(double pt) {
        return pt(pt, MIN_DECIMALS);
    }

    /** Returns a length in points with the given number of decimals. */
    public static String pt(double pt, int decimals) {
        return String.format(Locale.ROOT, "%." + decimals + "fpt", pt);
    }

    /**
     * Returns the fewest decimals, from 2 to 6, at which two lengths in points print differently,
     * or -1 when they print the same even at 6.
     */
    public static int decimalsToDistinguish(double pt, double other) {
        for (int decimals = MIN_DECIMALS; decimals <= MAX_DECIMALS; decimals++) {
            if (!pt(pt, decimals).equals(pt(other, decimals))) {
                return decimals;
            }
        }
        return -1;
    }

    /** Returns a length in millimetres converted from points, e.g. {@code "3.00mm"}. */
    public static String mm(double pt) {
        return String.format(Locale.ROOT, "%.2fmm", toMm(pt));
    }

    /** Returns a length in both units, e.g. {@code "8.50pt (3.00mm)"}. */
    public static String length(double pt) {
        return pt(pt) + " (" + mm(pt) + ")";
    }

    /** Returns a length in both units, with the points shown to the given number of decimals. */
    public static String length(double pt, int decimals) {
        return pt(pt, decimals) + " (" + mm(pt) + ")";
    }

    /** Returns page dimensions, e.g. {@code "612.0 x 792.0pt"}. */
    public static String dimensions(double width, double height) {
        return String.format(Locale.ROOT, "%.1f x %.1fpt", width, height);
    }

    public static String dimensions(PageBox box) {
        return dimensions(box.width(), box.height());
    }

    /** Returns a short label for a page number. */
    public static String page(int pageNum) {
        return "p. " + pageNum;
    }

    /**
     * Returns a parenthesized location string for an issue, e.g. {@code " (p. 3)"}. Returns empty
     * string for document-level issues.
     */
    public static String loc(PreflightIssue issue) {
        if (issue == null || !issue.hasPage()) return "";
        return " (" + page(issue.page()) + ")";
    }
}
