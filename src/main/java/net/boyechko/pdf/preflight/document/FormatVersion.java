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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** PDF format version, e.g. 1.4. */
public record FormatVersion(int major, int minor) implements Comparable<FormatVersion> {
    public static final FormatVersion PDF_1_3 = new FormatVersion(1, 3);
    public static final FormatVersion PDF_1_4 = new FormatVersion(1, 4);

    private static final Pattern VERSION = Pattern.compile("(\\d+)\\.(\\d+)");

    /** Parses the first {@code major.minor} pair in text such as {@code "1.7"} or {@code "PDF-1.7"}. */
    public static FormatVersion parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("No version text");
        }
        Matcher m = VERSION.matcher(text);
        if (!m.find()) {
            throw new IllegalArgumentException("Not a format version: " + text);
        }
        return new FormatVersion(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
    }

    public boolean isBefore(FormatVersion other) {
        return compareTo(other) < 0;
    }

    /** Transparency groups, soft masks and constant alpha were introduced in PDF 1.4. */
    public boolean supportsTransparency() {
        return !isBefore(PDF_1_4);
    }

    @Override
    public int compareTo(FormatVersion other) {
        if (major != other.major) {
            return Integer.compare(major, other.major);
        }
        return Integer.compare(minor, other.minor);
    }

    @Override
    public String toString() {
        return major + "." + minor;
    }
}
