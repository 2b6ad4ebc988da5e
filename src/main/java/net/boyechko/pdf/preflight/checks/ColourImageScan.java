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

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.boyechko.pdf.preflight.document.PaintOperation;
import net.boyechko.pdf.preflight.issue.IssueList;
import net.boyechko.pdf.preflight.issue.IssueSev;
import net.boyechko.pdf.preflight.issue.IssueType;
import net.boyechko.pdf.preflight.issue.PreflightIssue;

/** Classifies colour-space usage and counts image paints in one page's operator list. */
public class ColourImageScan {
    static final Set<String> RGB_FAMILY = Set.of("DeviceRGB", "CalRGB", "RGB");
    static final Set<String> CMYK_FAMILY = Set.of("DeviceCMYK", "CMYK");

    public IssueList scan(List<PaintOperation> ops, int pageNum) {
        Set<String> colourSpaces = new LinkedHashSet<>();
        int images = 0;
        for (PaintOperation op : ops) {
            if (op.kind().paintsImage()) {
                images++;
            } else if (op.kind().setsColourSpace() && op.colourSpace() != null) {
                colourSpaces.add(op.colourSpace());
            }
        }

        IssueList issues = new IssueList();
        boolean rgb = colourSpaces.stream().anyMatch(RGB_FAMILY::contains);
        boolean cmyk = colourSpaces.stream().anyMatch(CMYK_FAMILY::contains);
        if (rgb) {
            issues.add(
                    PreflightIssue.atPage(
                            IssueType.RGB_COLOUR,
                            IssueSev.WARNING,
                            pageNum,
                            "RGB colour detected; colours may shift under CMYK conversion",
                            "colour spaces: " + String.join(", ", colourSpaces)));
        }
        if (rgb && cmyk) {
            issues.add(
                    PreflightIssue.atPage(
                            IssueType.MIXED_COLOUR_SPACES,
                            IssueSev.WARNING,
                            pageNum,
                            "Page mixes RGB and CMYK colour spaces"));
        }
        if (images > 0) {
            issues.add(
                    PreflightIssue.atPage(
                            IssueType.IMAGES_PRESENT,
                            IssueSev.INFO,
                            pageNum,
                            images == 1 ? "1 image placed" : images + " images placed"));
        }
        return issues;
    }
}
