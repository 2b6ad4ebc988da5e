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

import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfNumber;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfPage;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.preflight.document.FormatVersion;
import net.boyechko.pdf.preflight.document.PdfValues;
import net.boyechko.pdf.preflight.issue.IssueList;
import net.boyechko.pdf.preflight.issue.IssueSev;
import net.boyechko.pdf.preflight.issue.IssueType;
import net.boyechko.pdf.preflight.issue.PreflightIssue;

/**
 * Detects transparency groups and graphics states with constant alpha or soft masks. Transparency
 * is an error in documents older than PDF 1.4, where it is undefined, and informational otherwise.
 */
public class TransparencyCheck {
    private final int maxResolveDepth;

    public TransparencyCheck(int maxResolveDepth) {
        this.maxResolveDepth = maxResolveDepth;
    }

    public TransparencyCheck() {
        this(PdfValues.DEFAULT_MAX_DEPTH);
    }

    public IssueList check(PdfPage page, int pageNum, FormatVersion version) {
        IssueList issues = new IssueList();
        IssueSev severity = version.supportsTransparency() ? IssueSev.INFO : IssueSev.ERROR;
        PdfDictionary pageDict = page.getPdfObject();

        PdfObject group = PdfValues.resolve(pageDict.get(PdfName.Group, false), maxResolveDepth);
        if (group instanceof PdfDictionary groupDict
                && PdfName.Transparency.equals(PdfValues.name(groupDict, PdfName.S))) {
            issues.add(
                    PreflightIssue.atPage(
                            IssueType.TRANSPARENCY_GROUP,
                            severity,
                            pageNum,
                            "Page uses a transparency group" + versionNote(version)));
        }

        PdfObject resources =
                PdfValues.resolve(PdfValues.inherited(pageDict, PdfName.Resources), maxResolveDepth);
        for (String stateName : transparentStates(resources)) {
            issues.add(
                    PreflightIssue.atPage(
                            IssueType.TRANSPARENT_GRAPHICS_STATE,
                            severity,
                            pageNum,
                            "Graphics state " + stateName + " uses transparency" + versionNote(version)));
        }
        return issues;
    }

    private List<String> transparentStates(PdfObject resources) {
        List<String> names = new ArrayList<>();
        if (!(resources instanceof PdfDictionary resourceDict)) {
            return names;
        }
        PdfObject extGStates =
                PdfValues.resolve(resourceDict.get(PdfName.ExtGState, false), maxResolveDepth);
        if (!(extGStates instanceof PdfDictionary states)) {
            return names;
        }
        for (PdfName name : states.keySet()) {
            PdfObject state = PdfValues.resolve(states.get(name, false), maxResolveDepth);
            if (state instanceof PdfDictionary gs && usesTransparency(gs)) {
                names.add(name.getValue());
            }
        }
        return names;
    }

    boolean usesTransparency(PdfDictionary gs) {
        if (isBelowOne(PdfValues.resolve(gs.get(PdfName.ca, false), maxResolveDepth))
                || isBelowOne(PdfValues.resolve(gs.get(PdfName.CA, false), maxResolveDepth))) {
            return true;
        }
        PdfObject softMask = PdfValues.resolve(gs.get(PdfName.SMask, false), maxResolveDepth);
        return softMask != null && !PdfName.None.equals(softMask);
    }

    private static boolean isBelowOne(PdfObject value) {
        return value instanceof PdfNumber number && number.doubleValue() < 1.0;
    }

    private static String versionNote(FormatVersion version) {
        return version.supportsTransparency()
                ? ""
                : " but PDF " + version + " predates transparency (1.4)";
    }
}
