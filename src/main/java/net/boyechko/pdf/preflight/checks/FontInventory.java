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

import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfObject;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import net.boyechko.pdf.preflight.document.PdfValues;
import net.boyechko.pdf.preflight.issue.IssueList;
import net.boyechko.pdf.preflight.issue.IssueSev;
import net.boyechko.pdf.preflight.issue.IssueType;
import net.boyechko.pdf.preflight.issue.PreflightIssue;
import net.boyechko.pdf.preflight.report.FontInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects the distinct fonts used across pages and decides whether each one is embedded.
 *
 * <p>Fonts are keyed by name and subtype; the first occurrence wins and keeps the page it was first
 * seen on.
 */
public class FontInventory {
    private static final Logger logger = LoggerFactory.getLogger(FontInventory.class);

    private static final Pattern SUBSET_PREFIX = Pattern.compile("^[A-Z]{6}\\+");

    static final String UNKNOWN = "Unknown";

    private static final Set<String> STANDARD_14 =
            Set.of(
                    "Courier",
                    "Courier-Bold",
                    "Courier-Oblique",
                    "Courier-BoldOblique",
                    "Helvetica",
                    "Helvetica-Bold",
                    "Helvetica-Oblique",
                    "Helvetica-BoldOblique",
                    "Times-Roman",
                    "Times-Bold",
                    "Times-Italic",
                    "Times-BoldItalic",
                    "Symbol",
                    "ZapfDingbats");

    private static final List<PdfName> FONT_FILE_KEYS =
            List.of(PdfName.FontFile, PdfName.FontFile2, PdfName.FontFile3);

    private final int maxResolveDepth;
    private final Map<String, FontInfo> fontsByKey = new LinkedHashMap<>();
    private final Map<String, Integer> firstPageByKey = new LinkedHashMap<>();

    public FontInventory(int maxResolveDepth) {
        this.maxResolveDepth = maxResolveDepth;
    }

    public FontInventory() {
        this(PdfValues.DEFAULT_MAX_DEPTH);
    }

    /** Adds the fonts of one page's resource dictionary. */
    public void add(PdfDictionary resources, int pageNum) {
        if (resources == null) {
            return;
        }
        PdfObject fontResource = PdfValues.resolve(resources.get(PdfName.Font, false), maxResolveDepth);
        if (!(fontResource instanceof PdfDictionary fonts)) {
            return;
        }
        for (PdfName resourceName : fonts.keySet()) {
            PdfObject value = PdfValues.resolve(fonts.get(resourceName, false), maxResolveDepth);
            if (!(value instanceof PdfDictionary fontDict)) {
                logger.debug("Font resource {} on page {} is not a dictionary", resourceName, pageNum);
                continue;
            }
            FontInfo info = describe(fontDict);
            if (fontsByKey.putIfAbsent(info.key(), info) == null) {
                firstPageByKey.put(info.key(), pageNum);
                logger.debug(
                        "Font {} ({}) first seen on page {}, embedded: {}",
                        info.name(),
                        info.subtype(),
                        pageNum,
                        info.embedded());
            }
        }
    }

    /** Returns the distinct fonts in order of first appearance. */
    public List<FontInfo> fonts() {
        return new ArrayList<>(fontsByKey.values());
    }

    /** Returns one error per font that is not embedded and one warning per Type 3 font. */
    public IssueList issues() {
        IssueList issues = new IssueList();
        for (FontInfo font : fontsByKey.values()) {
            int firstPage = firstPageByKey.get(font.key());
            if (!font.embedded()) {
                issues.add(
                        PreflightIssue.atPage(
                                IssueType.FONT_NOT_EMBEDDED,
                                IssueSev.ERROR,
                                firstPage,
                                "Font " + font.name() + " (" + font.subtype() + ") is not embedded"));
            }
            if (PdfName.Type3.getValue().equals(font.subtype())) {
                issues.add(
                        PreflightIssue.atPage(
                                IssueType.TYPE3_FONT,
                                IssueSev.WARNING,
                                firstPage,
                                "Font " + font.name() + " is a Type 3 font and may not print sharply"));
            }
        }
        return issues;
    }

    FontInfo describe(PdfDictionary fontDict) {
        String baseFont = PdfValues.nameValue(fontDict, PdfName.BaseFont, null);
        String subtype = PdfValues.nameValue(fontDict, PdfName.Subtype, UNKNOWN);
        boolean subset = baseFont != null && SUBSET_PREFIX.matcher(baseFont).find();
        String name = baseFont == null ? UNKNOWN : SUBSET_PREFIX.matcher(baseFont).replaceFirst("");
        return new FontInfo(name, subtype, isEmbedded(fontDict, name, subset));
    }

    /**
     * A font is embedded when its own descriptor carries a font file, when it is one of the
     * standard 14 fonts referenced by name, or when it is composite and a descendant's descriptor
     * carries a font file. A subset-tagged name promises an embedded program, so it never
     * qualifies as a standard font.
     */
    private boolean isEmbedded(PdfDictionary fontDict, String name, boolean subset) {
        if (hasFontFile(fontDict)) {
            return true;
        }
        if (!subset && STANDARD_14.contains(name)) {
            return true;
        }
        if (PdfName.Type0.equals(PdfValues.name(fontDict, PdfName.Subtype))) {
            PdfObject descendants =
                    PdfValues.resolve(fontDict.get(PdfName.DescendantFonts, false), maxResolveDepth);
            if (descendants instanceof PdfArray array) {
                for (int i = 0; i < array.size(); i++) {
                    PdfObject descendant = PdfValues.resolve(array.get(i, false), maxResolveDepth);
                    if (descendant instanceof PdfDictionary dict && hasFontFile(dict)) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    private boolean hasFontFile(PdfDictionary fontDict) {
        PdfObject descriptor =
                PdfValues.resolve(fontDict.get(PdfName.FontDescriptor, false), maxResolveDepth);
        if (!(descriptor instanceof PdfDictionary dict)) {
            return false;
        }
        for (PdfName key : FONT_FILE_KEYS) {
            if (PdfValues.resolve(dict.get(key, false), maxResolveDepth) != null) {
                return true;
            }
        }
        return false;
    }
}
