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

import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfPage;
import java.util.List;
import net.boyechko.pdf.preflight.PdfTestBase;
import net.boyechko.pdf.preflight.issue.IssueList;
import net.boyechko.pdf.preflight.issue.IssueSev;
import net.boyechko.pdf.preflight.issue.IssueType;
import net.boyechko.pdf.preflight.report.FontInfo;
import org.junit.jupiter.api.Test;

class FontInventoryTest extends PdfTestBase {

    private static PdfDictionary resources(String resourceName, PdfDictionary font) {
        PdfDictionary fonts = new PdfDictionary();
        fonts.put(new PdfName(resourceName), font);
        PdfDictionary resources = new PdfDictionary();
        resources.put(PdfName.Font, fonts);
        return resources;
    }

    @Test
    void standardFontByNameCountsAsEmbedded() {
        FontInventory inventory = new FontInventory();
        FontInfo info = inventory.describe(simpleFont("Type1", "Times-Roman"));

        assertEquals(new FontInfo("Times-Roman", "Type1", true), info);
    }

    @Test
    void customFontWithoutProgramIsNotEmbedded() {
        FontInventory inventory = new FontInventory();
        inventory.add(resources("F1", simpleFont("TrueType", "CustomSans")), 3);

        IssueList issues = inventory.issues();
        assertEquals(1, issues.size());
        assertEquals(IssueType.FONT_NOT_EMBEDDED, issues.get(0).type());
        assertEquals(IssueSev.ERROR, issues.get(0).severity());
        assertEquals(3, (int) issues.get(0).page());
        assertEquals("Font CustomSans (TrueType) is not embedded", issues.get(0).message());
    }

    @Test
    void fontFileMakesFontEmbedded() {
        FontInventory inventory = new FontInventory();
        PdfDictionary font = withFontFile(simpleFont("TrueType", "CustomSans"), PdfName.FontFile2);

        assertTrue(inventory.describe(font).embedded());
    }

    @Test
    void subsetPrefixIsStrippedAndDeduplicated() {
        FontInventory inventory = new FontInventory();
        inventory.add(
                resources("F1", withFontFile(simpleFont("Type1", "ABCDEF+Helvetica"), PdfName.FontFile)),
                1);
        inventory.add(resources("F2", simpleFont("Type1", "Helvetica")), 2);

        List<FontInfo> fonts = inventory.fonts();
        assertEquals(1, fonts.size(), "Subset and plain Helvetica share one entry");
        assertEquals("Helvetica", fonts.get(0).name());
        assertTrue(fonts.get(0).embedded());
        assertTrue(inventory.issues().isEmpty());
    }

    @Test
    void fontReusedAcrossPagesIsReportedOnce() {
        FontInventory inventory = new FontInventory();
        inventory.add(resources("F1", simpleFont("Type1", "ABCDEF+Helvetica")), 1);
        inventory.add(resources("F1", simpleFont("Type1", "ABCDEF+Helvetica")), 2);

        List<FontInfo> fonts = inventory.fonts();
        assertEquals(1, fonts.size());
        assertEquals(new FontInfo("Helvetica", "Type1", false), fonts.get(0));

        IssueList issues = inventory.issues();
        assertEquals(1, issues.size(), "One issue per font, not per page");
        assertEquals(IssueType.FONT_NOT_EMBEDDED, issues.get(0).type());
        assertEquals(1, (int) issues.get(0).page());
    }

    @Test
    void subsetTaggedStandardNameNeedsAProgram() {
        FontInventory inventory = new FontInventory();
        FontInfo info = inventory.describe(simpleFont("Type1", "ABCDEF+Helvetica"));

        assertEquals("Helvetica", info.name());
        assertFalse(info.embedded(), "A subset tag promises an embedded program");
    }

    @Test
    void sameNameWithDifferentSubtypeIsDistinct() {
        FontInventory inventory = new FontInventory();
        PdfDictionary fonts = new PdfDictionary();
        fonts.put(new PdfName("F1"), simpleFont("Type1", "Helvetica"));
        fonts.put(new PdfName("F2"), simpleFont("TrueType", "Helvetica"));
        PdfDictionary resources = new PdfDictionary();
        resources.put(PdfName.Font, fonts);
        inventory.add(resources, 1);

        assertEquals(2, inventory.fonts().size());
    }

    @Test
    void compositeFontIsEmbeddedThroughDescendant() {
        FontInventory inventory = new FontInventory();
        PdfDictionary descendant =
                withFontFile(simpleFont("CIDFontType2", "ABCDEF+NotoSans"), PdfName.FontFile2);
        PdfDictionary type0 = simpleFont("Type0", "ABCDEF+NotoSans");
        type0.put(PdfName.DescendantFonts, new PdfArray(descendant));

        FontInfo info = inventory.describe(type0);
        assertEquals(new FontInfo("NotoSans", "Type0", true), info);
    }

    @Test
    void compositeFontWithoutProgramIsNotEmbedded() {
        FontInventory inventory = new FontInventory();
        PdfDictionary type0 = simpleFont("Type0", "NotoSans");
        type0.put(PdfName.DescendantFonts, new PdfArray(simpleFont("CIDFontType2", "NotoSans")));

        assertFalse(inventory.describe(type0).embedded());
    }

    @Test
    void type3FontIsWarnedAbout() {
        FontInventory inventory = new FontInventory();
        PdfDictionary type3 = withFontFile(simpleFont("Type3", "Glyphs"), PdfName.FontFile3);
        inventory.add(resources("T3", type3), 5);

        IssueList issues = inventory.issues();
        assertEquals(1, issues.size());
        assertEquals(IssueType.TYPE3_FONT, issues.get(0).type());
        assertEquals(IssueSev.WARNING, issues.get(0).severity());
    }

    @Test
    void missingNamesAreUnknown() {
        FontInventory inventory = new FontInventory();
        PdfDictionary font = new PdfDictionary();
        font.put(PdfName.Type, PdfName.Font);

        FontInfo info = inventory.describe(font);
        assertEquals("Unknown", info.name());
        assertEquals("Unknown", info.subtype());
        assertFalse(info.embedded());
    }

    @Test
    void readsFontsThroughIndirectReferences() throws Exception {
        byte[] pdf =
                createPdf(
                        pdfDoc -> {
                            PdfPage page = addPage(pdfDoc, null);
                            PdfDictionary font =
                                    withFontFile(
                                            simpleFont("TrueType", "ABCDEF+Brand"),
                                            PdfName.FontFile2);
                            font.getAsDictionary(PdfName.FontDescriptor)
                                    .getAsStream(PdfName.FontFile2)
                                    .makeIndirect(pdfDoc);
                            font.makeIndirect(pdfDoc);
                            resourceCategory(page, PdfName.Font).put(new PdfName("F1"), font);

                            PdfPage second = addPage(pdfDoc, null);
                            resourceCategory(second, PdfName.Font)
                                    .put(new PdfName("F9"), simpleFont("Type1", "Courier"));
                        });
        FontInventory inventory = new FontInventory();
        try (PdfDocument pdfDoc = open(pdf)) {
            for (int i = 1; i <= pdfDoc.getNumberOfPages(); i++) {
                PdfDictionary resources =
                        pdfDoc.getPage(i).getPdfObject().getAsDictionary(PdfName.Resources);
                inventory.add(resources, i);
            }
        }

        assertEquals(
                List.of(
                        new FontInfo("Brand", "TrueType", true),
                        new FontInfo("Courier", "Type1", true)),
                inventory.fonts());
        assertTrue(inventory.issues().isEmpty());
    }

    @Test
    void nullResourcesAreIgnored() {
        FontInventory inventory = new FontInventory();
        inventory.add(null, 1);
        assertTrue(inventory.fonts().isEmpty());
    }
}
