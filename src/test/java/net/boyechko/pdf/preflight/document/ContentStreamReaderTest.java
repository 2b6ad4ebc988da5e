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

import static org.junit.jupiter.api.Assertions.*;

import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfNumber;
import com.itextpdf.kernel.pdf.PdfPage;
import com.itextpdf.kernel.pdf.PdfStream;
import com.itextpdf.kernel.pdf.PdfString;
import java.util.List;
import java.util.stream.Collectors;
import net.boyechko.pdf.preflight.PdfTestBase;
import org.junit.jupiter.api.Test;

class ContentStreamReaderTest extends PdfTestBase {
    private final ContentStreamReader reader = new ContentStreamReader();

    private List<PaintOperation> readFirstPage(byte[] pdf, ContentStreamReader source)
            throws Exception {
        try (PdfDocument pdfDoc = open(pdf)) {
            return source.operatorList(pdfDoc.getPage(1));
        }
    }

    private static List<OperationKind> kinds(List<PaintOperation> ops) {
        return ops.stream().map(PaintOperation::kind).collect(Collectors.toList());
    }

    private static List<String> colourSpaces(List<PaintOperation> ops) {
        return ops.stream()
                .filter(op -> op.kind().setsColourSpace())
                .map(PaintOperation::colourSpace)
                .collect(Collectors.toList());
    }

    @Test
    void shortcutOperatorsSetDeviceFamilies() throws Exception {
        byte[] pdf =
                createPdf(
                        pdfDoc ->
                                addPage(
                                        pdfDoc,
                                        "1 0 0 rg 0 0 1 RG 0 0 0 1 k 1 0 0 0 K 0.5 g 0.5 G"));
        List<PaintOperation> ops = readFirstPage(pdf, reader);

        assertEquals(
                List.of(
                        "DeviceRGB",
                        "DeviceRGB",
                        "DeviceCMYK",
                        "DeviceCMYK",
                        "DeviceGray",
                        "DeviceGray"),
                colourSpaces(ops));
        assertEquals(OperationKind.SET_FILL_COLOUR_SPACE, ops.get(0).kind());
        assertEquals(OperationKind.SET_STROKE_COLOUR_SPACE, ops.get(1).kind());
    }

    @Test
    void namedColourSpaceResolvesThroughResources() throws Exception {
        byte[] pdf =
                createPdf(
                        pdfDoc -> {
                            PdfPage page = addPage(pdfDoc, "/CS0 cs 0.2 0.4 0.6 sc /DeviceCMYK CS");
                            resourceCategory(page, PdfName.ColorSpace)
                                    .put(new PdfName("CS0"), iccBased(pdfDoc, 3));
                        });
        List<PaintOperation> ops = readFirstPage(pdf, reader);

        assertEquals(List.of("DeviceRGB", "DeviceCMYK"), colourSpaces(ops));
        assertTrue(
                ops.stream().anyMatch(op -> "sc".equals(op.operator())),
                "Other operators should be kept as OTHER");
    }

    @Test
    void familyMapsIccComponentsAndIndexedBase() {
        assertEquals("DeviceGray", reader.family(iccBased(null, 1), 0));
        assertEquals("DeviceRGB", reader.family(iccBased(null, 3), 0));
        assertEquals("DeviceCMYK", reader.family(iccBased(null, 4), 0));
        assertEquals("ICCBased", reader.family(iccBased(null, 2), 0));

        PdfArray indexed = new PdfArray();
        indexed.add(PdfName.Indexed);
        indexed.add(iccBased(null, 4));
        indexed.add(new PdfNumber(1));
        indexed.add(new PdfString("\0\0\0\0\1\1\1\1"));
        assertEquals("DeviceCMYK", reader.family(indexed, 0));

        PdfArray separation = new PdfArray();
        separation.add(PdfName.Separation);
        separation.add(new PdfName("Gold"));
        assertEquals("Separation", reader.family(separation, 0));
        assertEquals("Lab", reader.family(PdfName.Lab, 0));
        assertEquals("Unknown", reader.family(new PdfArray(), 0));
    }

    @Test
    void imageXObjectIsAnImagePaint() throws Exception {
        byte[] pdf =
                createPdf(
                        pdfDoc -> {
                            PdfPage page = addPage(pdfDoc, "q 100 0 0 100 0 0 cm /Im1 Do Q");
                            resourceCategory(page, PdfName.XObject)
                                    .put(new PdfName("Im1"), imageXObject(pdfDoc));
                        });
        List<PaintOperation> ops = readFirstPage(pdf, reader);

        List<PaintOperation> images =
                ops.stream().filter(op -> op.kind().paintsImage()).collect(Collectors.toList());
        assertEquals(1, images.size());
        assertEquals(OperationKind.PAINT_IMAGE, images.get(0).kind());
        assertEquals("Im1", images.get(0).operand());
    }

    @Test
    void inlineImageIsAnImagePaint() throws Exception {
        byte[] pdf = createPdf(pdfDoc -> addPage(pdfDoc, "q BI /W 1 /H 1 /CS /G /BPC 8 ID A\nEI Q"));
        List<PaintOperation> ops = readFirstPage(pdf, reader);

        assertTrue(
                kinds(ops).contains(OperationKind.PAINT_INLINE_IMAGE),
                "Inline image should be reported, got " + ops);
    }

    @Test
    void unknownXObjectIsSkipped() throws Exception {
        byte[] pdf = createPdf(pdfDoc -> addPage(pdfDoc, "/Missing Do"));
        List<PaintOperation> ops = readFirstPage(pdf, reader);

        assertEquals(List.of(OperationKind.OTHER), kinds(ops));
    }

    @Test
    void formContentIsReadWithItsOwnResources() throws Exception {
        byte[] pdf =
                createPdf(
                        pdfDoc -> {
                            PdfDictionary formResources = new PdfDictionary();
                            PdfDictionary formXObjects = new PdfDictionary();
                            formXObjects.put(new PdfName("Inner"), imageXObject(pdfDoc));
                            formResources.put(PdfName.XObject, formXObjects);
                            PdfStream form =
                                    formXObject(pdfDoc, "0 0 0 1 k /Inner Do", formResources);

                            PdfPage page = addPage(pdfDoc, "1 0 0 rg /Fm1 Do");
                            resourceCategory(page, PdfName.XObject).put(new PdfName("Fm1"), form);
                        });
        List<PaintOperation> ops = readFirstPage(pdf, reader);

        assertEquals(
                List.of(
                        OperationKind.SET_FILL_COLOUR_SPACE,
                        OperationKind.BEGIN_FORM,
                        OperationKind.SET_FILL_COLOUR_SPACE,
                        OperationKind.PAINT_IMAGE,
                        OperationKind.END_FORM),
                kinds(ops));
        assertEquals(List.of("DeviceRGB", "DeviceCMYK"), colourSpaces(ops));
    }

    @Test
    void selfReferencingFormIsEnteredOnce() throws Exception {
        byte[] pdf =
                createPdf(
                        pdfDoc -> {
                            PdfDictionary formResources = new PdfDictionary();
                            PdfDictionary formXObjects = new PdfDictionary();
                            formResources.put(PdfName.XObject, formXObjects);
                            PdfStream form = formXObject(pdfDoc, "0 g /Loop Do", formResources);
                            formXObjects.put(new PdfName("Loop"), form);

                            PdfPage page = addPage(pdfDoc, "/Loop Do");
                            resourceCategory(page, PdfName.XObject).put(new PdfName("Loop"), form);
                        });
        List<PaintOperation> ops = readFirstPage(pdf, reader);

        assertEquals(
                1,
                ops.stream().filter(op -> op.kind() == OperationKind.BEGIN_FORM).count(),
                "A form must not be entered while it is already open");
        assertEquals(OperationKind.END_FORM, ops.get(ops.size() - 1).kind());
    }

    @Test
    void formsAreNotEnteredPastDepthLimit() throws Exception {
        byte[] pdf =
                createPdf(
                        pdfDoc -> {
                            PdfStream form = formXObject(pdfDoc, "1 0 0 rg", null);
                            PdfPage page = addPage(pdfDoc, "/Fm1 Do");
                            resourceCategory(page, PdfName.XObject).put(new PdfName("Fm1"), form);
                        });
        List<PaintOperation> ops = readFirstPage(pdf, new ContentStreamReader(0, 8));

        assertEquals(List.of(OperationKind.OTHER), kinds(ops));
        assertTrue(colourSpaces(ops).isEmpty(), "Form content should not be read");
    }

    @Test
    void emptyPageHasNoOperations() throws Exception {
        byte[] pdf = createPdf(pdfDoc -> addPage(pdfDoc, null));
        assertTrue(readFirstPage(pdf, reader).isEmpty());
    }
}
