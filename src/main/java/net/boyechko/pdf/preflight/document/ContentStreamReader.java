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

import com.itextpdf.commons.exceptions.ITextException;
import com.itextpdf.io.source.PdfTokenizer;
import com.itextpdf.io.source.RandomAccessFileOrArray;
import com.itextpdf.io.source.RandomAccessSourceFactory;
import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfLiteral;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfNumber;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfPage;
import com.itextpdf.kernel.pdf.PdfResources;
import com.itextpdf.kernel.pdf.PdfStream;
import com.itextpdf.kernel.pdf.canvas.parser.util.PdfCanvasParser;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds operator lists from page content streams with iText's {@link PdfCanvasParser}.
 *
 * <p>Form XObjects are followed with their own resources, up to a nesting limit. A form that is
 * already being read higher up the chain is not entered again.
 */
public final class ContentStreamReader implements OperatorListSource {
    private static final Logger logger = LoggerFactory.getLogger(ContentStreamReader.class);

    public static final String DEVICE_GRAY = "DeviceGray";
    public static final String DEVICE_RGB = "DeviceRGB";
    public static final String DEVICE_CMYK = "DeviceCMYK";

    private final int maxFormDepth;
    private final int maxResolveDepth;

    public ContentStreamReader(int maxFormDepth, int maxResolveDepth) {
        this.maxFormDepth = maxFormDepth;
        this.maxResolveDepth = maxResolveDepth;
    }

    public ContentStreamReader() {
        this(PdfValues.DEFAULT_MAX_DEPTH, PdfValues.DEFAULT_MAX_DEPTH);
    }

    @Override
    public List<PaintOperation> operatorList(PdfPage page) throws IOException {
        List<PaintOperation> ops = new ArrayList<>();
        Set<PdfStream> openForms = Collections.newSetFromMap(new IdentityHashMap<>());
        try {
            read(page.getContentBytes(), page.getResources(), ops, openForms, 0);
        } catch (ITextException e) {
            throw new IOException("Cannot decode content stream: " + e.getMessage(), e);
        }
        return ops;
    }

    private void read(
            byte[] contentBytes,
            PdfResources resources,
            List<PaintOperation> ops,
            Set<PdfStream> openForms,
            int depth)
            throws IOException {
        if (contentBytes == null || contentBytes.length == 0) {
            return;
        }
        RandomAccessFileOrArray source =
                new RandomAccessFileOrArray(
                        new RandomAccessSourceFactory().createSource(contentBytes));
        try (PdfTokenizer tokenizer = new PdfTokenizer(source)) {
            PdfCanvasParser parser = new PdfCanvasParser(tokenizer, resources);
            List<PdfObject> operands = new ArrayList<>();
            while (true) {
                parser.parse(operands);
                if (operands.isEmpty()) {
                    break;
                }
                PdfObject last = operands.get(operands.size() - 1);
                if (!(last instanceof PdfLiteral literal)) {
                    continue;
                }
                handle(literal.toString(), operands, resources, ops, openForms, depth);
            }
        } finally {
            source.close();
        }
    }

    private void handle(
            String operator,
            List<PdfObject> operands,
            PdfResources resources,
            List<PaintOperation> ops,
            Set<PdfStream> openForms,
            int depth)
            throws IOException {
        switch (operator) {
            case "cs" -> ops.add(
                    PaintOperation.fillColourSpace(
                            operator, colourSpaceOperand(operands, resources)));
            case "CS" -> ops.add(
                    PaintOperation.strokeColourSpace(
                            operator, colourSpaceOperand(operands, resources)));
            case "rg" -> ops.add(PaintOperation.fillColourSpace(operator, DEVICE_RGB));
            case "RG" -> ops.add(PaintOperation.strokeColourSpace(operator, DEVICE_RGB));
            case "k" -> ops.add(PaintOperation.fillColourSpace(operator, DEVICE_CMYK));
            case "K" -> ops.add(PaintOperation.strokeColourSpace(operator, DEVICE_CMYK));
            case "g" -> ops.add(PaintOperation.fillColourSpace(operator, DEVICE_GRAY));
            case "G" -> ops.add(PaintOperation.strokeColourSpace(operator, DEVICE_GRAY));
            case "EI" -> ops.add(PaintOperation.inlineImage());
            case "Do" -> paintXObject(operands, resources, ops, openForms, depth);
            default -> ops.add(PaintOperation.other(operator));
        }
    }

    private void paintXObject(
            List<PdfObject> operands,
            PdfResources resources,
            List<PaintOperation> ops,
            Set<PdfStream> openForms,
            int depth)
            throws IOException {
        PdfName name = operands.get(0) instanceof PdfName n ? n : null;
        PdfStream xObject = name == null ? null : xObject(resources, name);
        if (xObject == null) {
            logger.debug("Skipping Do with unknown XObject {}", name);
            ops.add(PaintOperation.other("Do"));
            return;
        }
        PdfName subtype = xObject.getAsName(PdfName.Subtype);
        if (PdfName.Image.equals(subtype)) {
            ops.add(PaintOperation.image(name.getValue()));
            return;
        }
        if (!PdfName.Form.equals(subtype)) {
            ops.add(PaintOperation.other("Do"));
            return;
        }
        if (depth >= maxFormDepth || openForms.contains(xObject)) {
            logger.debug("Not entering form {} at depth {}", name, depth);
            ops.add(PaintOperation.other("Do"));
            return;
        }
        PdfObject formResources =
                PdfValues.resolve(xObject.get(PdfName.Resources, false), maxResolveDepth);
        PdfResources nested =
                formResources instanceof PdfDictionary d ? new PdfResources(d) : resources;

        openForms.add(xObject);
        ops.add(new PaintOperation("Do", OperationKind.BEGIN_FORM, name.getValue(), null));
        read(xObject.getBytes(), nested, ops, openForms, depth + 1);
        ops.add(new PaintOperation("Do", OperationKind.END_FORM, name.getValue(), null));
        openForms.remove(xObject);
    }

    private PdfStream xObject(PdfResources resources, PdfName name) {
        if (resources == null) {
            return null;
        }
        PdfDictionary xObjects = resourceCategory(resources, PdfName.XObject);
        if (xObjects == null) {
            return null;
        }
        return PdfValues.resolve(xObjects.get(name, false), maxResolveDepth) instanceof PdfStream s
                ? s
                : null;
    }

    private PdfDictionary resourceCategory(PdfResources resources, PdfName category) {
        PdfObject value =
                PdfValues.resolve(resources.getPdfObject().get(category, false), maxResolveDepth);
        return value instanceof PdfDictionary d ? d : null;
    }

    /** Returns the colour-space family named by the operand of a {@code cs} or {@code CS}. */
    private String colourSpaceOperand(List<PdfObject> operands, PdfResources resources) {
        if (!(operands.get(0) instanceof PdfName name)) {
            return "Unknown";
        }
        PdfDictionary colourSpaces =
                resources == null ? null : resourceCategory(resources, PdfName.ColorSpace);
        PdfObject definition =
                colourSpaces == null
                        ? null
                        : PdfValues.resolve(colourSpaces.get(name, false), maxResolveDepth);
        if (definition == null) {
            return name.getValue();
        }
        return family(definition, 0);
    }

    /**
     * Returns the family of a colour-space definition. ICC-based spaces map to the device family
     * with the same number of components; indexed spaces map to their base.
     */
    String family(PdfObject definition, int depth) {
        PdfObject cs = PdfValues.resolve(definition, maxResolveDepth);
        if (cs instanceof PdfName name) {
            return name.getValue();
        }
        if (!(cs instanceof PdfArray array) || array.isEmpty()) {
            return "Unknown";
        }
        PdfObject head = PdfValues.element(array, 0);
        if (!(head instanceof PdfName family)) {
            return "Unknown";
        }
        if (PdfName.ICCBased.equals(family)) {
            PdfObject profile = PdfValues.element(array, 1);
            if (profile instanceof PdfDictionary dict
                    && dict.get(PdfName.N) instanceof PdfNumber n) {
                return switch (n.intValue()) {
                    case 1 -> DEVICE_GRAY;
                    case 3 -> DEVICE_RGB;
                    case 4 -> DEVICE_CMYK;
                    default -> family.getValue();
                };
            }
            return family.getValue();
        }
        if (PdfName.Indexed.equals(family) && depth < maxResolveDepth) {
            PdfObject base = PdfValues.element(array, 1);
            return base == null ? family.getValue() : family(base, depth + 1);
        }
        return family.getValue();
    }
}
