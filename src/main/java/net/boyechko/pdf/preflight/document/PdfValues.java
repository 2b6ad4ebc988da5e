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

import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfIndirectReference;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfNumber;
import com.itextpdf.kernel.pdf.PdfObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Explicit access to the PDF object graph. Every lookup reads the raw entry and follows indirect
 * references one hop at a time, up to a fixed depth, instead of relying on eager resolution.
 */
public final class PdfValues {
    private static final Logger logger = LoggerFactory.getLogger(PdfValues.class);

    public static final int DEFAULT_MAX_DEPTH = 8;

    /** Maximum number of /Parent hops when looking up inherited page attributes. */
    private static final int MAX_INHERITANCE_DEPTH = 64;

    private PdfValues() {}

    /** Follows indirect references until a direct object is reached. */
    public static PdfObject resolve(PdfObject obj) {
        return resolve(obj, DEFAULT_MAX_DEPTH);
    }

    /**
     * Follows indirect references until a direct object is reached, giving up after {@code
     * maxDepth} hops. Returns null for null input, dangling references, and chains that are too
     * long.
     */
    public static PdfObject resolve(PdfObject obj, int maxDepth) {
        PdfObject current = obj;
        int hops = 0;
        while (current != null && current.isIndirectReference()) {
            if (hops++ >= maxDepth) {
                logger.debug("Gave up resolving {} after {} hops", obj, maxDepth);
                return null;
            }
            current = ((PdfIndirectReference) current).getRefersTo();
        }
        return current;
    }

    /** Returns the raw (unresolved) value stored under {@code key}. */
    public static PdfObject raw(PdfDictionary dict, PdfName key) {
        return dict == null ? null : dict.get(key, false);
    }

    /** Returns the value stored under {@code key}, resolved. */
    public static PdfObject get(PdfDictionary dict, PdfName key) {
        return resolve(raw(dict, key));
    }

    public static PdfDictionary dict(PdfDictionary dict, PdfName key) {
        return get(dict, key) instanceof PdfDictionary d ? d : null;
    }

    public static PdfArray array(PdfDictionary dict, PdfName key) {
        return get(dict, key) instanceof PdfArray a ? a : null;
    }

    public static PdfName name(PdfDictionary dict, PdfName key) {
        return get(dict, key) instanceof PdfName n ? n : null;
    }

    public static PdfNumber number(PdfDictionary dict, PdfName key) {
        return get(dict, key) instanceof PdfNumber n ? n : null;
    }

    /** Returns the resolved array element at {@code index}, or null when out of range. */
    public static PdfObject element(PdfArray array, int index) {
        if (array == null || index < 0 || index >= array.size()) {
            return null;
        }
        return resolve(array.get(index, false));
    }

    /** Returns the value of {@code key} as a name string, or {@code fallback} if it is not a name. */
    public static String nameValue(PdfDictionary dict, PdfName key, String fallback) {
        PdfName n = name(dict, key);
        return n != null ? n.getValue() : fallback;
    }

    /**
     * Looks up an inheritable page attribute (MediaBox, CropBox, Resources, Rotate), walking up the
     * page tree through /Parent. Returns the raw value found on the nearest node.
     */
    public static PdfObject inherited(PdfDictionary pageDict, PdfName key) {
        PdfDictionary node = pageDict;
        for (int depth = 0; node != null && depth < MAX_INHERITANCE_DEPTH; depth++) {
            PdfObject value = raw(node, key);
            if (value != null) {
                return value;
            }
            node = dict(node, PdfName.Parent);
        }
        return null;
    }
}
