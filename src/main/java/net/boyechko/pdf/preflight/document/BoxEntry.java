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

import com.itextpdf.kernel.pdf.PdfIndirectReference;
import com.itextpdf.kernel.pdf.PdfNumber;
import com.itextpdf.kernel.pdf.PdfObject;

/**
 * One raw entry of a page box array. Box arrays are supposed to hold four numbers, but real files
 * also contain indirect references and other junk; each kind coerces to a coordinate its own way.
 */
public sealed interface BoxEntry permits BoxEntry.Numeric, BoxEntry.Reference, BoxEntry.Other {

    /** Returns the coordinate this entry contributes to the box. */
    double coerce();

    record Numeric(double value) implements BoxEntry {
        @Override
        public double coerce() {
            return value;
        }
    }

    /** An unresolved indirect reference. Box resolution never follows these. */
    record Reference(int objNum, int genNum) implements BoxEntry {
        @Override
        public double coerce() {
            return 0;
        }
    }

    record Other(String kind) implements BoxEntry {
        @Override
        public double coerce() {
            return 0;
        }
    }

    /** Classifies a raw (unresolved) array element. */
    static BoxEntry of(PdfObject obj) {
        if (obj instanceof PdfNumber number) {
            return new Numeric(number.doubleValue());
        }
        if (obj instanceof PdfIndirectReference ref) {
            return new Reference(ref.getObjNumber(), ref.getGenNumber());
        }
        return new Other(obj == null ? "null" : obj.getClass().getSimpleName());
    }
}
