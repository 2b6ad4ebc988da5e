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

import java.util.Objects;

/**
 * One decoded content-stream operation.
 *
 * @param operator the operator as written in the stream, e.g. {@code "cs"} or {@code "Do"}
 * @param kind what the operation does
 * @param operand the resource name the operator refers to, or null
 * @param colourSpace colour-space family name for colour-space operations, otherwise null
 */
public record PaintOperation(
        String operator, OperationKind kind, String operand, String colourSpace) {

    public PaintOperation {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(kind, "kind");
    }

    public static PaintOperation image(String name) {
        return new PaintOperation("Do", OperationKind.PAINT_IMAGE, name, null);
    }

    public static PaintOperation inlineImage() {
        return new PaintOperation("EI", OperationKind.PAINT_INLINE_IMAGE, null, null);
    }

    public static PaintOperation fillColourSpace(String operator, String colourSpace) {
        return new PaintOperation(operator, OperationKind.SET_FILL_COLOUR_SPACE, null, colourSpace);
    }

    public static PaintOperation strokeColourSpace(String operator, String colourSpace) {
        return new PaintOperation(
                operator, OperationKind.SET_STROKE_COLOUR_SPACE, null, colourSpace);
    }

    public static PaintOperation other(String operator) {
        return new PaintOperation(operator, OperationKind.OTHER, null, null);
    }
}
