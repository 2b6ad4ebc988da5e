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

import java.awt.image.BufferedImage;
import java.io.Closeable;
import java.io.IOException;

/** An open document that can render page bitmaps. Closing releases the renderer's document. */
public interface RenderSession extends Closeable {
    int pageCount();

    /**
     * Renders a page at the given scale, where 1.0 is one pixel per point.
     *
     * @param pageNumber 1-based page number
     */
    BufferedImage render(int pageNumber, float scale) throws IOException;
}
