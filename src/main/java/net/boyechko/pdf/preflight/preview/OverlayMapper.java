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
package net.boyechko.pdf.preflight.preview;

import net.boyechko.pdf.preflight.report.PageBox;
import net.boyechko.pdf.preflight.report.PageInfo;

/**
 * Maps page boxes from document space (origin bottom left, in points) to bitmap space (origin top
 * left, in pixels) for a page rendered at a given scale.
 */
public final class OverlayMapper {
    private OverlayMapper() {}

    public static ScreenRect map(PageBox box, PageBox media, double scale, int bitmapHeight) {
        double x = (box.x() - media.x()) * scale;
        double y = bitmapHeight - (box.y() + box.height() - media.y()) * scale;
        return new ScreenRect(x, y, box.width() * scale, box.height() * scale);
    }

    public static PageOverlay overlay(PageInfo page, double scale, int bitmapHeight) {
        PageBox media = page.mediaBox();
        return new PageOverlay(
                map(media, media, scale, bitmapHeight),
                page.trim().map(box -> map(box, media, scale, bitmapHeight)).orElse(null),
                page.bleed().map(box -> map(box, media, scale, bitmapHeight)).orElse(null),
                page.crop().map(box -> map(box, media, scale, bitmapHeight)).orElse(null));
    }
}
