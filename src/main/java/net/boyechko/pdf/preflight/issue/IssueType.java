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
package net.boyechko.pdf.preflight.issue;

/** Represents the type of a printing hazard found in a PDF document. */
public enum IssueType {
    // Document-level issues
    DOCUMENT_ENCRYPTED(IssueCategory.DOCUMENT, "encrypted document"),
    NO_PAGES(IssueCategory.DOCUMENT, "document without pages"),
    LEGACY_VERSION(IssueCategory.DOCUMENT, "legacy format version"),
    CONTENT_ANALYSIS_UNAVAILABLE(IssueCategory.DOCUMENT, "content analysis unavailable"),

    // Geometry issues
    BLEED_BOX_MISSING(IssueCategory.GEOMETRY, "pages without a BleedBox"),
    BLEED_MARGIN_INSUFFICIENT(IssueCategory.GEOMETRY, "pages with insufficient bleed"),
    TRIM_BOX_MISSING(IssueCategory.GEOMETRY, "pages without a TrimBox"),
    PAGE_SIZE_MISMATCH(IssueCategory.GEOMETRY, "pages sized differently from page 1"),

    // Font issues
    FONT_NOT_EMBEDDED(IssueCategory.FONTS, "fonts not embedded"),
    TYPE3_FONT(IssueCategory.FONTS, "Type 3 fonts"),

    // Transparency issues
    TRANSPARENCY_GROUP(IssueCategory.TRANSPARENCY, "pages with a transparency group"),
    TRANSPARENT_GRAPHICS_STATE(IssueCategory.TRANSPARENCY, "graphics states using transparency"),

    // Content issues
    RGB_COLOUR(IssueCategory.COLOUR, "pages using RGB colour"),
    MIXED_COLOUR_SPACES(IssueCategory.COLOUR, "pages mixing RGB and CMYK"),
    IMAGES_PRESENT(IssueCategory.IMAGES, "pages with placed images");

    private final IssueCategory category;
    private final String groupLabel;

    IssueType(IssueCategory category, String groupLabel) {
        this.category = category;
        this.groupLabel = groupLabel;
    }

    public IssueCategory category() {
        return category;
    }

    public String groupLabel() {
        return groupLabel;
    }
}
