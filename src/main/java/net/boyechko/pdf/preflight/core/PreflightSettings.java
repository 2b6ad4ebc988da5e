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
package net.boyechko.pdf.preflight.core;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.preflight.document.PaperSizes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Thresholds and limits used by the analysers, bound from YAML. Any key missing from the YAML
 * keeps its built-in default.
 */
public final class PreflightSettings {
    private static final String DEFAULT_SETTINGS_RESOURCE = "/preflight.yaml";
    private static final Logger logger = LoggerFactory.getLogger(PreflightSettings.class);

    /** Smallest acceptable distance between TrimBox and BleedBox on any side (about 3mm). */
    public Double min_bleed_margin_pt = 8.5;

    /** Pages whose MediaBox differs from page 1 by more than this are reported. */
    public Double page_size_tolerance_pt = 1.0;

    /** Render scale of the preview bitmap; 1.0 renders at 72 dpi. */
    public Double preview_scale = 1.0;

    /** 1-based number of the page rendered as preview. */
    public Integer preview_page = 1;

    /** Maximum indirect-reference hops followed from any access site. */
    public Integer max_resolve_depth = 8;

    /** Maximum nesting of Form XObjects followed when building operator lists. */
    public Integer max_form_depth = 8;

    /** Known paper sizes, used to name page sizes in reports. */
    public List<PaperSize> paper_sizes = new ArrayList<>();

    public static final class PaperSize {
        public String label;
        public Double width_mm;
        public Double height_mm;
    }

    /** Returns the built-in defaults without reading any resource. */
    public static PreflightSettings builtIn() {
        return new PreflightSettings();
    }

    /** Loads the settings bundled with the application. */
    public static PreflightSettings loadDefault() {
        return fromResource(DEFAULT_SETTINGS_RESOURCE);
    }

    /**
     * Load settings from a classpath resource (e.g., from src/main/resources/)
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static PreflightSettings fromResource(String resourcePath) {
        try (InputStream in = PreflightSettings.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }
            PreflightSettings settings = parse(in);
            logger.debug(
                    "Loaded settings with {} paper sizes from resource {}",
                    settings.paper_sizes.size(),
                    resourcePath);
            return settings;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings resource " + resourcePath, e);
        }
    }

    /** Loads settings from a YAML file on disk. */
    public static PreflightSettings fromFile(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            PreflightSettings settings = parse(in);
            logger.debug("Loaded settings from {}", path);
            return settings;
        }
    }

    private static PreflightSettings parse(InputStream in) {
        Yaml yaml = new Yaml(new Constructor(PreflightSettings.class, new LoaderOptions()));
        PreflightSettings settings = yaml.load(in);
        if (settings == null) {
            settings = new PreflightSettings();
        }
        settings.validate();
        return settings;
    }

    private void validate() {
        if (min_bleed_margin_pt == null || min_bleed_margin_pt < 0) {
            throw new IllegalArgumentException("min_bleed_margin_pt must be zero or more");
        }
        if (page_size_tolerance_pt == null || page_size_tolerance_pt < 0) {
            throw new IllegalArgumentException("page_size_tolerance_pt must be zero or more");
        }
        if (preview_scale == null || preview_scale <= 0) {
            throw new IllegalArgumentException("preview_scale must be positive");
        }
        if (preview_page == null || preview_page < 1) {
            throw new IllegalArgumentException("preview_page must be 1 or more");
        }
        if (max_resolve_depth == null || max_resolve_depth < 1) {
            throw new IllegalArgumentException("max_resolve_depth must be 1 or more");
        }
        if (max_form_depth == null || max_form_depth < 0) {
            throw new IllegalArgumentException("max_form_depth must be zero or more");
        }
        if (paper_sizes == null) {
            paper_sizes = new ArrayList<>();
        }
    }

    public double minBleedMarginPt() {
        return min_bleed_margin_pt;
    }

    public double pageSizeTolerancePt() {
        return page_size_tolerance_pt;
    }

    public float previewScale() {
        return preview_scale.floatValue();
    }

    public int previewPage() {
        return preview_page;
    }

    public int maxResolveDepth() {
        return max_resolve_depth;
    }

    public int maxFormDepth() {
        return max_form_depth;
    }

    /** Returns the paper-size catalog described by these settings. */
    public PaperSizes paperSizes() {
        List<PaperSizes.Paper> papers = new ArrayList<>();
        for (PaperSize size : paper_sizes) {
            if (size.label == null || size.width_mm == null || size.height_mm == null) {
                logger.warn("Ignoring incomplete paper size entry {}", size.label);
                continue;
            }
            papers.add(new PaperSizes.Paper(size.label, size.width_mm, size.height_mm));
        }
        return new PaperSizes(papers);
    }
}
