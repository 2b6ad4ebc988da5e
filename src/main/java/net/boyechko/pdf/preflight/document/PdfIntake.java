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

import java.util.Locale;
import net.boyechko.pdf.preflight.core.IntakeRejectedException;

/** Cheap checks applied to a candidate file before it is handed to the analysis engine. */
public final class PdfIntake {
    private static final byte[] MAGIC = {'%', 'P', 'D', 'F'};

    private PdfIntake() {}

    /**
     * Rejects files whose name does not end in {@code .pdf} or whose content does not start with
     * the {@code %PDF} header.
     */
    public static void validate(String fileName, byte[] bytes) throws IntakeRejectedException {
        if (fileName == null || !fileName.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
            throw new IntakeRejectedException("Only .pdf files can be checked: " + fileName);
        }
        if (!hasPdfHeader(bytes)) {
            throw new IntakeRejectedException(
                    "File does not start with a PDF header: " + fileName);
        }
    }

    public static boolean hasPdfHeader(byte[] bytes) {
        if (bytes == null || bytes.length < MAGIC.length) {
            return false;
        }
        for (int i = 0; i < MAGIC.length; i++) {
            if (bytes[i] != MAGIC[i]) {
                return false;
            }
        }
        return true;
    }
}
