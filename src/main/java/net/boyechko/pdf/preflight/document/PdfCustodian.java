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
import com.itextpdf.kernel.exceptions.BadPasswordException;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfReader;
import com.itextpdf.kernel.pdf.ReaderProperties;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import net.boyechko.pdf.preflight.core.DocumentParseException;
import net.boyechko.pdf.preflight.core.EncryptedDocumentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Opens in-memory PDF documents for read-only inspection, with an optional user password. */
public final class PdfCustodian {
    private static final Logger logger = LoggerFactory.getLogger(PdfCustodian.class);

    private final byte[] bytes;
    private final String fileName;
    private final ReaderProperties readerProps;

    public PdfCustodian(byte[] bytes, String fileName, String password) {
        this.bytes = bytes;
        this.fileName = fileName;
        this.readerProps = new ReaderProperties();
        if (password != null) {
            this.readerProps.setPassword(password.getBytes(StandardCharsets.UTF_8));
        }
    }

    public PdfCustodian(byte[] bytes, String fileName) {
        this(bytes, fileName, null);
    }

    /**
     * Opens the document without a writer. The caller owns the returned document and must close
     * it.
     *
     * @throws EncryptedDocumentException if the security handler refuses access
     * @throws DocumentParseException if the bytes are not a readable PDF
     */
    public PdfDocument openForReading() throws DocumentParseException, EncryptedDocumentException {
        PdfReader reader = null;
        try {
            reader = new PdfReader(new ByteArrayInputStream(bytes), readerProps);
            PdfDocument pdfDoc = new PdfDocument(reader);
            logger.debug(
                    "Opened {}: version {}, {} pages, encrypted {}",
                    fileName,
                    pdfDoc.getPdfVersion(),
                    pdfDoc.getNumberOfPages(),
                    reader.isEncrypted());
            return pdfDoc;
        } catch (BadPasswordException e) {
            closeQuietly(reader);
            throw new EncryptedDocumentException(fileName, e);
        } catch (ITextException | IOException e) {
            boolean encrypted = reader != null && reader.isEncrypted();
            closeQuietly(reader);
            if (encrypted) {
                throw new EncryptedDocumentException(fileName, e);
            }
            throw new DocumentParseException(fileName, e);
        }
    }

    /** Returns whether the document declares an encryption dictionary. */
    public static boolean isEncrypted(PdfDocument pdfDoc) {
        return pdfDoc.getReader() != null && pdfDoc.getReader().isEncrypted();
    }

    /** Returns the format version the document declares in its header or catalog. */
    public static FormatVersion version(PdfDocument pdfDoc) {
        return FormatVersion.parse(pdfDoc.getPdfVersion().toString());
    }

    private void closeQuietly(PdfReader reader) {
        if (reader == null) {
            return;
        }
        try {
            reader.close();
        } catch (IOException e) {
            logger.debug("Failed to close reader for {}: {}", fileName, e.getMessage());
        }
    }
}
