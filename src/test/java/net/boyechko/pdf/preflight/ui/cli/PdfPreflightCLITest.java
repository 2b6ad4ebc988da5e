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
package net.boyechko.pdf.preflight.ui.cli;

import static org.junit.jupiter.api.Assertions.*;

import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfPage;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import net.boyechko.pdf.preflight.PdfTestBase;
import net.boyechko.pdf.preflight.ui.VerbosityLevel;
import org.junit.jupiter.api.Test;

class PdfPreflightCLITest extends PdfTestBase {
    private final ByteArrayOutputStream outBuffer = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBuffer = new ByteArrayOutputStream();

    private int run(String... args) {
        return PdfPreflightCLI.run(
                args,
                new PrintStream(outBuffer, true, StandardCharsets.UTF_8),
                new PrintStream(errBuffer, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return outBuffer.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBuffer.toString(StandardCharsets.UTF_8);
    }

    private Path writePdf(String name, byte[] bytes) throws Exception {
        Path file = tempDir.resolve(name);
        Files.write(file, bytes);
        return file;
    }

    private Path readyPdf() throws Exception {
        return writePdf(
                "ready.pdf",
                createPdf(
                        pdfDoc -> {
                            PdfPage page = addPage(pdfDoc, "0 0 0 1 k 0 0 100 100 re f");
                            setTrimAndBleed(page, 9);
                        }));
    }

    @Test
    void parsesOptions() throws Exception {
        PdfPreflightCLI.CLIConfig config =
                PdfPreflightCLI.parseArguments(
                        new String[] {"-p", "pw", "-r", "out.txt", "-s", "press.yaml", "-v", "in.pdf"});

        assertEquals(Path.of("in.pdf"), config.inputPath());
        assertEquals("pw", config.password());
        assertEquals(Path.of("out.txt"), config.reportPath());
        assertEquals(Path.of("press.yaml"), config.settingsPath());
        assertEquals(VerbosityLevel.VERBOSE, config.verbosity());
    }

    @Test
    void rejectsBadArguments() {
        assertThrows(
                PdfPreflightCLI.CLIException.class,
                () -> PdfPreflightCLI.parseArguments(new String[] {}));
        assertThrows(
                PdfPreflightCLI.CLIException.class,
                () -> PdfPreflightCLI.parseArguments(new String[] {"--bogus", "a.pdf"}));
        assertThrows(
                PdfPreflightCLI.CLIException.class,
                () -> PdfPreflightCLI.parseArguments(new String[] {"a.pdf", "b.pdf"}));
        assertThrows(
                PdfPreflightCLI.CLIException.class,
                () -> PdfPreflightCLI.parseArguments(new String[] {"a.pdf", "-p"}));
    }

    @Test
    void helpExitsCleanly() {
        assertEquals(PdfPreflightCLI.EXIT_READY, run("--help"));
        assertTrue(out().startsWith("Usage: pdf-preflight"), out());
    }

    @Test
    void readyDocumentExitsWithZero() throws Exception {
        Path report = tempDir.resolve("reports/ready.txt");
        int exit = run("-r", report.toString(), readyPdf().toString());

        assertEquals(PdfPreflightCLI.EXIT_READY, exit, err());
        assertTrue(out().contains("READY FOR PRINT"), out());
        assertTrue(Files.exists(report), "Report file should be written");
    }

    @Test
    void documentWithErrorsExitsWithTwo() throws Exception {
        Path pdf =
                writePdf(
                        "fonts.pdf",
                        createPdf(
                                pdfDoc -> {
                                    PdfPage page = addPage(pdfDoc, "0 g 0 0 10 10 re f");
                                    resourceCategory(page, PdfName.Font)
                                            .put(
                                                    new PdfName("F1"),
                                                    simpleFont("TrueType", "CustomSans"));
                                }));

        assertEquals(PdfPreflightCLI.EXIT_NOT_READY, run("-q", pdf.toString()));
        assertTrue(out().contains("Not ready for print"), out());
    }

    @Test
    void unreadableDocumentExitsWithOne() throws Exception {
        Path pdf =
                writePdf("broken.pdf", "%PDF-1.4 truncated".getBytes(StandardCharsets.US_ASCII));

        assertEquals(PdfPreflightCLI.EXIT_FAILURE, run("-q", pdf.toString()));
        assertTrue(err().contains("could not be read as a PDF"), err());
    }

    @Test
    void nonPdfInputIsRejected() throws Exception {
        Path png = writePdf("image.png", new byte[] {(byte) 0x89, 'P', 'N', 'G'});

        assertEquals(PdfPreflightCLI.EXIT_FAILURE, run(png.toString()));
        assertTrue(err().startsWith("Error: Only .pdf files"), err());
    }

    @Test
    void missingFileIsReported() {
        assertEquals(
                PdfPreflightCLI.EXIT_FAILURE, run(tempDir.resolve("absent.pdf").toString()));
        assertTrue(err().contains("File not found"), err());
    }
}
