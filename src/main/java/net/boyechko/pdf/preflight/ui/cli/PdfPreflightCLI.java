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

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.ExecutionException;
import net.boyechko.pdf.preflight.core.AnalysisHandle;
import net.boyechko.pdf.preflight.core.IntakeRejectedException;
import net.boyechko.pdf.preflight.core.PreflightFailure;
import net.boyechko.pdf.preflight.core.PreflightService;
import net.boyechko.pdf.preflight.core.PreflightSettings;
import net.boyechko.pdf.preflight.document.PdfIntake;
import net.boyechko.pdf.preflight.report.PreflightReport;
import net.boyechko.pdf.preflight.ui.LoggingListener;
import net.boyechko.pdf.preflight.ui.PreflightReportWriter;
import net.boyechko.pdf.preflight.ui.VerbosityLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PdfPreflightCLI {
    public static final int EXIT_READY = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_NOT_READY = 2;

    private static Logger logger;

    // Configuration record to hold parsed CLI arguments
    public record CLIConfig(
            Path inputPath,
            String password,
            Path reportPath,
            Path settingsPath,
            VerbosityLevel verbosity) {
        public CLIConfig {
            if (inputPath == null) {
                throw new IllegalArgumentException("Input path is required");
            }
            if (verbosity == null) {
                throw new IllegalArgumentException("Verbosity level is required");
            }
        }
    }

    // Custom exception for CLI errors
    public static class CLIException extends Exception {
        public CLIException(String message) {
            super(message);
        }
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** Runs the CLI and returns the process exit code. */
    static int run(String[] args, PrintStream out, PrintStream err) {
        try {
            if (isHelpRequested(args)) {
                out.println(usageMessage());
                return EXIT_READY;
            }
            CLIConfig config = parseArguments(args);
            return checkFile(config, out, err);
        } catch (CLIException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    static CLIConfig parseArguments(String[] args) throws CLIException {
        if (args.length == 0) {
            throw new CLIException("No input file specified\n" + usageMessage());
        }

        Path inputPath = null;
        String password = null;
        Path reportPath = null;
        Path settingsPath = null;
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "-p", "--password" -> {
                    requireValue(args, i);
                    password = args[++i];
                }
                case "-r", "--report" -> {
                    requireValue(args, i);
                    reportPath = Paths.get(args[++i]);
                }
                case "-s", "--settings" -> {
                    requireValue(args, i);
                    settingsPath = Paths.get(args[++i]);
                }
                case "-q", "--quiet" -> verbosity = VerbosityLevel.QUIET;
                case "-v", "--verbose" -> verbosity = VerbosityLevel.VERBOSE;
                case "-vv", "--debug" -> verbosity = VerbosityLevel.DEBUG;
                default -> {
                    if (args[i].startsWith("-")) {
                        throw new CLIException("Unknown option: " + args[i]);
                    }
                    if (inputPath != null) {
                        throw new CLIException("Multiple input files specified");
                    }
                    inputPath = Paths.get(args[i]);
                }
            }
        }

        if (inputPath == null) {
            throw new CLIException("No input file specified");
        }
        return new CLIConfig(inputPath, password, reportPath, settingsPath, verbosity);
    }

    private static void requireValue(String[] args, int i) throws CLIException {
        if (i + 1 >= args.length) {
            throw new CLIException("Value not specified after " + args[i]);
        }
    }

    private static int checkFile(CLIConfig config, PrintStream out, PrintStream err)
            throws CLIException {
        LoggingListener listener = LoggingListener.withConsoleOutput();
        LoggingListener.setRootLevel(config.verbosity().logLevel());

        if (!Files.isRegularFile(config.inputPath())) {
            throw new CLIException("File not found: " + config.inputPath());
        }
        String fileName = config.inputPath().getFileName().toString();
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(config.inputPath());
            PdfIntake.validate(fileName, bytes);
        } catch (IOException e) {
            throw new CLIException("Cannot read " + config.inputPath() + ": " + e.getMessage());
        } catch (IntakeRejectedException e) {
            throw new CLIException(e.getMessage());
        }

        PreflightSettings settings = loadSettings(config.settingsPath());
        PreflightReport report;
        try (PreflightService service =
                PreflightService.builder()
                        .withListener(listener)
                        .withSettings(settings)
                        .withPassword(config.password())
                        .build()) {
            AnalysisHandle handle = service.analyse(bytes, fileName);
            try {
                report = handle.result().get();
            } catch (ExecutionException e) {
                PreflightFailure failure = service.failure();
                String message =
                        failure != null ? failure.userMessage() : e.getCause().getMessage();
                err.println("✗ " + message);
                logger().debug("Analysis failed", e.getCause());
                return EXIT_FAILURE;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                err.println("✗ Interrupted");
                return EXIT_FAILURE;
            }
        }

        PreflightReportWriter writer = new PreflightReportWriter(settings.paperSizes());
        if (config.verbosity().isAtLeast(VerbosityLevel.NORMAL)) {
            PrintWriter console = new PrintWriter(out, true, StandardCharsets.UTF_8);
            writer.write(report, console);
        } else {
            out.println(report.isReady() ? "✓ Ready for print" : "✗ Not ready for print");
        }
        if (config.reportPath() != null) {
            try {
                writer.write(report, config.reportPath());
                logger().info("Report saved to {}", config.reportPath());
            } catch (IOException e) {
                err.println("✗ Failed to write report: " + e.getMessage());
                return EXIT_FAILURE;
            }
        }
        return report.isReady() ? EXIT_READY : EXIT_NOT_READY;
    }

    private static PreflightSettings loadSettings(Path settingsPath) throws CLIException {
        if (settingsPath == null) {
            return PreflightSettings.loadDefault();
        }
        try {
            return PreflightSettings.fromFile(settingsPath);
        } catch (IOException | RuntimeException e) {
            throw new CLIException("Cannot load settings " + settingsPath + ": " + e.getMessage());
        }
    }

    private static Logger logger() {
        if (logger == null) {
            logger = LoggerFactory.getLogger(PdfPreflightCLI.class);
        }
        return logger;
    }

    private static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if (arg.equals("-h") || arg.equals("--help")) {
                return true;
            }
        }
        return false;
    }

    private static String usageMessage() {
        return "Usage: pdf-preflight [-q|-v|-vv] [-p password] [-r report] [-s settings] <input.pdf>\n"
                + "  -h, --help             Show this help message\n"
                + "  -p, --password <pw>    Password for encrypted PDFs\n"
                + "  -r, --report <file>    Also save the report to a file\n"
                + "  -s, --settings <file>  Load thresholds and paper sizes from a YAML file\n"
                + "  -q, --quiet            Only show the verdict\n"
                + "  -v, --verbose          Show analysis progress\n"
                + "  -vv, --debug           Show all debug information\n"
                + "Exit codes: 0 ready for print, 2 not ready, 1 failure\n"
                + "Examples:\n"
                + "  pdf-preflight brochure.pdf\n"
                + "  pdf-preflight -r brochure.txt -s press.yaml brochure.pdf";
    }
}
