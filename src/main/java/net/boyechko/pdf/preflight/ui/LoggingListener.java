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
package net.boyechko.pdf.preflight.ui;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import java.util.List;
import net.boyechko.pdf.preflight.core.AnalysisState;
import net.boyechko.pdf.preflight.core.PreflightFailure;
import net.boyechko.pdf.preflight.core.PreflightListener;
import net.boyechko.pdf.preflight.document.Format;
import net.boyechko.pdf.preflight.issue.IssueSev;
import net.boyechko.pdf.preflight.issue.PreflightIssue;
import net.boyechko.pdf.preflight.report.PreflightReport;
import org.slf4j.LoggerFactory;

/** A {@link PreflightListener} that routes all events through SLF4J. */
public class LoggingListener implements PreflightListener {

    private static final String CONSOLE_APPENDER_NAME = "PREFLIGHT_CONSOLE";

    private static final org.slf4j.Logger logger =
            LoggerFactory.getLogger("net.boyechko.pdf.preflight.analysis");

    /** Creates a {@link LoggingListener} and ensures logs are emitted to stderr. */
    public static LoggingListener withConsoleOutput() {
        ensureConsoleAppender();
        return new LoggingListener();
    }

    /** Sets the level of the root logger. */
    public static void setRootLevel(Level level) {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(level);
    }

    private static void ensureConsoleAppender() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ch.qos.logback.classic.Logger root = ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);

        if (root.getAppender(CONSOLE_APPENDER_NAME) != null) {
            return;
        }

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(ctx);
        encoder.setPattern("%-24logger{0} [%-5level] %msg%n");
        encoder.start();

        ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
        console.setName(CONSOLE_APPENDER_NAME);
        console.setContext(ctx);
        console.setTarget("System.err");
        console.setEncoder(encoder);
        console.start();

        root.addAppender(console);
    }

    @Override
    public void onPhaseStart(String phaseName) {
        logger.info("PHASE {}", phaseName);
    }

    @Override
    public void onSuccess(String message) {
        logger.info("OK {}", message);
    }

    @Override
    public void onWarning(String message) {
        logger.warn("{}", message);
    }

    @Override
    public void onError(String message) {
        logger.error("{}", message);
    }

    @Override
    public void onInfo(String message) {
        logger.info("{}", message);
    }

    @Override
    public void onVerboseOutput(String message) {
        logger.debug("{}", message);
    }

    @Override
    public void onPageAnalysed(AnalysisState phase, int pageNum, int pageCount) {
        logger.debug("{}: page {} of {}", phase.label(), pageNum, pageCount);
    }

    @Override
    public void onStructuralReport(PreflightReport report) {
        logger.info(
                "STRUCTURE {} pages, {} fonts, {} issues so far",
                report.pageCount(),
                report.fonts().size(),
                report.issues().size());
    }

    @Override
    public void onReport(PreflightReport report) {
        logger.info(
                "SUMMARY errors={} warnings={} info={} ready={}",
                report.errorCount(),
                report.warningCount(),
                report.infoCount(),
                report.isReady());
    }

    @Override
    public void onFailure(PreflightFailure failure) {
        logger.error("FAILED {}: {} ({})", failure.fileName(), failure.userMessage(), failure.detail());
    }

    @Override
    public void onCancelled(String fileName) {
        logger.info("CANCELLED {}", fileName);
    }

    @Override
    public void onIssueGroup(String groupLabel, List<PreflightIssue> issues) {
        logger.info("{} {}", issues.size(), groupLabel);
        for (PreflightIssue issue : issues) {
            logIssue(issue);
        }
    }

    private static void logIssue(PreflightIssue issue) {
        String message = "ISSUE " + issue.type() + ": " + issue.message() + Format.loc(issue);
        IssueSev severity = issue.severity();
        if (severity == IssueSev.INFO) {
            logger.info("{}", message);
        } else if (severity == IssueSev.WARNING) {
            logger.warn("{}", message);
        } else {
            logger.error("{}", message);
        }
    }
}
