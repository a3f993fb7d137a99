////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.tclfmt;

import com.tomaszrup.tclfmt.io.FileAccessException;
import com.tomaszrup.tclfmt.io.FileFormattingResult;
import com.tomaszrup.tclfmt.io.TclFileFormatter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line front end: {@code tcl-formatter [options] <file>...}
 *
 * <p>Each file is formatted independently; a failure on one file does not
 * stop the others. The process exit code is the worst outcome seen.</p>
 */
@Command(
        name = "tcl-formatter",
        mixinStandardHelpOptions = true,
        version = "tcl-formatter 0.1.0",
        description = "Re-indents Tcl scripts and checks that braces and quotes are balanced.",
        footer = {
                "",
                "Writes <name>_formatted<ext> next to each input, or errors.log when the",
                "input has unbalanced braces or quotes."
        })
public final class TclFormatterMain implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(TclFormatterMain.class);

    static final int EXIT_OK = CommandLine.ExitCode.OK;
    static final int EXIT_SYNTAX_ERRORS = 1;
    static final int EXIT_USAGE = CommandLine.ExitCode.USAGE;

    // Option fields stay null when the flag is absent so the config file can supply them.

    @Option(names = "--align", description = "Align the values of consecutive 'set' statements.")
    private Boolean alignAssignments;

    @Option(names = "--expand-lists", description = "Expand long single-line lists, one item per line.")
    private Boolean expandLists;

    @Option(names = "--strict-indent", description = "Strict indentation of continuation lines.")
    private Boolean strictContinuationIndent;

    @Option(names = "--indent", paramLabel = "<n>", description = "Indent unit in spaces (default 2).")
    private Integer indentUnit;

    @Option(names = "--threshold", paramLabel = "<n>",
            description = "Line length above which lists are expanded (default 80).")
    private Integer listExpansionThreshold;

    @Option(names = "--config", paramLabel = "<file>",
            description = "JSON options file; command-line flags take precedence.")
    private Path configFile;

    @Option(names = "--log-level", paramLabel = "<level>", description = "ERROR, WARN, INFO, DEBUG or TRACE.")
    private String logLevel;

    @Parameters(arity = "1..*", paramLabel = "<file>", description = "Scripts to format.")
    private List<Path> files;

    @Spec
    private CommandSpec spec;

    public static void main(String[] args) {
        Thread.setDefaultUncaughtExceptionHandler((thread, throwable) -> {
            System.err.println("[FATAL] Uncaught exception on thread " + thread.getName());
            throwable.printStackTrace(System.err);
            logger.error("Uncaught exception on thread {}: {}",
                    thread.getName(), throwable.getMessage(), throwable);
            Runtime.getRuntime().halt(EXIT_USAGE);
        });

        System.exit(run(args, System.out, System.err));
    }

    /**
     * Run the formatter over the files named in {@code args}.
     *
     * @return the process exit code
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        return new CommandLine(new TclFormatterMain())
                .setOut(new PrintWriter(out, true))
                .setErr(new PrintWriter(err, true))
                .execute(args);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        FormatterOptions options = FormatterOptions.defaults();
        if (configFile != null) {
            try {
                options = FormatterOptionsParser.parseFile(configFile, options);
            } catch (FileAccessException e) {
                err.println("Error: " + e.getMessage());
                return EXIT_USAGE;
            }
        }
        // after the config file, so its logLevel cannot override the flag
        if (logLevel != null) {
            FormatterOptionsParser.applyLogLevel(logLevel);
        }
        try {
            options = applyFlags(options);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }
        logger.debug("Effective options: {}", options);

        TclFileFormatter fileFormatter = new TclFileFormatter(options);
        int exitCode = EXIT_OK;
        for (Path file : files) {
            try {
                FileFormattingResult result = fileFormatter.formatFile(file);
                out.println(result.getMessage());
                if (!result.isSuccess()) {
                    out.println("Found " + result.getDiagnostics().size() + " error(s).");
                    exitCode = Math.max(exitCode, EXIT_SYNTAX_ERRORS);
                }
            } catch (FileAccessException e) {
                logger.debug("File access failed for {}", e.getPath(), e);
                err.println("Error: " + e.getMessage());
                exitCode = EXIT_USAGE;
            }
        }
        return exitCode;
    }

    private FormatterOptions applyFlags(FormatterOptions options) {
        FormatterOptions result = options;
        if (alignAssignments != null) {
            result = result.withAlignAssignments(alignAssignments);
        }
        if (expandLists != null) {
            result = result.withExpandLists(expandLists);
        }
        if (strictContinuationIndent != null) {
            result = result.withStrictContinuationIndent(strictContinuationIndent);
        }
        if (indentUnit != null) {
            result = result.withIndentUnit(indentUnit);
        }
        if (listExpansionThreshold != null) {
            result = result.withListExpansionThreshold(listExpansionThreshold);
        }
        return result;
    }
}
