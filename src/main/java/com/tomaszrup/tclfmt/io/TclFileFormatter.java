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
package com.tomaszrup.tclfmt.io;

import com.tomaszrup.tclfmt.FormatOutcome;
import com.tomaszrup.tclfmt.FormatterOptions;
import com.tomaszrup.tclfmt.TclFormatter;
import com.tomaszrup.tclfmt.util.MdcFileContext;
import com.tomaszrup.tclfmt.validation.Diagnostic;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Formats a script file on disk.
 *
 * <p>The input is decoded with {@link SourceDecoder} and passed to
 * {@link TclFormatter}. Artifacts are written beside the input:</p>
 * <ul>
 *   <li>{@code <stem>_formatted<ext>} with the formatted lines when the
 *       script is valid</li>
 *   <li>{@code errors.log} with one {@code Line <n>: <message>} entry per
 *       diagnostic when it is not</li>
 * </ul>
 * <p>Existing artifacts are overwritten. Storage problems are reported as
 * {@link FileAccessException}; when the input cannot be read no artifact is
 * written.</p>
 */
public class TclFileFormatter {

    private static final Logger logger = LoggerFactory.getLogger(TclFileFormatter.class);

    public static final String ERROR_LOG_NAME = "errors.log";
    static final String FORMATTED_SUFFIX = "_formatted";

    private final TclFormatter formatter;
    private final FormatterOptions options;

    public TclFileFormatter(FormatterOptions options) {
        this(new TclFormatter(), options);
    }

    public TclFileFormatter(TclFormatter formatter, FormatterOptions options) {
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.options = Objects.requireNonNull(options, "options");
    }

    public FileFormattingResult formatFile(Path inputPath) throws FileAccessException {
        Map<String, String> previousMdc = MdcFileContext.setFile(inputPath);
        try {
            List<String> lines = readLines(inputPath);
            logger.debug("Read {} line(s) from {}", lines.size(), inputPath);

            FormatOutcome outcome = formatter.format(lines, options);
            if (!outcome.isFormatted()) {
                Path errorLog = errorLogPath(inputPath);
                writeErrorLog(errorLog, outcome.getDiagnostics());
                logger.info("Wrote {} diagnostic(s) to {}", outcome.getDiagnostics().size(), errorLog);
                return FileFormattingResult.invalid(errorLog, outcome.getDiagnostics());
            }

            Path outputPath = outputPath(inputPath);
            writeLines(outputPath, outcome.getLines());
            logger.info("Wrote formatted output to {}", outputPath);
            return FileFormattingResult.formatted(outputPath);
        } finally {
            MdcFileContext.restore(previousMdc);
        }
    }

    /**
     * {@code dir/name.tcl} becomes {@code dir/name_formatted.tcl}; a name
     * without extension just gets the suffix.
     */
    public static Path outputPath(Path inputPath) {
        String fileName = inputPath.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        String extension = dot > 0 ? fileName.substring(dot) : "";
        return inputPath.resolveSibling(stem + FORMATTED_SUFFIX + extension);
    }

    public static Path errorLogPath(Path inputPath) {
        return inputPath.resolveSibling(ERROR_LOG_NAME);
    }

    private List<String> readLines(Path inputPath) throws FileAccessException {
        if (!Files.isRegularFile(inputPath)) {
            throw new FileAccessException("File not found: " + inputPath, inputPath);
        }
        try {
            byte[] bytes = Files.readAllBytes(inputPath);
            return SourceDecoder.splitLines(SourceDecoder.decode(bytes));
        } catch (IOException e) {
            throw new FileAccessException("Cannot read " + inputPath + ": " + e.getMessage(), inputPath, e);
        }
    }

    private void writeErrorLog(Path errorLog, List<Diagnostic> diagnostics) throws FileAccessException {
        List<String> entries = new ArrayList<>(diagnostics.size());
        for (Diagnostic diagnostic : diagnostics) {
            entries.add(diagnostic.toLogLine());
        }
        writeLines(errorLog, entries);
    }

    private void writeLines(Path target, List<String> lines) throws FileAccessException {
        StringBuilder content = new StringBuilder();
        for (String line : lines) {
            content.append(line).append('\n');
        }
        try {
            Files.writeString(target, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new FileAccessException("Cannot write " + target + ": " + e.getMessage(), target, e);
        }
    }
}
