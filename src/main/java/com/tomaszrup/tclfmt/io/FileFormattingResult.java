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

import com.tomaszrup.tclfmt.validation.Diagnostic;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable result of {@link TclFileFormatter#formatFile(Path)}.
 *
 * <p>A successful result carries the path of the formatted file; a failed
 * one carries the path of the error log and the diagnostics written to it.</p>
 */
public final class FileFormattingResult {

    private final boolean success;
    private final Path outputPath;
    private final Path errorLogPath;
    private final List<Diagnostic> diagnostics;
    private final String message;

    private FileFormattingResult(boolean success, Path outputPath, Path errorLogPath,
                                 List<Diagnostic> diagnostics, String message) {
        this.success = success;
        this.outputPath = outputPath;
        this.errorLogPath = errorLogPath;
        this.diagnostics = Collections.unmodifiableList(new ArrayList<>(diagnostics));
        this.message = message;
    }

    static FileFormattingResult formatted(Path outputPath) {
        return new FileFormattingResult(true, outputPath, null, Collections.emptyList(),
                "Successfully formatted to " + outputPath);
    }

    static FileFormattingResult invalid(Path errorLogPath, List<Diagnostic> diagnostics) {
        return new FileFormattingResult(false, null, errorLogPath, diagnostics,
                "Syntax validation failed with " + diagnostics.size() + " error(s). See " + errorLogPath);
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * The formatted file, or {@code null} when validation failed.
     */
    public Path getOutputPath() {
        return outputPath;
    }

    /**
     * The error log, or {@code null} when formatting succeeded.
     */
    public Path getErrorLogPath() {
        return errorLogPath;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /**
     * Short human-readable summary of the outcome.
     */
    public String getMessage() {
        return message;
    }
}
