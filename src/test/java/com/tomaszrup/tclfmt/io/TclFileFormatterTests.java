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
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.tclfmt.io;

import com.tomaszrup.tclfmt.FormatterOptions;
import com.tomaszrup.tclfmt.util.MdcFileContext;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link TclFileFormatter}: artifact naming, output and error
 * log contents, and storage failures.
 */
class TclFileFormatterTests {

    @TempDir
    Path tempDir;

    private TclFileFormatter fileFormatter;

    @BeforeEach
    void setUp() {
        MDC.clear();
        fileFormatter = new TclFileFormatter(FormatterOptions.defaults());
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    // ---- Output naming ----

    @Test
    void outputPathInsertsSuffixBeforeExtension() {
        assertEquals(Paths.get("dir", "script_formatted.tcl"), TclFileFormatter.outputPath(Paths.get("dir", "script.tcl")));
        assertEquals(Paths.get("a.b_formatted.tcl"), TclFileFormatter.outputPath(Paths.get("a.b.tcl")));
    }

    @Test
    void outputPathWithoutExtension() {
        assertEquals(Paths.get("Makefile_formatted"), TclFileFormatter.outputPath(Paths.get("Makefile")));
        assertEquals(Paths.get(".tclshrc_formatted"), TclFileFormatter.outputPath(Paths.get(".tclshrc")));
    }

    @Test
    void errorLogPathIsBesideInput() {
        assertEquals(Paths.get("dir", "errors.log"), TclFileFormatter.errorLogPath(Paths.get("dir", "script.tcl")));
    }

    // ---- Valid input ----

    @Test
    void validInputWritesFormattedFile() throws IOException, FileAccessException {
        Path input = write("script.tcl", "proc p {} {\nputs hi\n}\n");

        FileFormattingResult result = fileFormatter.formatFile(input);

        Path output = tempDir.resolve("script_formatted.tcl");
        assertTrue(result.isSuccess());
        assertEquals(output, result.getOutputPath());
        assertNull(result.getErrorLogPath());
        assertTrue(result.getDiagnostics().isEmpty());
        assertEquals("Successfully formatted to " + output, result.getMessage());
        assertEquals("proc p {} {\n  puts hi\n}\n", Files.readString(output, StandardCharsets.UTF_8));
        assertFalse(Files.exists(tempDir.resolve("errors.log")));
    }

    @Test
    void existingOutputIsOverwritten() throws IOException, FileAccessException {
        Path input = write("script.tcl", "puts hi\n");
        write("script_formatted.tcl", "stale content that is much longer than the new output\n");

        fileFormatter.formatFile(input);

        assertEquals("puts hi\n", Files.readString(tempDir.resolve("script_formatted.tcl"), StandardCharsets.UTF_8));
    }

    @Test
    void windowsLineEndingsAreNormalized() throws IOException, FileAccessException {
        Path input = write("crlf.tcl", "if {1} {\r\nputs hi\r\n}\r\n");

        fileFormatter.formatFile(input);

        assertEquals("if {1} {\n  puts hi\n}\n",
                Files.readString(tempDir.resolve("crlf_formatted.tcl"), StandardCharsets.UTF_8));
    }

    @Test
    void byteOrderMarkIsDropped() throws IOException, FileAccessException {
        Path input = tempDir.resolve("bom.tcl");
        byte[] body = "puts ok\n".getBytes(StandardCharsets.UTF_8);
        byte[] bytes = new byte[body.length + 3];
        bytes[0] = (byte) 0xEF;
        bytes[1] = (byte) 0xBB;
        bytes[2] = (byte) 0xBF;
        System.arraycopy(body, 0, bytes, 3, body.length);
        Files.write(input, bytes);

        fileFormatter.formatFile(input);

        assertEquals("puts ok\n", Files.readString(tempDir.resolve("bom_formatted.tcl"), StandardCharsets.UTF_8));
    }

    @Test
    void latin1InputIsWrittenAsUtf8WithoutLoss() throws IOException, FileAccessException {
        Path input = tempDir.resolve("legacy.tcl");
        String script = "proc greet {} {\nputs \"Bonjour, café crème à la française\"\n}\n";
        Files.write(input, script.getBytes(StandardCharsets.ISO_8859_1));

        fileFormatter.formatFile(input);

        String output = Files.readString(tempDir.resolve("legacy_formatted.tcl"), StandardCharsets.UTF_8);
        assertEquals("proc greet {} {\n  puts \"Bonjour, café crème à la française\"\n}\n", output);
        assertEquals(-1, output.indexOf('\uFFFD'));
    }

    @Test
    void optionsArePassedToFormatter() throws IOException, FileAccessException {
        Path input = write("vars.tcl", "set a 1\nset bbb 2\n");
        TclFileFormatter aligning = new TclFileFormatter(FormatterOptions.defaults().withAlignAssignments(true));

        aligning.formatFile(input);

        assertEquals("set a   1\nset bbb 2\n",
                Files.readString(tempDir.resolve("vars_formatted.tcl"), StandardCharsets.UTF_8));
    }

    // ---- Invalid input ----

    @Test
    void invalidInputWritesErrorLog() throws IOException, FileAccessException {
        Path input = write("broken.tcl", "puts \"abc\n}\n");

        FileFormattingResult result = fileFormatter.formatFile(input);

        Path errorLog = tempDir.resolve("errors.log");
        assertFalse(result.isSuccess());
        assertNull(result.getOutputPath());
        assertEquals(errorLog, result.getErrorLogPath());
        assertEquals(2, result.getDiagnostics().size());
        assertEquals("Syntax validation failed with 2 error(s). See " + errorLog, result.getMessage());
        assertEquals("Line 2: Unexpected closing brace, expected closing quote from line 1\n"
                        + "Line 1: Unmatched opening quote\n",
                Files.readString(errorLog, StandardCharsets.UTF_8));
        assertFalse(Files.exists(tempDir.resolve("broken_formatted.tcl")));
    }

    // ---- Storage failures ----

    @Test
    void missingInputRaisesFileAccessException() {
        Path input = tempDir.resolve("missing.tcl");

        FileAccessException e = assertThrows(FileAccessException.class, () -> fileFormatter.formatFile(input));

        assertEquals(input, e.getPath());
        assertFalse(Files.exists(tempDir.resolve("missing_formatted.tcl")));
        assertFalse(Files.exists(tempDir.resolve("errors.log")));
    }

    @Test
    void directoryInputRaisesFileAccessException() throws IOException {
        Path dir = Files.createDirectory(tempDir.resolve("scripts.tcl"));

        assertThrows(FileAccessException.class, () -> fileFormatter.formatFile(dir));
    }

    @Test
    void unwritableDestinationRaisesFileAccessException() throws IOException {
        Path input = write("script.tcl", "puts hi\n");
        // a directory where the output file should go cannot be overwritten
        Files.createDirectory(tempDir.resolve("script_formatted.tcl"));

        FileAccessException e = assertThrows(FileAccessException.class, () -> fileFormatter.formatFile(input));
        assertEquals(tempDir.resolve("script_formatted.tcl"), e.getPath());
    }

    // ---- Logging context ----

    @Test
    void mdcIsRestoredAfterFormatting() throws IOException, FileAccessException {
        Path input = write("script.tcl", "puts hi\n");
        MDC.put(MdcFileContext.MDC_KEY, "outer");

        fileFormatter.formatFile(input);

        assertEquals("outer", MDC.get(MdcFileContext.MDC_KEY));
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
