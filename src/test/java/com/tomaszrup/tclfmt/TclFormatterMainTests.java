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
package com.tomaszrup.tclfmt;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

/**
 * Tests for the command-line front end: argument handling, exit codes and
 * the messages printed for each file.
 */
class TclFormatterMainTests {

	@TempDir
	Path tempDir;

	private ByteArrayOutputStream outBytes;
	private ByteArrayOutputStream errBytes;
	private ch.qos.logback.classic.Logger rootLogger;
	private Level originalLevel;

	@BeforeEach
	void setup() {
		outBytes = new ByteArrayOutputStream();
		errBytes = new ByteArrayOutputStream();
		rootLogger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
		originalLevel = rootLogger.getLevel();
	}

	@AfterEach
	void tearDown() {
		rootLogger.setLevel(originalLevel);
	}

	// ------------------------------------------------------------------
	// Arguments
	// ------------------------------------------------------------------

	@Test
	void testNoArgumentsPrintsUsage() {
		int exitCode = run();

		Assertions.assertEquals(TclFormatterMain.EXIT_USAGE, exitCode);
		Assertions.assertTrue(err().contains("Usage: tcl-formatter"));
	}

	@Test
	void testHelp() {
		int exitCode = run("--help");

		Assertions.assertEquals(TclFormatterMain.EXIT_OK, exitCode);
		Assertions.assertTrue(out().contains("--expand-lists"));
	}

	@Test
	void testVersion() {
		Assertions.assertEquals(TclFormatterMain.EXIT_OK, run("--version"));
		Assertions.assertTrue(out().contains("tcl-formatter 0.1.0"));
	}

	@Test
	void testUnknownOption() {
		int exitCode = run("--tabs", "script.tcl");

		Assertions.assertEquals(TclFormatterMain.EXIT_USAGE, exitCode);
		Assertions.assertTrue(err().contains("Unknown option"));
		Assertions.assertTrue(err().contains("--tabs"));
	}

	@Test
	void testMissingOptionValue() {
		Assertions.assertEquals(TclFormatterMain.EXIT_USAGE, run("script.tcl", "--indent"));
	}

	@Test
	void testNonNumericIndent() {
		Assertions.assertEquals(TclFormatterMain.EXIT_USAGE, run("--indent", "wide", "script.tcl"));
	}

	@Test
	void testNegativeIndentIsRejected() throws IOException {
		Path script = write("script.tcl", "puts hi\n");

		Assertions.assertEquals(TclFormatterMain.EXIT_USAGE, run("--indent", "-1", script.toString()));
		Assertions.assertFalse(Files.exists(tempDir.resolve("script_formatted.tcl")));
	}

	// ------------------------------------------------------------------
	// Formatting files
	// ------------------------------------------------------------------

	@Test
	void testFormatsValidFile() throws IOException {
		Path script = write("script.tcl", "if {1} {\nputs hi\n}\n");

		int exitCode = run(script.toString());

		Path output = tempDir.resolve("script_formatted.tcl");
		Assertions.assertEquals(TclFormatterMain.EXIT_OK, exitCode);
		Assertions.assertTrue(out().contains("Successfully formatted to " + output));
		Assertions.assertEquals("if {1} {\n  puts hi\n}\n", Files.readString(output, StandardCharsets.UTF_8));
	}

	@Test
	void testReportsSyntaxErrors() throws IOException {
		Path script = write("broken.tcl", "if {1} {\nputs hi\n");

		int exitCode = run(script.toString());

		Path errorLog = tempDir.resolve("errors.log");
		Assertions.assertEquals(TclFormatterMain.EXIT_SYNTAX_ERRORS, exitCode);
		Assertions.assertTrue(out().contains("Syntax validation failed with 1 error(s). See " + errorLog));
		Assertions.assertTrue(out().contains("Found 1 error(s)."));
		Assertions.assertEquals("Line 1: Unmatched opening brace\n",
				Files.readString(errorLog, StandardCharsets.UTF_8));
	}

	@Test
	void testMissingFile() {
		int exitCode = run(tempDir.resolve("nope.tcl").toString());

		Assertions.assertEquals(TclFormatterMain.EXIT_USAGE, exitCode);
		Assertions.assertTrue(err().contains("nope.tcl"));
	}

	@Test
	void testContinuesAfterFailingFile() throws IOException {
		Path good = write("good.tcl", "puts ok\n");

		int exitCode = run(tempDir.resolve("nope.tcl").toString(), good.toString());

		Assertions.assertEquals(TclFormatterMain.EXIT_USAGE, exitCode);
		Assertions.assertTrue(Files.exists(tempDir.resolve("good_formatted.tcl")));
	}

	@Test
	void testFlagsEnableAlignmentAndIndent() throws IOException {
		Path script = write("vars.tcl", "proc p {} {\nset a 1\nset bbb 2\n}\n");

		int exitCode = run("--align", "--indent", "4", script.toString());

		Assertions.assertEquals(TclFormatterMain.EXIT_OK, exitCode);
		Assertions.assertEquals("proc p {} {\n    set a   1\n    set bbb 2\n}\n",
				Files.readString(tempDir.resolve("vars_formatted.tcl"), StandardCharsets.UTF_8));
	}

	@Test
	void testCommandLineOverridesConfigFile() throws IOException {
		Path config = write("tclfmt.json", "{\"indentUnit\": 8, \"alignAssignments\": true}");
		Path script = write("vars.tcl", "proc p {} {\nset a 1\nset bbb 2\n}\n");

		int exitCode = run("--config", config.toString(), "--indent", "3", script.toString());

		Assertions.assertEquals(TclFormatterMain.EXIT_OK, exitCode);
		Assertions.assertEquals("proc p {} {\n   set a   1\n   set bbb 2\n}\n",
				Files.readString(tempDir.resolve("vars_formatted.tcl"), StandardCharsets.UTF_8));
	}

	@Test
	void testLogLevelFlagOverridesConfigFile() throws IOException {
		Path config = write("tclfmt.json", "{\"logLevel\": \"ERROR\"}");
		Path script = write("script.tcl", "puts hi\n");

		int exitCode = run("--config", config.toString(), "--log-level", "DEBUG", script.toString());

		Assertions.assertEquals(TclFormatterMain.EXIT_OK, exitCode);
		Assertions.assertEquals(Level.DEBUG, rootLogger.getLevel());
	}

	@Test
	void testConfigLogLevelAppliesWithoutFlag() throws IOException {
		Path config = write("tclfmt.json", "{\"logLevel\": \"ERROR\"}");
		Path script = write("script.tcl", "puts hi\n");

		run("--config", config.toString(), script.toString());

		Assertions.assertEquals(Level.ERROR, rootLogger.getLevel());
	}

	@Test
	void testUnreadableConfigFile() throws IOException {
		Path script = write("script.tcl", "puts hi\n");

		int exitCode = run("--config", tempDir.resolve("missing.json").toString(), script.toString());

		Assertions.assertEquals(TclFormatterMain.EXIT_USAGE, exitCode);
		Assertions.assertFalse(Files.exists(tempDir.resolve("script_formatted.tcl")));
	}

	private int run(String... args) {
		PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8);
		PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8);
		return TclFormatterMain.run(args, out, err);
	}

	private String out() {
		return outBytes.toString(StandardCharsets.UTF_8);
	}

	private String err() {
		return errBytes.toString(StandardCharsets.UTF_8);
	}

	private Path write(String name, String content) throws IOException {
		Path file = tempDir.resolve(name);
		Files.writeString(file, content, StandardCharsets.UTF_8);
		return file;
	}
}
