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
package com.tomaszrup.tclfmt.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that braces and double quotes are balanced, using a single stack of
 * open delimiters shared across the whole input.
 *
 * <p>Lines are folded first (see {@link LineContinuationFolder}), then each
 * logical line is scanned character by character:</p>
 * <ul>
 *   <li>a backslash consumes the character after it, which is never treated
 *       as a delimiter</li>
 *   <li>a quote opens a string when outside one and closes it when inside</li>
 *   <li>braces count only outside strings</li>
 *   <li>comment lines (first non-blank character {@code #}) are skipped</li>
 * </ul>
 *
 * <p>String state is local to a line; only the stack carries over. When a
 * closer meets an opener of the other kind, the mismatch is reported and the
 * opener is put back, so one mistake does not cascade into diagnostics for
 * every closer that follows.</p>
 *
 * <p>Instances are stateless and may be shared between threads.</p>
 */
public class DelimiterValidator {

	private static final Logger logger = LoggerFactory.getLogger(DelimiterValidator.class);

	/**
	 * Mutable state of one validation run.
	 */
	private static final class ScanContext {
		private final List<DelimiterFrame> stack = new ArrayList<>();
		private final List<Diagnostic> diagnostics = new ArrayList<>();
	}

	/**
	 * Fold continuation lines and validate the result.
	 *
	 * @param physicalLines the raw lines, without terminators
	 * @return diagnostics in discovery order; empty when the text is balanced
	 */
	public List<Diagnostic> validate(List<String> physicalLines) {
		return validateFolded(LineContinuationFolder.fold(physicalLines));
	}

	/**
	 * Validate lines that were already folded.
	 */
	public List<Diagnostic> validateFolded(List<SourceLine> lines) {
		ScanContext context = new ScanContext();
		for (SourceLine line : lines) {
			scanLine(line, context);
		}
		reportUnclosed(context);
		if (!context.diagnostics.isEmpty()) {
			logger.debug("Delimiter validation found {} problem(s) in {} line(s)",
					context.diagnostics.size(), lines.size());
		}
		return Collections.unmodifiableList(context.diagnostics);
	}

	private void scanLine(SourceLine line, ScanContext context) {
		String text = line.getText();
		if (isComment(text)) {
			return;
		}

		boolean insideString = false;
		int i = 0;
		while (i < text.length()) {
			char c = text.charAt(i);
			if (c == '\\' && i + 1 < text.length()) {
				i += 2;
				continue;
			}
			if (c == '"') {
				if (insideString) {
					closeQuote(line.getNumber(), context);
					insideString = false;
				} else {
					push(context, DelimiterFrame.Kind.OPEN_QUOTE, line.getNumber(), i);
					insideString = true;
				}
			} else if (!insideString) {
				if (c == '{') {
					push(context, DelimiterFrame.Kind.OPEN_BRACE, line.getNumber(), i);
				} else if (c == '}') {
					closeBrace(line.getNumber(), context);
				}
			}
			i++;
		}
	}

	private void push(ScanContext context, DelimiterFrame.Kind kind, int lineNumber, int column) {
		context.stack.add(new DelimiterFrame(kind, lineNumber, column));
	}

	private void closeBrace(int lineNumber, ScanContext context) {
		if (context.stack.isEmpty()) {
			context.diagnostics.add(new Diagnostic(lineNumber, Diagnostic.Kind.UNEXPECTED_CLOSE, Delimiter.BRACE,
					"Unexpected closing } with no matching opening"));
			return;
		}
		DelimiterFrame frame = context.stack.remove(context.stack.size() - 1);
		if (frame.getKind() != DelimiterFrame.Kind.OPEN_BRACE) {
			context.stack.add(frame);
			context.diagnostics.add(new Diagnostic(lineNumber, Diagnostic.Kind.UNEXPECTED_CLOSE, Delimiter.BRACE,
					"Unexpected closing brace, expected closing quote from line " + frame.getLine()));
		}
	}

	private void closeQuote(int lineNumber, ScanContext context) {
		if (context.stack.isEmpty()) {
			context.diagnostics.add(new Diagnostic(lineNumber, Diagnostic.Kind.UNEXPECTED_CLOSE, Delimiter.QUOTE,
					"Unexpected closing \" with no matching opening"));
			return;
		}
		DelimiterFrame frame = context.stack.remove(context.stack.size() - 1);
		if (frame.getKind() != DelimiterFrame.Kind.OPEN_QUOTE) {
			context.stack.add(frame);
			context.diagnostics.add(new Diagnostic(lineNumber, Diagnostic.Kind.UNEXPECTED_CLOSE, Delimiter.QUOTE,
					"Unexpected closing quote, expected closing brace from line " + frame.getLine()));
		}
	}

	/**
	 * Every frame left on the stack is reported on its own, outermost first.
	 */
	private void reportUnclosed(ScanContext context) {
		for (DelimiterFrame frame : context.stack) {
			if (frame.getKind() == DelimiterFrame.Kind.OPEN_BRACE) {
				context.diagnostics.add(new Diagnostic(frame.getLine(), Diagnostic.Kind.UNMATCHED_BRACE,
						Delimiter.BRACE, "Unmatched opening brace"));
			} else {
				context.diagnostics.add(new Diagnostic(frame.getLine(), Diagnostic.Kind.UNMATCHED_QUOTE,
						Delimiter.QUOTE, "Unmatched opening quote"));
			}
		}
	}

	static boolean isComment(String text) {
		return text.trim().startsWith("#");
	}
}
