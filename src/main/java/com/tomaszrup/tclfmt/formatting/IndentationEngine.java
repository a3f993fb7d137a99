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
package com.tomaszrup.tclfmt.formatting;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-indents script lines from their brace nesting depth.
 *
 * <p>Every non-blank, non-comment line is trimmed and prefixed with
 * {@code depth * indentUnit} spaces. The depth for the next line is this
 * line's level plus the net count of braces found outside quoted spans.
 * A line that starts with <code>&#125;</code> is written one level shallower.</p>
 *
 * <p>Quote parity is carried across lines: after an odd number of unescaped
 * quotes the following lines are inside a multi-line string and keep the
 * current depth until the string closes. This tracking is independent of
 * {@link com.tomaszrup.tclfmt.validation.DelimiterValidator}, whose string
 * state ends at each line.</p>
 *
 * <p>Blank lines and comment lines are emitted exactly as given.</p>
 *
 * <p>The engine expects delimiter-balanced input; it never fails on
 * unbalanced text but the result is then meaningless.</p>
 */
public class IndentationEngine {

	private static final Logger logger = LoggerFactory.getLogger(IndentationEngine.class);

	public static final int DEFAULT_INDENT_UNIT = 2;

	static final Set<String> BLOCK_KEYWORDS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
			"if", "else", "foreach", "while", "switch", "proc", "namespace")));

	static final Set<String> LEADING_COMMANDS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
			"set", "puts", "return", "source", "package", "namespace")));

	private final String singleIndent;
	private final boolean strictContinuation;

	public IndentationEngine() {
		this(DEFAULT_INDENT_UNIT, false);
	}

	/**
	 * @param indentUnit         number of spaces per nesting level
	 * @param strictContinuation whether continuation lines get one extra level
	 */
	public IndentationEngine(int indentUnit, boolean strictContinuation) {
		if (indentUnit < 0) {
			throw new IllegalArgumentException("indentUnit must not be negative: " + indentUnit);
		}
		this.singleIndent = " ".repeat(indentUnit);
		this.strictContinuation = strictContinuation;
	}

	public boolean isStrictContinuation() {
		return strictContinuation;
	}

	public List<String> indent(List<String> lines) {
		List<String> result = new ArrayList<>(lines.size());
		IndentState state = IndentState.INITIAL;
		int maxLevel = 0;

		for (String line : lines) {
			String trimmedLine = line.trim();
			if (trimmedLine.isEmpty() || trimmedLine.startsWith("#")) {
				result.add(line);
				continue;
			}

			int level = computeLineLevel(trimmedLine, state);
			maxLevel = Math.max(maxLevel, level);
			result.add(buildIndent(level) + trimmedLine);
			state = nextState(trimmedLine, level, state);
		}

		logger.debug("Indented {} line(s), deepest level {}", lines.size(), maxLevel);
		return result;
	}

	private int computeLineLevel(String trimmedLine, IndentState state) {
		int depth = state.getDepth();
		if (state.isInsideMultilineString()) {
			return depth;
		}
		if (trimmedLine.startsWith("}")) {
			return Math.max(0, depth - 1);
		}
		if (strictContinuation && isContinuationLine(trimmedLine)) {
			return depth + 1;
		}
		return depth;
	}

	private IndentState nextState(String trimmedLine, int level, IndentState state) {
		int nextDepth;
		if (state.isInsideMultilineString()) {
			nextDepth = level;
		} else {
			nextDepth = level + countNetBraces(trimmedLine);
			// the closing line was written one level up; undo that before applying net
			if (trimmedLine.startsWith("}")) {
				nextDepth++;
			}
		}
		boolean oddQuotes = countUnescapedQuotes(trimmedLine) % 2 == 1;
		return new IndentState(nextDepth, state.isInsideMultilineString() ^ oddQuotes);
	}

	/**
	 * Decide whether a line continues the statement of the previous line.
	 *
	 * <p>Lines that open with a brace, a block keyword or a common leading
	 * command start a statement. Any other line would need the previous
	 * statement's state to classify, which this pass does not keep, so it is
	 * read as a statement start too and strict mode leaves it unchanged.</p>
	 */
	boolean isContinuationLine(String trimmedLine) {
		if (startsStatement(trimmedLine)) {
			return false;
		}
		// TODO: carry open-bracket state of the previous statement to detect real continuations
		return false;
	}

	static boolean startsStatement(String trimmedLine) {
		if (trimmedLine.startsWith("#") || trimmedLine.startsWith("{") || trimmedLine.startsWith("}")) {
			return true;
		}
		String firstWord = firstWord(trimmedLine);
		return BLOCK_KEYWORDS.contains(firstWord) || LEADING_COMMANDS.contains(firstWord);
	}

	private static String firstWord(String trimmedLine) {
		int end = 0;
		while (end < trimmedLine.length() && !Character.isWhitespace(trimmedLine.charAt(end))) {
			end++;
		}
		return trimmedLine.substring(0, end);
	}

	/**
	 * Count opening minus closing braces outside quoted spans. Quote state
	 * starts fresh on every line.
	 */
	static int countNetBraces(String line) {
		int net = 0;
		boolean insideString = false;
		int i = 0;
		while (i < line.length()) {
			char c = line.charAt(i);
			if (c == '\\' && i + 1 < line.length()) {
				i += 2;
				continue;
			}
			if (c == '"') {
				insideString = !insideString;
			} else if (!insideString) {
				if (c == '{') {
					net++;
				} else if (c == '}') {
					net--;
				}
			}
			i++;
		}
		return net;
	}

	static int countUnescapedQuotes(String line) {
		int quotes = 0;
		int i = 0;
		while (i < line.length()) {
			char c = line.charAt(i);
			if (c == '\\' && i + 1 < line.length()) {
				i += 2;
				continue;
			}
			if (c == '"') {
				quotes++;
			}
			i++;
		}
		return quotes;
	}

	private String buildIndent(int depth) {
		return depth <= 0 ? "" : singleIndent.repeat(depth);
	}
}
