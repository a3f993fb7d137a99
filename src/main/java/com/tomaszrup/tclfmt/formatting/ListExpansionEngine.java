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
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands long single-line brace lists into one item per line.
 *
 * <p>A line qualifies when it is at least {@code lengthThreshold} characters
 * long, is not a comment, and the text between its first <code>&#123;</code> and last
 * <code>&#125;</code> contains whitespace (which separates a list from a single braced
 * word such as {@code {$var}}). Such a line becomes:</p>
 * <pre>
 * set mylist {
 *   item1
 *   item2
 * }
 * </pre>
 *
 * <p>Items are split on whitespace at brace depth 0 outside quotes, so nested
 * lists and quoted strings stay in one item.</p>
 */
public class ListExpansionEngine {

	private static final Logger logger = LoggerFactory.getLogger(ListExpansionEngine.class);

	public static final int DEFAULT_LENGTH_THRESHOLD = 80;

	private final int lengthThreshold;
	private final String singleIndent;

	public ListExpansionEngine() {
		this(DEFAULT_LENGTH_THRESHOLD, IndentationEngine.DEFAULT_INDENT_UNIT);
	}

	public ListExpansionEngine(int lengthThreshold, int indentUnit) {
		if (lengthThreshold < 1) {
			throw new IllegalArgumentException("lengthThreshold must be positive: " + lengthThreshold);
		}
		if (indentUnit < 0) {
			throw new IllegalArgumentException("indentUnit must not be negative: " + indentUnit);
		}
		this.lengthThreshold = lengthThreshold;
		this.singleIndent = " ".repeat(indentUnit);
	}

	public List<String> expand(List<String> lines) {
		List<String> result = new ArrayList<>(lines.size());
		int expanded = 0;
		for (String line : lines) {
			Optional<ListLiteral> literal = detect(line);
			if (literal.isPresent()) {
				result.addAll(render(literal.get()));
				expanded++;
			} else {
				result.add(line);
			}
		}
		if (expanded > 0) {
			logger.debug("Expanded {} list literal(s)", expanded);
		}
		return result;
	}

	/**
	 * Parse the list literal on a line, if the line qualifies for expansion.
	 */
	public Optional<ListLiteral> detect(String line) {
		if (!shouldExpand(line)) {
			return Optional.empty();
		}
		String baseIndent = line.substring(0, line.length() - line.stripLeading().length());
		String trimmedLine = line.trim();
		int open = trimmedLine.indexOf('{');
		int close = trimmedLine.lastIndexOf('}');

		String prefix = trimmedLine.substring(0, open + 1);
		String content = trimmedLine.substring(open + 1, close).trim();
		String suffix = trimmedLine.substring(close + 1);
		return Optional.of(new ListLiteral(baseIndent, prefix, tokenize(content), suffix));
	}

	boolean shouldExpand(String line) {
		if (line.length() < lengthThreshold) {
			return false;
		}
		String trimmedLine = line.trim();
		if (trimmedLine.startsWith("#")) {
			return false;
		}
		int open = trimmedLine.indexOf('{');
		int close = trimmedLine.lastIndexOf('}');
		if (open == -1 || close == -1 || close <= open) {
			return false;
		}
		String content = trimmedLine.substring(open + 1, close).trim();
		return !content.isEmpty() && (content.indexOf(' ') >= 0 || content.indexOf('\t') >= 0);
	}

	private List<String> render(ListLiteral literal) {
		List<String> lines = new ArrayList<>(literal.getItems().size() + 2);
		String baseIndent = literal.getBaseIndent();
		lines.add(baseIndent + literal.getPrefix());
		for (String item : literal.getItems()) {
			lines.add(baseIndent + singleIndent + item);
		}
		lines.add(baseIndent + "}" + literal.getSuffix());
		return lines;
	}

	/**
	 * Split list content into items. Whitespace separates items only outside
	 * quotes and at brace depth 0; braces, quotes and escaped characters are
	 * kept in the item they belong to.
	 */
	static List<String> tokenize(String content) {
		List<String> items = new ArrayList<>();
		StringBuilder current = new StringBuilder();
		int braceDepth = 0;
		boolean insideString = false;
		int i = 0;

		while (i < content.length()) {
			char c = content.charAt(i);
			if (c == '\\' && i + 1 < content.length()) {
				current.append(c).append(content.charAt(i + 1));
				i += 2;
				continue;
			}
			if (c == '"') {
				insideString = !insideString;
			} else if (!insideString && c == '{') {
				braceDepth++;
			} else if (!insideString && c == '}') {
				braceDepth--;
			} else if (!insideString && braceDepth == 0 && isBlank(c)) {
				if (current.length() > 0) {
					items.add(current.toString());
					current.setLength(0);
				}
				while (i < content.length() && isBlank(content.charAt(i))) {
					i++;
				}
				continue;
			}
			current.append(c);
			i++;
		}
		if (current.length() > 0) {
			items.add(current.toString());
		}
		return items;
	}

	private static boolean isBlank(char c) {
		return c == ' ' || c == '\t';
	}
}
