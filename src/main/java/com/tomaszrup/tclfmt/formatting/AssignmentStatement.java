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

import java.util.Optional;

/**
 * A {@code set name value} line split into its parts.
 */
public final class AssignmentStatement {

	public static final String KEYWORD = "set";

	private final String indent;
	private final String name;
	private final String value;

	AssignmentStatement(String indent, String name, String value) {
		this.indent = indent;
		this.name = name;
		this.value = value;
	}

	/**
	 * Parse a line whose first word is exactly {@value #KEYWORD} and which has
	 * both a name and a value. {@code set x} alone does not parse.
	 */
	public static Optional<AssignmentStatement> parse(String line) {
		String trimmedLine = line.trim();
		if (!trimmedLine.startsWith(KEYWORD)
				|| trimmedLine.length() == KEYWORD.length()
				|| !Character.isWhitespace(trimmedLine.charAt(KEYWORD.length()))) {
			return Optional.empty();
		}
		String remainder = trimmedLine.substring(KEYWORD.length()).stripLeading();
		int nameEnd = 0;
		while (nameEnd < remainder.length() && !Character.isWhitespace(remainder.charAt(nameEnd))) {
			nameEnd++;
		}
		String value = remainder.substring(nameEnd).stripLeading();
		if (nameEnd == 0 || value.isEmpty()) {
			return Optional.empty();
		}
		String indent = line.substring(0, line.length() - line.stripLeading().length());
		return Optional.of(new AssignmentStatement(indent, remainder.substring(0, nameEnd), value));
	}

	public String getIndent() {
		return indent;
	}

	public String getName() {
		return name;
	}

	public String getValue() {
		return value;
	}

	/**
	 * Render with exactly {@code gap} spaces between name and value.
	 */
	String render(int gap) {
		return indent + KEYWORD + " " + name + " ".repeat(gap) + value;
	}
}
