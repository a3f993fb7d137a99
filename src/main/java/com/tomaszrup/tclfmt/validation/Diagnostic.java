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

import java.util.Objects;

/**
 * A delimiter balance problem found by {@link DelimiterValidator}.
 * Diagnostics are values: the validator returns them and never throws.
 */
public final class Diagnostic {

	public enum Kind {
		/** An opening brace with no closer before end of input. */
		UNMATCHED_BRACE,
		/** An opening quote with no closer before end of input. */
		UNMATCHED_QUOTE,
		/** A closer with no opener, or whose kind differs from the innermost opener. */
		UNEXPECTED_CLOSE
	}

	private final int line;
	private final Kind kind;
	private final Delimiter delimiter;
	private final String message;

	public Diagnostic(int line, Kind kind, Delimiter delimiter, String message) {
		this.line = line;
		this.kind = Objects.requireNonNull(kind, "kind");
		this.delimiter = Objects.requireNonNull(delimiter, "delimiter");
		this.message = Objects.requireNonNull(message, "message");
	}

	public int getLine() {
		return line;
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * The delimiter the problem was reported for: the opener for unmatched
	 * diagnostics, the closer for {@link Kind#UNEXPECTED_CLOSE}.
	 */
	public Delimiter getDelimiter() {
		return delimiter;
	}

	public String getMessage() {
		return message;
	}

	/**
	 * Renders the diagnostic as one line of an error log:
	 * {@code Line <n>: <message>}.
	 */
	public String toLogLine() {
		return "Line " + line + ": " + message;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Diagnostic)) {
			return false;
		}
		Diagnostic other = (Diagnostic) o;
		return line == other.line && kind == other.kind && delimiter == other.delimiter
				&& message.equals(other.message);
	}

	@Override
	public int hashCode() {
		return Objects.hash(line, kind, delimiter, message);
	}

	@Override
	public String toString() {
		return kind + " " + toLogLine();
	}
}
