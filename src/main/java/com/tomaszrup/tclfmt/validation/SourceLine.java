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
 * One logical line of script text. When physical lines are joined by a
 * trailing backslash, the logical line keeps the number of the first
 * physical line so diagnostics point at the start of the statement.
 */
public final class SourceLine {

	private final int number;
	private final String text;

	public SourceLine(int number, String text) {
		if (number < 1) {
			throw new IllegalArgumentException("Line numbers are 1-based, got " + number);
		}
		this.number = number;
		this.text = Objects.requireNonNull(text, "text");
	}

	/**
	 * 1-based line number of the first physical line.
	 */
	public int getNumber() {
		return number;
	}

	/**
	 * Line content without its terminator.
	 */
	public String getText() {
		return text;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof SourceLine)) {
			return false;
		}
		SourceLine other = (SourceLine) o;
		return number == other.number && text.equals(other.text);
	}

	@Override
	public int hashCode() {
		return Objects.hash(number, text);
	}

	@Override
	public String toString() {
		return number + ": " + text;
	}
}
