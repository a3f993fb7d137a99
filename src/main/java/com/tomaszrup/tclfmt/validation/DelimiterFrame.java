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

/**
 * An opening delimiter still waiting for its closer on the validation stack.
 */
public final class DelimiterFrame {

	public enum Kind {
		OPEN_BRACE(Delimiter.BRACE),
		OPEN_QUOTE(Delimiter.QUOTE);

		private final Delimiter delimiter;

		Kind(Delimiter delimiter) {
			this.delimiter = delimiter;
		}

		public Delimiter getDelimiter() {
			return delimiter;
		}
	}

	private final Kind kind;
	private final int line;
	private final int column;

	public DelimiterFrame(Kind kind, int line, int column) {
		this.kind = kind;
		this.line = line;
		this.column = column;
	}

	public Kind getKind() {
		return kind;
	}

	public int getLine() {
		return line;
	}

	/**
	 * 0-based offset of the opener within its logical line.
	 */
	public int getColumn() {
		return column;
	}

	@Override
	public String toString() {
		return kind + "@" + line + ":" + column;
	}
}
