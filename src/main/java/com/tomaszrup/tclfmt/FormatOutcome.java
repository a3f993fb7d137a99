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
package com.tomaszrup.tclfmt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.tomaszrup.tclfmt.validation.Diagnostic;

/**
 * Result of {@link TclFormatter#format}: either the input was rejected with
 * diagnostics ({@link Invalid}) or it was rewritten ({@link Formatted}).
 * Invalid input is never partially formatted.
 */
public abstract class FormatOutcome {

	private FormatOutcome() {
	}

	public static FormatOutcome invalid(List<Diagnostic> diagnostics) {
		return new Invalid(diagnostics);
	}

	public static FormatOutcome formatted(List<String> lines) {
		return new Formatted(lines);
	}

	public abstract boolean isFormatted();

	/**
	 * @return the diagnostics of an invalid outcome, empty for a formatted one
	 */
	public abstract List<Diagnostic> getDiagnostics();

	/**
	 * @return the formatted lines
	 * @throws IllegalStateException if the outcome is invalid
	 */
	public abstract List<String> getLines();

	public static final class Invalid extends FormatOutcome {
		private final List<Diagnostic> diagnostics;

		private Invalid(List<Diagnostic> diagnostics) {
			List<Diagnostic> copy = new ArrayList<>(diagnostics);
			if (copy.isEmpty()) {
				throw new IllegalArgumentException("An invalid outcome needs at least one diagnostic");
			}
			this.diagnostics = Collections.unmodifiableList(copy);
		}

		@Override
		public boolean isFormatted() {
			return false;
		}

		@Override
		public List<Diagnostic> getDiagnostics() {
			return diagnostics;
		}

		@Override
		public List<String> getLines() {
			throw new IllegalStateException("Input has " + diagnostics.size() + " syntax error(s) and was not formatted");
		}

		@Override
		public String toString() {
			return "Invalid" + diagnostics;
		}
	}

	public static final class Formatted extends FormatOutcome {
		private final List<String> lines;

		private Formatted(List<String> lines) {
			this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
		}

		@Override
		public boolean isFormatted() {
			return true;
		}

		@Override
		public List<Diagnostic> getDiagnostics() {
			return Collections.emptyList();
		}

		@Override
		public List<String> getLines() {
			return lines;
		}

		@Override
		public String toString() {
			return "Formatted[" + lines.size() + " line(s)]";
		}
	}
}
