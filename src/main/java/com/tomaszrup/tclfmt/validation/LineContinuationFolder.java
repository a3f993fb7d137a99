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
import java.util.List;

/**
 * Joins physical lines that end in an unescaped backslash with the line that
 * follows them.
 *
 * <p>The continuation backslash (and any whitespace after it) is dropped and
 * the next physical line is appended verbatim. Consecutive continuations are
 * folded into a single logical line. A continuation on the last physical line
 * has nothing to join and is kept unchanged.</p>
 */
public final class LineContinuationFolder {

	private LineContinuationFolder() {
		// utility class
	}

	public static List<SourceLine> fold(List<String> physicalLines) {
		List<SourceLine> result = new ArrayList<>();
		int i = 0;
		while (i < physicalLines.size()) {
			int lineNumber = i + 1;
			String line = physicalLines.get(i);
			while (i < physicalLines.size() - 1 && isContinuation(line)) {
				String trimmed = stripTrailing(line);
				line = trimmed.substring(0, trimmed.length() - 1) + physicalLines.get(i + 1);
				i++;
			}
			result.add(new SourceLine(lineNumber, line));
			i++;
		}
		return result;
	}

	/**
	 * A line continues when, ignoring trailing whitespace, it ends in an odd
	 * run of backslashes. An even run is a sequence of escaped backslashes.
	 */
	public static boolean isContinuation(String line) {
		String trimmed = stripTrailing(line);
		int backslashes = 0;
		for (int i = trimmed.length() - 1; i >= 0 && trimmed.charAt(i) == '\\'; i--) {
			backslashes++;
		}
		return backslashes % 2 == 1;
	}

	private static String stripTrailing(String line) {
		int end = line.length();
		while (end > 0 && Character.isWhitespace(line.charAt(end - 1))) {
			end--;
		}
		return line.substring(0, end);
	}
}
