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
import java.util.Collections;
import java.util.List;

/**
 * A run of consecutive assignment statements sharing the same indentation,
 * with the position of each statement in the line list.
 */
public final class AlignmentBlock {

	private final String indent;
	private final List<Integer> lineIndexes = new ArrayList<>();
	private final List<AssignmentStatement> statements = new ArrayList<>();

	AlignmentBlock(String indent) {
		this.indent = indent;
	}

	void add(int lineIndex, AssignmentStatement statement) {
		lineIndexes.add(lineIndex);
		statements.add(statement);
	}

	public String getIndent() {
		return indent;
	}

	/**
	 * 0-based indexes of the member lines, ascending.
	 */
	public List<Integer> getLineIndexes() {
		return Collections.unmodifiableList(lineIndexes);
	}

	public List<AssignmentStatement> getStatements() {
		return Collections.unmodifiableList(statements);
	}

	public int size() {
		return statements.size();
	}

	int maxNameLength() {
		int max = 0;
		for (AssignmentStatement statement : statements) {
			max = Math.max(max, statement.getName().length());
		}
		return max;
	}
}
