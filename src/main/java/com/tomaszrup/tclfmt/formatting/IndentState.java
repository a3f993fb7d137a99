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

/**
 * Indentation state carried from one line to the next.
 */
final class IndentState {

	static final IndentState INITIAL = new IndentState(0, false);

	private final int depth;
	private final boolean insideMultilineString;

	IndentState(int depth, boolean insideMultilineString) {
		this.depth = Math.max(0, depth);
		this.insideMultilineString = insideMultilineString;
	}

	int getDepth() {
		return depth;
	}

	/**
	 * Whether an odd number of unescaped quotes was seen on the lines so far,
	 * meaning the next line starts inside a string.
	 */
	boolean isInsideMultilineString() {
		return insideMultilineString;
	}
}
