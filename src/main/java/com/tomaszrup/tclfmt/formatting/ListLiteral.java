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
 * A single-line brace list split into the parts needed to write it out over
 * several lines. Items keep nested braces and quotes exactly as written.
 */
public final class ListLiteral {

	private final String baseIndent;
	private final String prefix;
	private final List<String> items;
	private final String suffix;

	public ListLiteral(String baseIndent, String prefix, List<String> items, String suffix) {
		this.baseIndent = baseIndent;
		this.prefix = prefix;
		this.items = Collections.unmodifiableList(new ArrayList<>(items));
		this.suffix = suffix;
	}

	/**
	 * Leading whitespace of the original line.
	 */
	public String getBaseIndent() {
		return baseIndent;
	}

	/**
	 * Text up to and including the first opening brace, e.g. <code>set mylist &#123;</code>.
	 */
	public String getPrefix() {
		return prefix;
	}

	public List<String> getItems() {
		return items;
	}

	/**
	 * Text after the last closing brace, kept verbatim (trailing comments included).
	 */
	public String getSuffix() {
		return suffix;
	}
}
