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
 * Lines up the values of consecutive {@code set} statements, or, when
 * alignment is off, reduces the gap between name and value to one space.
 *
 * <p>Blocks are built from consecutive assignment lines with identical
 * indentation. Blank lines are skipped without ending a block; comments and
 * any other line end it. Blocks of a single statement are left alone.</p>
 *
 * <pre>
 * set x             10
 * set variable_name 20
 * </pre>
 *
 * <p>Only whitespace inside assignment lines changes; line count and order
 * are preserved.</p>
 */
public class AlignmentEngine {

	private static final Logger logger = LoggerFactory.getLogger(AlignmentEngine.class);

	/**
	 * Align the values of every block at one column past its longest name.
	 */
	public List<String> align(List<String> lines) {
		List<String> result = new ArrayList<>(lines);
		List<AlignmentBlock> blocks = findBlocks(lines);
		for (AlignmentBlock block : blocks) {
			int maxNameLength = block.maxNameLength();
			List<Integer> indexes = block.getLineIndexes();
			List<AssignmentStatement> statements = block.getStatements();
			for (int i = 0; i < indexes.size(); i++) {
				AssignmentStatement statement = statements.get(i);
				int gap = maxNameLength - statement.getName().length() + 1;
				result.set(indexes.get(i), statement.render(gap));
			}
		}
		logger.debug("Aligned {} assignment block(s)", blocks.size());
		return result;
	}

	/**
	 * Rewrite every assignment statement with a single space between name
	 * and value. Other lines are returned unchanged.
	 */
	public List<String> normalizeSpacing(List<String> lines) {
		List<String> result = new ArrayList<>(lines.size());
		for (String line : lines) {
			if (isComment(line)) {
				result.add(line);
				continue;
			}
			Optional<AssignmentStatement> statement = AssignmentStatement.parse(line);
			result.add(statement.isPresent() ? statement.get().render(1) : line);
		}
		return result;
	}

	/**
	 * Find the blocks with at least two statements, in line order.
	 */
	public List<AlignmentBlock> findBlocks(List<String> lines) {
		List<AlignmentBlock> blocks = new ArrayList<>();
		AlignmentBlock current = null;

		for (int i = 0; i < lines.size(); i++) {
			String line = lines.get(i);
			if (line.trim().isEmpty()) {
				continue;
			}
			Optional<AssignmentStatement> statement = isComment(line)
					? Optional.empty()
					: AssignmentStatement.parse(line);
			if (statement.isEmpty()) {
				flush(current, blocks);
				current = null;
				continue;
			}
			AssignmentStatement assignment = statement.get();
			if (current == null || !current.getIndent().equals(assignment.getIndent())) {
				flush(current, blocks);
				current = new AlignmentBlock(assignment.getIndent());
			}
			current.add(i, assignment);
		}
		flush(current, blocks);
		return blocks;
	}

	private void flush(AlignmentBlock block, List<AlignmentBlock> blocks) {
		if (block != null && block.size() > 1) {
			blocks.add(block);
		}
	}

	private static boolean isComment(String line) {
		return line.trim().startsWith("#");
	}
}
