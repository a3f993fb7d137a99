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

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.tclfmt.formatting.AlignmentEngine;
import com.tomaszrup.tclfmt.formatting.IndentationEngine;
import com.tomaszrup.tclfmt.formatting.ListExpansionEngine;
import com.tomaszrup.tclfmt.validation.DelimiterValidator;
import com.tomaszrup.tclfmt.validation.Diagnostic;

/**
 * Entry point of the formatting engine.
 *
 * <p>Runs the passes in a fixed order:</p>
 * <ol>
 *   <li>delimiter validation; any diagnostic ends the run with
 *       {@link FormatOutcome.Invalid} and nothing is rewritten</li>
 *   <li>indentation (always)</li>
 *   <li>list expansion, when {@link FormatterOptions#isExpandLists()}</li>
 *   <li>assignment alignment when {@link FormatterOptions#isAlignAssignments()},
 *       otherwise single-space normalization of assignments</li>
 * </ol>
 *
 * <p>The formatter keeps no state between calls and may be shared by
 * concurrent callers.</p>
 */
public class TclFormatter {

	private static final Logger logger = LoggerFactory.getLogger(TclFormatter.class);

	private final DelimiterValidator validator = new DelimiterValidator();
	private final AlignmentEngine alignmentEngine = new AlignmentEngine();

	public FormatOutcome format(List<String> sourceLines, FormatterOptions options) {
		Objects.requireNonNull(sourceLines, "sourceLines");
		Objects.requireNonNull(options, "options");

		List<Diagnostic> diagnostics = validator.validate(sourceLines);
		if (!diagnostics.isEmpty()) {
			logger.info("Syntax validation failed with {} error(s); skipping formatting", diagnostics.size());
			return FormatOutcome.invalid(diagnostics);
		}

		IndentationEngine indentationEngine = new IndentationEngine(options.getIndentUnit(),
				options.isStrictContinuationIndent());
		List<String> formatted = indentationEngine.indent(sourceLines);

		if (options.isExpandLists()) {
			ListExpansionEngine expansionEngine = new ListExpansionEngine(options.getListExpansionThreshold(),
					options.getIndentUnit());
			formatted = expansionEngine.expand(formatted);
		}

		if (options.isAlignAssignments()) {
			formatted = alignmentEngine.align(formatted);
		} else {
			formatted = alignmentEngine.normalizeSpacing(formatted);
		}

		logger.info("Formatted {} line(s) into {} line(s)", sourceLines.size(), formatted.size());
		return FormatOutcome.formatted(formatted);
	}

	/**
	 * Validate without formatting.
	 */
	public List<Diagnostic> validate(List<String> sourceLines) {
		return validator.validate(Objects.requireNonNull(sourceLines, "sourceLines"));
	}
}
