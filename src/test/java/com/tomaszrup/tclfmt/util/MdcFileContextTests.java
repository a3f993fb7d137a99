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
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.tclfmt.util;

import java.nio.file.Paths;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

/**
 * Tests for {@link MdcFileContext}: MDC key management and restore of the
 * previous context.
 */
class MdcFileContextTests {

	@BeforeEach
	void setup() {
		MDC.clear();
	}

	@AfterEach
	void tearDown() {
		MDC.clear();
	}

	@Test
	void testSetFileUsesFileName() {
		MdcFileContext.setFile(Paths.get("scripts", "build", "deploy.tcl"));

		Assertions.assertEquals("deploy.tcl", MDC.get(MdcFileContext.MDC_KEY));
	}

	@Test
	void testSetFileWithNullUsesPlaceholder() {
		MdcFileContext.setFile(null);

		Assertions.assertEquals("-", MDC.get(MdcFileContext.MDC_KEY));
	}

	@Test
	void testRestoreBringsBackPreviousValue() {
		MDC.put(MdcFileContext.MDC_KEY, "first.tcl");
		MDC.put("other", "kept");

		Map<String, String> previous = MdcFileContext.setFile(Paths.get("second.tcl"));
		Assertions.assertEquals("second.tcl", MDC.get(MdcFileContext.MDC_KEY));

		MdcFileContext.restore(previous);
		Assertions.assertEquals("first.tcl", MDC.get(MdcFileContext.MDC_KEY));
		Assertions.assertEquals("kept", MDC.get("other"));
	}

	@Test
	void testRestoreNullClearsContext() {
		Map<String, String> previous = MdcFileContext.setFile(Paths.get("a.tcl"));

		MdcFileContext.restore(previous);

		Assertions.assertNull(MDC.get(MdcFileContext.MDC_KEY));
	}
}
