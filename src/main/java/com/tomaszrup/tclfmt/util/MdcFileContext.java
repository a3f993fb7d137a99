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
package com.tomaszrup.tclfmt.util;

import org.slf4j.MDC;

import java.nio.file.Path;
import java.util.Map;

/**
 * Manages the SLF4J MDC (Mapped Diagnostic Context) key {@code "file"} so
 * that every log line written while a script is processed names that script.
 *
 * <h3>Usage:</h3>
 * <pre>{@code
 * Map<String, String> previous = MdcFileContext.setFile(path);
 * try {
 *     // ... all log calls inside here will include [script.tcl]
 * } finally {
 *     MdcFileContext.restore(previous);
 * }
 * }</pre>
 */
public final class MdcFileContext {

    /** MDC key used in the logback pattern via {@code %X{file}}. */
    public static final String MDC_KEY = "file";

    private MdcFileContext() {
        // utility class
    }

    /**
     * Sets the MDC {@code "file"} key to the file name of {@code path}, or
     * {@code "-"} when the path is null or has no file name.
     *
     * @return the MDC context in place before the call, for {@link #restore(Map)}
     */
    public static Map<String, String> setFile(Path path) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        Path fileName = path != null ? path.getFileName() : null;
        MDC.put(MDC_KEY, fileName != null ? fileName.toString() : "-");
        return previous;
    }

    /**
     * Restores a previously captured MDC context map on the current thread.
     *
     * @param contextMap the context map to restore (may be null)
     */
    public static void restore(Map<String, String> contextMap) {
        if (contextMap != null) {
            MDC.setContextMap(contextMap);
        } else {
            MDC.clear();
        }
    }
}
