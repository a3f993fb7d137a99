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

import com.tomaszrup.tclfmt.formatting.IndentationEngine;
import com.tomaszrup.tclfmt.formatting.ListExpansionEngine;

/**
 * Immutable formatting configuration. Start from {@link #defaults()} and
 * derive variants with the {@code with*} methods.
 */
public final class FormatterOptions {

    private static final FormatterOptions DEFAULTS = new FormatterOptions(false, false, false,
            IndentationEngine.DEFAULT_INDENT_UNIT, ListExpansionEngine.DEFAULT_LENGTH_THRESHOLD);

    private final boolean alignAssignments;
    private final boolean expandLists;
    private final boolean strictContinuationIndent;
    private final int indentUnit;
    private final int listExpansionThreshold;

    private FormatterOptions(boolean alignAssignments,
                             boolean expandLists,
                             boolean strictContinuationIndent,
                             int indentUnit,
                             int listExpansionThreshold) {
        if (indentUnit < 0) {
            throw new IllegalArgumentException("indentUnit must not be negative: " + indentUnit);
        }
        if (listExpansionThreshold < 1) {
            throw new IllegalArgumentException("listExpansionThreshold must be positive: " + listExpansionThreshold);
        }
        this.alignAssignments = alignAssignments;
        this.expandLists = expandLists;
        this.strictContinuationIndent = strictContinuationIndent;
        this.indentUnit = indentUnit;
        this.listExpansionThreshold = listExpansionThreshold;
    }

    /**
     * No alignment, no list expansion, non-strict indentation, 2-space indent,
     * 80-character expansion threshold.
     */
    public static FormatterOptions defaults() {
        return DEFAULTS;
    }

    public FormatterOptions withAlignAssignments(boolean value) {
        return new FormatterOptions(value, expandLists, strictContinuationIndent, indentUnit, listExpansionThreshold);
    }

    public FormatterOptions withExpandLists(boolean value) {
        return new FormatterOptions(alignAssignments, value, strictContinuationIndent, indentUnit, listExpansionThreshold);
    }

    public FormatterOptions withStrictContinuationIndent(boolean value) {
        return new FormatterOptions(alignAssignments, expandLists, value, indentUnit, listExpansionThreshold);
    }

    public FormatterOptions withIndentUnit(int value) {
        return new FormatterOptions(alignAssignments, expandLists, strictContinuationIndent, value, listExpansionThreshold);
    }

    public FormatterOptions withListExpansionThreshold(int value) {
        return new FormatterOptions(alignAssignments, expandLists, strictContinuationIndent, indentUnit, value);
    }

    public boolean isAlignAssignments() {
        return alignAssignments;
    }

    public boolean isExpandLists() {
        return expandLists;
    }

    public boolean isStrictContinuationIndent() {
        return strictContinuationIndent;
    }

    /** Spaces per nesting level. */
    public int getIndentUnit() {
        return indentUnit;
    }

    /** Minimum line length, in characters, for a list literal to be expanded. */
    public int getListExpansionThreshold() {
        return listExpansionThreshold;
    }

    @Override
    public String toString() {
        return "FormatterOptions{alignAssignments=" + alignAssignments
                + ", expandLists=" + expandLists
                + ", strictContinuationIndent=" + strictContinuationIndent
                + ", indentUnit=" + indentUnit
                + ", listExpansionThreshold=" + listExpansionThreshold + "}";
    }
}
