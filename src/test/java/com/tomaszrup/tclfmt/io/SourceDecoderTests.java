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
package com.tomaszrup.tclfmt.io;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link SourceDecoder}.
 */
class SourceDecoderTests {

    // ---- splitLines ----

    @Test
    void splitOnAllTerminators() {
        assertEquals(Arrays.asList("a", "b", "c", "d"), SourceDecoder.splitLines("a\nb\r\nc\rd"));
    }

    @Test
    void finalTerminatorDoesNotAddEmptyLine() {
        assertEquals(Arrays.asList("a", "b"), SourceDecoder.splitLines("a\nb\n"));
        assertEquals(Arrays.asList("a", ""), SourceDecoder.splitLines("a\n\n"));
    }

    @Test
    void emptyTextHasNoLines() {
        assertEquals(Collections.emptyList(), SourceDecoder.splitLines(""));
        assertEquals(Collections.singletonList(""), SourceDecoder.splitLines("\n"));
    }

    // ---- decode ----

    @Test
    void plainUtf8() {
        assertEquals("puts \"żółw\"", SourceDecoder.decode("puts \"żółw\"".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void utf16LittleEndianWithBom() {
        byte[] body = "set x 1".getBytes(StandardCharsets.UTF_16LE);
        byte[] bytes = new byte[body.length + 2];
        bytes[0] = (byte) 0xFF;
        bytes[1] = (byte) 0xFE;
        System.arraycopy(body, 0, bytes, 2, body.length);

        assertEquals("set x 1", SourceDecoder.decode(bytes));
    }

    @Test
    void latin1ScriptKeepsAccentedCharacters() {
        String script = "set message \"Le café était déjà très chaud à midi, voilà la réponse\"";

        String text = SourceDecoder.decode(script.getBytes(StandardCharsets.ISO_8859_1));

        assertEquals(script, text);
    }

    @Test
    void undecodableBytesAreNotReplaced() {
        byte[] bytes = {'p', 'u', 't', 's', ' ', (byte) 0xC3, (byte) 0x28};

        String text = SourceDecoder.decode(bytes);

        assertTrue(text.startsWith("puts "));
        assertEquals(bytes.length, text.length());
        assertEquals(-1, text.indexOf('\uFFFD'));
    }

    @Test
    void emptyInput() {
        assertEquals("", SourceDecoder.decode(new byte[0]));
    }
}
