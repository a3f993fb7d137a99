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
package com.tomaszrup.tclfmt.io;

import org.mozilla.universalchardet.UniversalDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns raw script bytes into lines.
 *
 * <p>Decoding tries, in order:</p>
 * <ol>
 *   <li>the charset named by a byte-order mark (UTF-8, UTF-16BE, UTF-16LE)</li>
 *   <li>strict UTF-8</li>
 *   <li>the charset reported by juniversalchardet, if the bytes decode
 *       cleanly with it</li>
 *   <li>ISO-8859-1, which maps every byte to a character so nothing is lost</li>
 * </ol>
 */
public final class SourceDecoder {

    private static final Logger logger = LoggerFactory.getLogger(SourceDecoder.class);

    private static final byte[] UTF8_BOM = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
    private static final byte[] UTF16BE_BOM = {(byte) 0xFE, (byte) 0xFF};
    private static final byte[] UTF16LE_BOM = {(byte) 0xFF, (byte) 0xFE};

    private SourceDecoder() {
        // utility class
    }

    public static String decode(byte[] bytes) {
        if (startsWith(bytes, UTF8_BOM)) {
            return new String(bytes, UTF8_BOM.length, bytes.length - UTF8_BOM.length, StandardCharsets.UTF_8);
        }
        if (startsWith(bytes, UTF16BE_BOM)) {
            return new String(bytes, UTF16BE_BOM.length, bytes.length - UTF16BE_BOM.length, StandardCharsets.UTF_16BE);
        }
        if (startsWith(bytes, UTF16LE_BOM)) {
            return new String(bytes, UTF16LE_BOM.length, bytes.length - UTF16LE_BOM.length, StandardCharsets.UTF_16LE);
        }

        try {
            return decodeStrict(bytes, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            logger.debug("Input is not valid UTF-8: {}", e.getMessage());
        }
        Charset detected = detectCharset(bytes);
        if (detected != null) {
            try {
                return decodeStrict(bytes, detected);
            } catch (CharacterCodingException e) {
                logger.debug("Detected charset {} does not decode the input: {}", detected, e.getMessage());
            }
        }
        logger.warn("Input is neither valid UTF-8 nor a detectable charset; reading it as ISO-8859-1");
        return new String(bytes, StandardCharsets.ISO_8859_1);
    }

    /**
     * Ask juniversalchardet for the charset of {@code bytes}.
     *
     * @return the detected charset, or {@code null} when nothing was detected
     *         or the JVM does not support the detected name
     */
    static Charset detectCharset(byte[] bytes) {
        UniversalDetector detector = new UniversalDetector();
        detector.handleData(bytes, 0, bytes.length);
        detector.dataEnd();
        String name = detector.getDetectedCharset();
        detector.reset();
        if (name == null) {
            return null;
        }
        try {
            Charset charset = Charset.forName(name);
            logger.debug("Detected charset {}", charset);
            return charset;
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            logger.debug("Detected charset {} is not supported by this JVM", name);
            return null;
        }
    }

    /**
     * Split text into lines on {@code \r\n}, {@code \n} or {@code \r}. A final
     * terminator ends the last line and does not start an empty one, so
     * {@code "a\nb\n"} yields two lines and {@code ""} yields none.
     */
    public static List<String> splitLines(String text) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                lines.add(text.substring(start, i));
                if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                start = i + 1;
            }
            i++;
        }
        if (start < text.length()) {
            lines.add(text.substring(start));
        }
        return lines;
    }

    private static String decodeStrict(byte[] bytes, Charset charset) throws CharacterCodingException {
        return charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
    }

    private static boolean startsWith(byte[] bytes, byte[] prefix) {
        if (bytes.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (bytes[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
