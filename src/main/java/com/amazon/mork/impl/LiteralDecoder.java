// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.mork.impl;

import static com.amazon.mork.impl.MorkTokenConsts.ESCAPE_CHAR;
import static com.amazon.mork.impl.MorkTokenConsts.HEX_ESCAPE_CHAR;

import java.io.ByteArrayOutputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Turns the raw text of a {@link MorkTokenType#LITERAL} token into the cell
 * value it denotes.
 * <p>
 * The token text holds one char per source byte.  When escape decoding is
 * enabled the bytes are rewritten first:
 * <ul>
 *   <li>a backslash followed by LF, CR or CRLF is a line continuation and
 *       produces nothing;</li>
 *   <li>a backslash followed by any other byte produces that byte;</li>
 *   <li>{@code $} followed by two hex digits produces the byte with that
 *       value;</li>
 *   <li>a {@code $} without two hex digits after it, and a backslash at the
 *       very end, are kept as written.</li>
 * </ul>
 * The resulting bytes are then read in the configured charset.
 * <p>
 * Instances are immutable.
 */
final class LiteralDecoder
{
    private final Charset  myCharset;
    private final boolean  myDecodeEscapes;

    LiteralDecoder(Charset charset, boolean decodeEscapes) {
        myCharset = charset;
        myDecodeEscapes = decodeEscapes;
    }

    String decode(String raw) {
        if (!myDecodeEscapes || !needsDecoding(raw)) {
            return transcode(raw);
        }

        int len = raw.length();
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(len);
        for (int ii = 0; ii < len; ii++) {
            char c = raw.charAt(ii);
            if (c == ESCAPE_CHAR && ii + 1 < len) {
                char next = raw.charAt(++ii);
                if (next == '\r') {
                    // CRLF continues the line as one unit
                    if (ii + 1 < len && raw.charAt(ii + 1) == '\n') ii++;
                }
                else if (next != '\n') {
                    bytes.write(next);
                }
            }
            else if (c == HEX_ESCAPE_CHAR && ii + 2 < len
                     && MorkTokenConsts.isHexDigit(raw.charAt(ii + 1))
                     && MorkTokenConsts.isHexDigit(raw.charAt(ii + 2))) {
                int hi = MorkTokenConsts.hexDigitValue(raw.charAt(ii + 1));
                int lo = MorkTokenConsts.hexDigitValue(raw.charAt(ii + 2));
                bytes.write((hi << 4) | lo);
                ii += 2;
            }
            else {
                bytes.write(c);
            }
        }
        return new String(bytes.toByteArray(), myCharset);
    }

    private static boolean needsDecoding(String raw) {
        return raw.indexOf(ESCAPE_CHAR) >= 0 || raw.indexOf(HEX_ESCAPE_CHAR) >= 0;
    }

    private String transcode(String raw) {
        if (myCharset.equals(StandardCharsets.ISO_8859_1)) {
            return raw;
        }
        return new String(raw.getBytes(StandardCharsets.ISO_8859_1), myCharset);
    }
}
