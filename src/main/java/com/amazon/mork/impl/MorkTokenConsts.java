// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.mork.impl;

/**
 * this is a collection of constants and some static helper functions
 * to support tokenizing Mork text.  All of the character tests take a
 * byte value (0-255) or -1 for end of input.
 */
final class MorkTokenConsts
{
    private MorkTokenConsts() { }

    public static final int EOF = -1;

    /** Prefix shared by every group marker. */
    public static final String GROUP_MARKER           = "@$$";
    /** Follows the group id of a start marker. */
    public static final String GROUP_START_TERMINATOR = "{@";
    /** Follows the group id of a commit marker. */
    public static final String GROUP_END_TERMINATOR   = "}@";
    /** Completes an abort marker after the group marker's closing brace. */
    public static final String GROUP_ABORT_SUFFIX     = "~~}@";

    public static final char ESCAPE_CHAR     = '\\';
    public static final char HEX_ESCAPE_CHAR = '$';

    private static final int CC_SPACE        = 0x01;
    private static final int CC_NAME_START   = 0x02;
    private static final int CC_NAME_PART    = 0x04;
    private static final int CC_HEX          = 0x08;

    private static final int[] charClass = makeCharClassArray();
    private static int[] makeCharClassArray() {
        int[] cc = new int[256];
        cc[' ']  = CC_SPACE;
        cc['\t'] = CC_SPACE;
        cc['\r'] = CC_SPACE;
        cc['\n'] = CC_SPACE;
        for (int ii='a'; ii<='z'; ii++) {
            cc[ii] |= CC_NAME_START | CC_NAME_PART;
        }
        for (int ii='A'; ii<='Z'; ii++) {
            cc[ii] |= CC_NAME_START | CC_NAME_PART;
        }
        for (int ii='0'; ii<='9'; ii++) {
            cc[ii] |= CC_NAME_START | CC_NAME_PART | CC_HEX;
        }
        for (int ii='a'; ii<='f'; ii++) {
            cc[ii] |= CC_HEX;
        }
        for (int ii='A'; ii<='F'; ii++) {
            cc[ii] |= CC_HEX;
        }
        cc['_'] |= CC_NAME_START | CC_NAME_PART;
        // allowed inside a name, never first
        cc['-'] |= CC_NAME_PART;
        cc['!'] |= CC_NAME_PART;
        cc['?'] |= CC_NAME_PART;
        cc['+'] |= CC_NAME_PART;
        return cc;
    }

    private static boolean is(int c, int mask) {
        return (c & ~0xff) == 0 && (charClass[c] & mask) != 0;
    }

    public static boolean isWhitespace(int c) {
        return is(c, CC_SPACE);
    }
    public static boolean isNameStart(int c) {
        return is(c, CC_NAME_START);
    }
    public static boolean isNamePart(int c) {
        return is(c, CC_NAME_PART);
    }
    public static boolean isHexDigit(int c) {
        return is(c, CC_HEX);
    }

    public static int hexDigitValue(int c) {
        if (c >= '0' && c <= '9') return c - '0';
        if (c >= 'a' && c <= 'f') return c - 'a' + 10;
        if (c >= 'A' && c <= 'F') return c - 'A' + 10;
        throw new IllegalArgumentException("character '"+((char)c)+"' is not a hex digit");
    }

    /**
     * @return true if the string is non-empty and every char is a hex digit.
     */
    public static boolean isHexId(CharSequence s) {
        if (s.length() == 0) return false;
        for (int ii=0; ii<s.length(); ii++) {
            if (!isHexDigit(s.charAt(ii))) return false;
        }
        return true;
    }

    /**
     * Maps the punctuation that forms a token all by itself to its type.
     *
     * @return null if c is not a single-character token.
     */
    public static MorkTokenType singleCharToken(int c) {
        switch (c) {
        case '(': return MorkTokenType.LPAREN;
        case ')': return MorkTokenType.RPAREN;
        case '[': return MorkTokenType.LSQUARE;
        case ']': return MorkTokenType.RSQUARE;
        case '{': return MorkTokenType.LBRACE;
        case '}': return MorkTokenType.RBRACE;
        case '<': return MorkTokenType.LANGLE;
        case '>': return MorkTokenType.RANGLE;
        case ':': return MorkTokenType.COLON;
        case '+': return MorkTokenType.PLUS;
        default:  return null;
        }
    }

    /**
     * @return a printable image of a byte for error messages.
     */
    public static String printByte(int c) {
        if (c == EOF) return "end of input";
        if (c >= 0x20 && c < 0x7f) return "'" + (char) c + "'";
        return String.format("0x%02X", c);
    }
}
