// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.mork;

/**
 * An error caused by bytes that do not form a valid Mork token: a character
 * that cannot start a token, a malformed comment or group marker, or a
 * missing hexadecimal id where the scanner requires one.
 */
public class MorkLexicalException
    extends MorkParseException
{
    private static final long serialVersionUID = 1L;

    public MorkLexicalException(String sourceName, SourcePosition position, String detail)
    {
        super(sourceName, position, detail);
    }
}
