// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.mork;

/**
 * An error caused by a name token holding non-hexadecimal characters where
 * the grammar requires a hex id, such as a table, row or reference id.
 */
public class InvalidIdentifierException
    extends MorkParseException
{
    private static final long serialVersionUID = 1L;

    private final String myText;

    public InvalidIdentifierException(String sourceName, SourcePosition position, String text)
    {
        super(sourceName, position, "not a hex id: \"" + text + "\"");
        myText = text;
    }

    public String getText()
    {
        return myText;
    }
}
