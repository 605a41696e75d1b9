// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.mork.impl;

import com.amazon.mork.SourcePosition;
import org.jetbrains.annotations.Nullable;

/**
 * One token from {@link MorkLexer}.  The text is the exact source slice the
 * token covers, one char per byte (ISO-8859-1), so that literal bytes survive
 * until {@link LiteralDecoder} turns them into a string.  For
 * {@link MorkTokenType#ERROR} tokens the text is the error message instead.
 */
public final class MorkToken
{
    private final MorkTokenType myType;
    private final String myText;
    private final SourcePosition myPosition;

    public MorkToken(MorkTokenType type, String text, SourcePosition position)
    {
        myType = type;
        myText = text;
        myPosition = position;
    }

    public MorkTokenType getType()
    {
        return myType;
    }

    public String getText()
    {
        return myText;
    }

    public SourcePosition getPosition()
    {
        return myPosition;
    }

    /**
     * The hex id written inside a group start or commit marker, for
     * example {@code 1A} in <code>&#64;$${1A{&#64;</code>.
     *
     * @return null for any other token type.
     */
    @Nullable
    public String getGroupId()
    {
        switch (myType) {
        case GROUP_START:
        case GROUP_COMMIT:
            // "@$${" or "@$$}" prefix, "{@" or "}@" suffix
            return myText.substring(4, myText.length() - 2);
        default:
            return null;
        }
    }

    @Override
    public String toString()
    {
        return myPosition.getLine() + ":" + myPosition.getColumn()
             + " " + myType + " \"" + myText + "\"";
    }
}
