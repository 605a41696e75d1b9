// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.mork;

/**
 * A location in a Mork source buffer.  Lines are 1-based, columns are
 * 0-based and count bytes since the last line feed.  The byte offset is
 * 0-based from the start of the buffer.
 */
public final class SourcePosition
{
    /** The position of the first byte of any buffer. */
    public static final SourcePosition START = new SourcePosition(0, 1, 0);

    private final int myOffset;
    private final int myLine;
    private final int myColumn;

    public SourcePosition(int offset, int line, int column)
    {
        if (offset < 0 || line < 1 || column < 0)
        {
            throw new IllegalArgumentException("invalid position: offset " + offset
                                               + " line " + line + " column " + column);
        }
        myOffset = offset;
        myLine = line;
        myColumn = column;
    }

    public int getOffset()
    {
        return myOffset;
    }

    public int getLine()
    {
        return myLine;
    }

    public int getColumn()
    {
        return myColumn;
    }

    @Override
    public boolean equals(Object other)
    {
        if (this == other) return true;
        if (!(other instanceof SourcePosition)) return false;
        SourcePosition that = (SourcePosition) other;
        return myOffset == that.myOffset
            && myLine == that.myLine
            && myColumn == that.myColumn;
    }

    @Override
    public int hashCode()
    {
        int result = myOffset;
        result = 31 * result + myLine;
        result = 31 * result + myColumn;
        return result;
    }

    @Override
    public String toString()
    {
        return myLine + ":" + myColumn;
    }
}
