// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.mork;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * An error found while parsing one Mork source.  The message always starts
 * with the source name and, when the position is known, ends with the line
 * and column where the problem was detected.
 * <p>
 * Parsing stops at the first such error; the tables completed before it are
 * still available from the {@link MorkParseResult} that carries it.
 */
public class MorkParseException extends MorkException
{
    private static final long serialVersionUID = 1L;

    private final String mySourceName;
    private final SourcePosition myPosition;
    private final String myDetail;

    public MorkParseException(@NotNull String sourceName,
                              @Nullable SourcePosition position,
                              @NotNull String detail)
    {
        super(detail);
        mySourceName = sourceName;
        myPosition = position;
        myDetail = detail;
    }

    /** The display name of the source that failed to parse. */
    public String getSourceName()
    {
        return mySourceName;
    }

    /** Where the error was detected, or null when unknown. */
    @Nullable
    public SourcePosition getPosition()
    {
        return myPosition;
    }

    /** The error description without source name or position. */
    public String getDetail()
    {
        return myDetail;
    }

    @Override
    public String getMessage()
    {
        StringBuilder buf = new StringBuilder();
        buf.append(mySourceName).append(": ").append(myDetail);
        if (myPosition != null)
        {
            buf.append(" at line ").append(myPosition.getLine())
               .append(" column ").append(myPosition.getColumn());
        }
        return buf.toString();
    }
}
