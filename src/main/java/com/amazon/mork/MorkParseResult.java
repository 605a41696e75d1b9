// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.mork;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The outcome of loading one Mork source: every table completed before
 * parsing stopped, plus the error that stopped it, if any.
 * <p>
 * Tables are keyed by their coalesced {@code "<id>:<scope>"} identity and
 * iterate in the order each key was first stored.  The result and its
 * tables and rows are read-only.
 */
public final class MorkParseResult
{
    private final String mySourceName;
    private final Map<String, MorkTable> myTables;
    private final MorkParseException myError;

    public MorkParseResult(@NotNull String sourceName,
                           @NotNull Map<String, MorkTable> tables,
                           @Nullable MorkParseException error)
    {
        mySourceName = sourceName;
        for (MorkTable table : tables.values())
        {
            table.makeReadOnly();
        }
        myTables = Collections.unmodifiableMap(new LinkedHashMap<String, MorkTable>(tables));
        myError = error;
    }

    public String getSourceName()
    {
        return mySourceName;
    }

    /**
     * @return an unmodifiable map; possibly partial when {@link #getError()}
     * is not null.
     */
    public Map<String, MorkTable> getTables()
    {
        return myTables;
    }

    @Nullable
    public MorkTable getTable(String tableId)
    {
        return myTables.get(tableId);
    }

    /**
     * @return the first error found in the source, or null if it parsed
     * completely.
     */
    @Nullable
    public MorkParseException getError()
    {
        return myError;
    }

    public boolean isSuccess()
    {
        return myError == null;
    }

    /**
     * @return the tables, if the source parsed without error.
     *
     * @throws MorkParseException the recorded error, if any.
     */
    public Map<String, MorkTable> getTablesOrThrow()
    {
        if (myError != null)
        {
            throw myError;
        }
        return myTables;
    }
}
