// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.mork;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A table parsed from a {@code { ... }} block: table-level meta cells plus
 * rows keyed by row id.
 * <p>
 * The {@linkplain #getRowScope() row scope} is the default scope of the
 * row ids inside the block.  It is the table's own scope unless the
 * metatable sets it through the {@value #ROW_SCOPE_CELL} cell.
 */
public final class MorkTable
{
    /** Name of the metatable cell that overrides the row scope. */
    public static final String ROW_SCOPE_CELL = "r";

    private final MorkOid myOid;
    private final Map<String, String> myMeta = new LinkedHashMap<String, String>();
    private final Map<String, MorkRow> myRows = new LinkedHashMap<String, MorkRow>();
    private boolean isReadOnly;

    public MorkTable(@NotNull MorkOid oid)
    {
        if (oid == null) throw new NullPointerException("oid");
        myOid = oid;
    }

    public MorkOid getOid()
    {
        return myOid;
    }

    /**
     * @return the coalesced {@code "<id>:<scope>"} identity of this table.
     */
    public String getId()
    {
        return myOid.coalesce();
    }

    public String getRowScope()
    {
        String scope = myMeta.get(ROW_SCOPE_CELL);
        return scope != null ? scope : myOid.getScope();
    }

    /**
     * @return an unmodifiable view of the meta cells.
     */
    public Map<String, String> getMeta()
    {
        return Collections.unmodifiableMap(myMeta);
    }

    /**
     * @throws ReadOnlyModelException if this table is read-only.
     */
    public void putMeta(String column, String value)
    {
        checkForLock();
        myMeta.put(column, value);
    }

    /**
     * @return an unmodifiable view of the rows, keyed by row id.
     */
    public Map<String, MorkRow> getRows()
    {
        return Collections.unmodifiableMap(myRows);
    }

    @Nullable
    public MorkRow getRow(String rowId)
    {
        return myRows.get(rowId);
    }

    /**
     * Stores the row under its id, replacing any row with the same id.
     */
    public void putRow(MorkRow row)
    {
        checkForLock();
        myRows.put(row.getId(), row);
    }

    /**
     * @return the removed row, or null if there was none.
     */
    @Nullable
    public MorkRow removeRow(String rowId)
    {
        checkForLock();
        return myRows.remove(rowId);
    }

    public boolean isReadOnly()
    {
        return isReadOnly;
    }

    /**
     * Makes this table and all of its rows read-only.  Tables returned by a
     * {@link MorkParseResult} are always read-only.
     */
    public void makeReadOnly()
    {
        for (MorkRow row : myRows.values())
        {
            row.makeReadOnly();
        }
        isReadOnly = true;
    }

    private void checkForLock()
    {
        if (isReadOnly)
        {
            throw new ReadOnlyModelException(MorkTable.class);
        }
    }

    @Override
    public String toString()
    {
        return "table " + getId() + " meta=" + myMeta + " rows=" + myRows.keySet();
    }
}
