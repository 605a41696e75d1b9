// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.mork;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * One row of a {@link MorkTable}: column names mapped to resolved cell
 * values.  Column names are unique; a later cell for the same column
 * replaces the earlier one.  Iteration follows the order the columns were
 * first seen in the source.
 */
public final class MorkRow
{
    private final String myId;
    private final Map<String, String> myCells = new LinkedHashMap<String, String>();
    private final Map<String, String> myMeta = new LinkedHashMap<String, String>();
    private boolean isReadOnly;

    /**
     * @param id the key this row is stored under in its table.
     */
    public MorkRow(String id)
    {
        if (id == null) throw new NullPointerException("id");
        myId = id;
    }

    public String getId()
    {
        return myId;
    }

    /**
     * @return an unmodifiable view of the cells.
     */
    public Map<String, String> getCells()
    {
        return Collections.unmodifiableMap(myCells);
    }

    /**
     * @return the value of the column, or null if this row has no such cell.
     */
    @Nullable
    public String get(String column)
    {
        return myCells.get(column);
    }

    /**
     * @throws ReadOnlyModelException if this row is read-only.
     */
    public void put(String column, String value)
    {
        checkForLock();
        myCells.put(column, value);
    }

    /**
     * Cells from the row's metarow, if it had one.
     *
     * @return an unmodifiable view, empty when there was no metarow.
     */
    public Map<String, String> getMeta()
    {
        return Collections.unmodifiableMap(myMeta);
    }

    public void putMeta(String column, String value)
    {
        checkForLock();
        myMeta.put(column, value);
    }

    public boolean isReadOnly()
    {
        return isReadOnly;
    }

    public void makeReadOnly()
    {
        isReadOnly = true;
    }

    private void checkForLock()
    {
        if (isReadOnly)
        {
            throw new ReadOnlyModelException(MorkRow.class);
        }
    }

    @Override
    public String toString()
    {
        return "row " + myId + " " + myCells;
    }
}
