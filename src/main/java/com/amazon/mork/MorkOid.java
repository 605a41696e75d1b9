// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.mork;

import org.jetbrains.annotations.NotNull;

/**
 * A Mork object id: a hexadecimal id qualified by the scope (namespace) it
 * lives in.  Hex ids are only unique within a scope, so tables are keyed by
 * the {@linkplain #coalesce() coalesced} form {@code "<id>:<scope>"}.
 * <p>
 * Instances are immutable.  Ids are compared exactly as written; no case
 * folding or leading-zero normalization is applied.
 */
public final class MorkOid
{
    private final String myId;
    private final String myScope;

    public MorkOid(@NotNull String id, @NotNull String scope)
    {
        if (id == null) throw new NullPointerException("id");
        if (scope == null) throw new NullPointerException("scope");
        myId = id;
        myScope = scope;
    }

    public String getId()
    {
        return myId;
    }

    public String getScope()
    {
        return myScope;
    }

    /**
     * @return {@code id + ":" + scope}.
     */
    public String coalesce()
    {
        return myId + ":" + myScope;
    }

    @Override
    public boolean equals(Object other)
    {
        if (this == other) return true;
        if (!(other instanceof MorkOid)) return false;
        MorkOid that = (MorkOid) other;
        return myId.equals(that.myId) && myScope.equals(that.myScope);
    }

    @Override
    public int hashCode()
    {
        return 31 * myId.hashCode() + myScope.hashCode();
    }

    @Override
    public String toString()
    {
        return coalesce();
    }
}
