// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.mork.impl;

import com.amazon.mork.MorkTable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The buffered edits of one transaction group, from its start marker up to
 * the commit or abort marker.  Dictionary definitions go to an overlay of
 * the enclosing dictionaries and tables to a private map; nothing reaches
 * the enclosing state until {@link #commitTo(Map)}.
 */
final class MorkGroup
{
    private final String _id;
    private final MorkDictionaries _dictionaries;
    private final Map<String, MorkTable> _tables = new LinkedHashMap<String, MorkTable>();

    MorkGroup(String id, MorkDictionaries enclosing) {
        _id = id;
        _dictionaries = enclosing.newOverlay();
    }

    /** the hex id from the start marker */
    String getId() {
        return _id;
    }

    MorkDictionaries getDictionaries() {
        return _dictionaries;
    }

    Map<String, MorkTable> getTables() {
        return _tables;
    }

    /**
     * Applies the buffered dictionary entries to the enclosing dictionaries
     * and the buffered tables to the given map, replacing tables with the
     * same id.
     */
    void commitTo(Map<String, MorkTable> tables) {
        _dictionaries.commit();
        tables.putAll(_tables);
        _tables.clear();
    }
}
