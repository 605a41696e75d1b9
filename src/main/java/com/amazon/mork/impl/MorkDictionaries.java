// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.mork.impl;

import java.util.HashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * The alias tables of one parse: for each namespace, hex ids mapped to the
 * strings they stand for.  Definitions are applied in document order and a
 * later definition of the same id replaces the earlier one; no history is
 * kept.
 * <p>
 * An overlay created by {@link #newOverlay()} sees every entry of its parent
 * but writes only to itself, so a transaction group can be thrown away
 * without touching the parent.  {@link #commit()} copies the overlay's
 * entries into the parent in one step.
 * <p>
 * Not thread safe; each parse owns its instance.
 */
final class MorkDictionaries
{
    /** Namespace of cell values and the default target of a dict. */
    static final String ATOM_NAMESPACE   = "a";
    /** Namespace of column names and of table ids. */
    static final String COLUMN_NAMESPACE = "c";

    private final MorkDictionaries _parent;
    private final Map<String, Map<String, String>> _dicts =
        new HashMap<String, Map<String, String>>();

    MorkDictionaries() {
        this(null);
    }

    private MorkDictionaries(MorkDictionaries parent) {
        _parent = parent;
    }

    /**
     * @return a fresh overlay whose parent is this instance.
     */
    MorkDictionaries newOverlay() {
        return new MorkDictionaries(this);
    }

    boolean isOverlay() {
        return _parent != null;
    }

    /**
     * Returns this instance's own dictionary for a namespace, creating it if
     * needed.  For an overlay that excludes the parent's entries.
     */
    Map<String, String> dictionaryFor(String namespace) {
        Map<String, String> dict = _dicts.get(namespace);
        if (dict == null) {
            dict = new HashMap<String, String>();
            _dicts.put(namespace, dict);
        }
        return dict;
    }

    void define(String id, String namespace, String value) {
        dictionaryFor(namespace).put(id, value);
    }

    /**
     * Looks up an id in this instance, then in its parent chain.
     *
     * @return null if the id is not defined in that namespace.
     */
    @Nullable
    String lookup(String id, String namespace) {
        for (MorkDictionaries d = this; d != null; d = d._parent) {
            Map<String, String> dict = d._dicts.get(namespace);
            if (dict != null) {
                String value = dict.get(id);
                if (value != null) {
                    return value;
                }
            }
        }
        return null;
    }

    /**
     * Copies every entry of this overlay into its parent, overwriting the
     * parent's entries for the same ids, and empties the overlay.
     *
     * @throws IllegalStateException if this is not an overlay.
     */
    void commit() {
        if (_parent == null) {
            throw new IllegalStateException("not an overlay");
        }
        for (Map.Entry<String, Map<String, String>> e : _dicts.entrySet()) {
            _parent.dictionaryFor(e.getKey()).putAll(e.getValue());
        }
        _dicts.clear();
    }

    /**
     * @return the number of ids this instance itself defines, over all namespaces.
     */
    int size() {
        int size = 0;
        for (Map<String, String> dict : _dicts.values()) {
            size += dict.size();
        }
        return size;
    }
}
