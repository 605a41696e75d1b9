// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.mork.impl;

import static com.amazon.mork.impl.MorkDictionaries.ATOM_NAMESPACE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.amazon.mork.MorkOid;
import com.amazon.mork.MorkTable;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class MorkGroupTest
{
    @Test
    public void testCommitReplacesTablesAndDefinesAliases()
    {
        MorkDictionaries root = new MorkDictionaries();
        Map<String, MorkTable> tables = new LinkedHashMap<String, MorkTable>();
        MorkTable old = new MorkTable(new MorkOid("1", "c"));
        tables.put(old.getId(), old);

        MorkGroup group = new MorkGroup("2A", root);
        assertEquals("2A", group.getId());
        MorkTable replacement = new MorkTable(new MorkOid("1", "c"));
        MorkTable added = new MorkTable(new MorkOid("2", "c"));
        group.getTables().put(replacement.getId(), replacement);
        group.getTables().put(added.getId(), added);
        group.getDictionaries().define("80", ATOM_NAMESPACE, "v");

        assertNull(root.lookup("80", ATOM_NAMESPACE));
        assertSame(old, tables.get("1:c"));

        group.commitTo(tables);

        assertEquals("v", root.lookup("80", ATOM_NAMESPACE));
        assertSame(replacement, tables.get("1:c"));
        assertSame(added, tables.get("2:c"));
        assertTrue(group.getTables().isEmpty());
    }
}
