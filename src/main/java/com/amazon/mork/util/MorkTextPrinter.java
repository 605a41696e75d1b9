// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.mork.util;

import com.amazon.mork.MorkRow;
import com.amazon.mork.MorkTable;
import com.amazon.mork.impl.MorkLexer;
import com.amazon.mork.impl.MorkToken;
import com.amazon.mork.impl.MorkTokenType;
import java.io.IOException;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders loaded tables, or the raw token stream of a source, as plain
 * text for people to read.
 * <p>
 * Table output looks like this, with tables, rows and columns sorted so the
 * same input always prints the same way.  Meta cells come before the
 * cells of their table or row:
 * <pre>
 * ----- 1:ns:addrbk:db:row:scope:card:all -----
 *   meta k: 'cards'
 *   row 1:
 *     meta s: 'x'
 *     FirstName: 'John'
 *     LastName: 'Doe'
 * </pre>
 * <b>Instances of this class are safe for use by multiple threads.</b>
 */
public final class MorkTextPrinter
{
    private MorkTextPrinter() { }

    /**
     * Prints every table of a load result.
     *
     * @param tables keyed by table id, as returned by
     * {@link com.amazon.mork.MorkParseResult#getTables()}.
     */
    public static void print(Map<String, MorkTable> tables, Appendable out)
        throws IOException
    {
        for (Map.Entry<String, MorkTable> t : sorted(tables).entrySet())
        {
            MorkTable table = t.getValue();
            out.append("----- ").append(t.getKey()).append(" -----\n");
            for (Map.Entry<String, String> cell : sorted(table.getMeta()).entrySet())
            {
                out.append("  meta ");
                printCell(cell, out);
            }
            for (Map.Entry<String, MorkRow> r : sorted(table.getRows()).entrySet())
            {
                out.append("  row ").append(r.getKey()).append(":\n");
                for (Map.Entry<String, String> cell : sorted(r.getValue().getMeta()).entrySet())
                {
                    out.append("    meta ");
                    printCell(cell, out);
                }
                for (Map.Entry<String, String> cell : sorted(r.getValue().getCells()).entrySet())
                {
                    out.append("    ");
                    printCell(cell, out);
                }
            }
        }
    }

    private static void printCell(Map.Entry<String, String> cell, Appendable out)
        throws IOException
    {
        out.append(cell.getKey()).append(": '").append(cell.getValue()).append("'\n");
    }

    private static <V> Map<String, V> sorted(Map<String, V> map)
    {
        return new TreeMap<String, V>(map);
    }

    /**
     * Prints one {@code line:column TYPE "text"} line per token, up to and
     * including the end of input or the first error.
     *
     * @return false if the lexer reported an error.
     */
    public static boolean printTokens(MorkLexer lexer, Appendable out)
        throws IOException
    {
        for (;;)
        {
            MorkToken token = lexer.nextToken();
            out.append(token.toString()).append('\n');
            if (token.getType() == MorkTokenType.ERROR) return false;
            if (token.getType() == MorkTokenType.EOF)   return true;
        }
    }
}
