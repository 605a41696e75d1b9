// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.mork;

/**
 * An error caused by a well-formed token appearing where the grammar
 * requires something else, including input that ends inside a dict, table,
 * row or cell.
 */
public class MorkSyntaxException
    extends MorkParseException
{
    private static final long serialVersionUID = 1L;

    private final String myFoundToken;

    public MorkSyntaxException(String sourceName, SourcePosition position,
                               String detail, String foundToken)
    {
        super(sourceName, position, detail);
        myFoundToken = foundToken;
    }

    /**
     * @return the source text of the offending token; empty at end of input.
     */
    public String getFoundToken()
    {
        return myFoundToken;
    }
}
