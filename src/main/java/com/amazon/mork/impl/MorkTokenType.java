// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.mork.impl;

/**
 * The kinds of token produced by {@link MorkLexer}.
 */
public enum MorkTokenType
{
    EOF("end of input"),
    ERROR("error"),
    /** The raw bytes of a cell value, up to but excluding the closing paren. */
    LITERAL("literal"),
    /** A name or a hex id; the scanner does not tell them apart. */
    NAME("name"),
    CARET("'^'"),
    PLUS("'+'"),
    COLON("':'"),
    EQUAL("'='"),
    LANGLE("'<'"),
    RANGLE("'>'"),
    LPAREN("'('"),
    RPAREN("')'"),
    LSQUARE("'['"),
    RSQUARE("']'"),
    LBRACE("'{'"),
    RBRACE("'}'"),
    /** <code>&#64;$${id{&#64;</code> */
    GROUP_START("group start"),
    /** <code>&#64;$$}id}&#64;</code> */
    GROUP_COMMIT("group commit"),
    /** <code>&#64;$$}~~}&#64;</code> */
    GROUP_ABORT("group abort");

    private final String myDescription;

    MorkTokenType(String description)
    {
        myDescription = description;
    }

    /**
     * @return the quoted punctuation for single-character tokens, otherwise
     * a short English name.  Used in error messages.
     */
    public String describe()
    {
        return myDescription;
    }

    public boolean isTerminal()
    {
        return this == EOF || this == ERROR;
    }
}
