// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.mork.impl;

import com.amazon.mork.MorkLoader;
import com.amazon.mork.MorkParseResult;

/**
 * Holds only immutable configuration; each load gets a fresh lexer and parser.
 */
final class MorkLoaderImpl
    implements MorkLoader
{
    private final LiteralDecoder _decoder;
    private final boolean        _validate_group_ids;

    MorkLoaderImpl(LiteralDecoder decoder, boolean validateGroupIds) {
        _decoder = decoder;
        _validate_group_ids = validateGroupIds;
    }

    @Override
    public MorkParseResult load(String sourceName, byte[] data) {
        if (sourceName == null) throw new NullPointerException("sourceName");
        MorkLexer lexer = new MorkLexer(data);
        MorkParser parser = new MorkParser(sourceName, lexer, _decoder, _validate_group_ids);
        return parser.parse();
    }

    @Override
    public MorkParseResult load(byte[] data) {
        return load(UNNAMED_SOURCE, data);
    }
}
