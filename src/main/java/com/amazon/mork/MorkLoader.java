// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.mork;

import com.amazon.mork.system.MorkLoaderBuilder;

/**
 * Loads Mork sources into tables.  Instances are built by
 * {@link MorkLoaderBuilder} and are safe to share between threads: each
 * call owns its own scanner, dictionaries and table map, and nothing is
 * carried over from one call to the next.
 * <p>
 * Loading never throws for malformed input.  The first problem found is
 * returned by {@link MorkParseResult#getError()} along with the tables
 * completed before it.
 */
public interface MorkLoader
{
    /** Source name used by {@link #load(byte[])}. */
    String UNNAMED_SOURCE = "<bytes>";

    /**
     * Parses one complete Mork source.
     *
     * @param sourceName the name reported in error messages, usually the
     * file name; must not be null.
     * @param data the whole source; it is not modified or retained.
     */
    MorkParseResult load(String sourceName, byte[] data);

    /**
     * Parses one complete Mork source named {@value #UNNAMED_SOURCE}.
     */
    MorkParseResult load(byte[] data);
}
