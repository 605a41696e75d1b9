// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.mork;


/**
 * An error caused by an attempt to modify a table or row after it has
 * been made read-only.
 *
 * @see MorkTable#makeReadOnly()
 */
public class ReadOnlyModelException
    extends MorkException
{
    private static final long serialVersionUID = 1L;

    public ReadOnlyModelException(Class<?> type)
    {
        super("Cannot modify read-only instance of " + type.getSimpleName());
    }
}
