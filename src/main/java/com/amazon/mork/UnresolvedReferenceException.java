// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.mork;

/**
 * An error caused by a {@code ^id} or {@code ^id:namespace} reference whose
 * id has no entry in that namespace's dictionary at the point it is read.
 * Dictionaries only grow in document order, so a reference to an id that is
 * defined later in the same source fails too.
 */
public class UnresolvedReferenceException
    extends MorkParseException
{
    private static final long serialVersionUID = 1L;

    private final String myId;
    private final String myNamespace;

    public UnresolvedReferenceException(String sourceName, SourcePosition position,
                                        String id, String namespace)
    {
        super(sourceName, position, "bad alias " + id + ":" + namespace);
        myId = id;
        myNamespace = namespace;
    }

    public String getId()
    {
        return myId;
    }

    public String getNamespace()
    {
        return myNamespace;
    }
}
