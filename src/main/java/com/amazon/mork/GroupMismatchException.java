// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.mork;

/**
 * An error caused by a group commit marker whose id differs from the id of
 * the group start marker it closes.
 *
 * @see com.amazon.mork.system.MorkLoaderBuilder#withGroupIdValidationEnabled(boolean)
 */
public class GroupMismatchException
    extends MorkParseException
{
    private static final long serialVersionUID = 1L;

    private final String myStartId;
    private final String myEndId;

    public GroupMismatchException(String sourceName, SourcePosition position,
                                  String startId, String endId)
    {
        super(sourceName, position,
              "group " + startId + " committed with id " + endId);
        myStartId = startId;
        myEndId = endId;
    }

    public String getStartId()
    {
        return myStartId;
    }

    public String getEndId()
    {
        return myEndId;
    }
}
