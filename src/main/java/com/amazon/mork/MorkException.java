// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.mork;

import java.util.IdentityHashMap;

/**
 * Base class for exceptions thrown throughout this library.  The library
 * works on bytes already in memory and does no I/O of its own, so callers
 * reading files handle their {@link java.io.IOException}s themselves.
 * <p>
 * Errors found while parsing a Mork document are not thrown by the parser
 * itself; they are reported through {@link MorkParseResult#getError()} as a
 * {@link MorkParseException} and only thrown when the caller asks for it.
 */
public class MorkException extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    public MorkException() { super(); }
    public MorkException(String message) { super(message); }
    public MorkException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new exception with the given cause, copying the message
     * from the cause into this instance.
     * @param cause
     *     the root cause of the exception; must not be null.
     */
    public MorkException(Throwable cause) { super(cause.getMessage(), cause); }


    /**
     * Finds the first exception in the {@link #getCause()} chain that is
     * an instance of the given type.
     *
     * @return null if there's no cause of the given type.
     */
    @SuppressWarnings("unchecked")
    public <T extends Throwable> T causeOfType(Class<T> type)
    {
        IdentityHashMap<Throwable, Throwable> seen =
            new IdentityHashMap<Throwable, Throwable>();

        Throwable cause = getCause();
        while (cause != null && ! type.isInstance(cause))
        {
            if (seen.put(cause, cause) != null)  // cycle check
            {
                return null;
            }
            cause = cause.getCause();
        }
        return (T) cause;
    }
}
