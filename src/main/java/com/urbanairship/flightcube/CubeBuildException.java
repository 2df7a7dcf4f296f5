/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.flightcube;

/**
 * A cube build failed and none of its output can be trusted: the input couldn't be read, had no
 * rows, or a table couldn't be written.
 */
public class CubeBuildException extends Exception {
    private static final long serialVersionUID = 1L;

    public CubeBuildException(String message) {
        super(message);
    }

    public CubeBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
