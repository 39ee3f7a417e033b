/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.common.exception;

/**
 * Raised when a reader supplies a malformed query parameter. Never raised by the
 * tailing side of the engine.
 */
public class InvalidQueryException extends TailLensException {

    private final String parameter;

    public InvalidQueryException(String parameter, String message) {
        super("TL_INVALID_QUERY", "Invalid parameter '" + parameter + "': " + message);
        this.parameter = parameter;
    }

    public String getParameter() { return parameter; }
}
