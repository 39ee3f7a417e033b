/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.common.exception;

/**
 * Base exception for all TailLens errors.
 */
public class TailLensException extends RuntimeException {
    private final String errorCode;

    public TailLensException(String message) {
        super(message);
        this.errorCode = "TL_GENERIC";
    }

    public TailLensException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public TailLensException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() { return errorCode; }
}
