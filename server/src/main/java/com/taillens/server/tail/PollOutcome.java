/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.server.tail;

/** Result of one {@link FileTailer#pollOnce()} step. */
public enum PollOutcome {
    /** New complete lines were admitted. */
    GREW,
    /** Nothing new (or only a partial line). */
    IDLE,
    /** The path now names a different file; state was reset and reloaded. */
    ROTATED,
    /** The file shrank below the consumed offset; state was reset and reloaded. */
    TRUNCATED,
    /** The file does not exist. */
    MISSING,
    /** The step failed; nothing changed. */
    ERROR
}
