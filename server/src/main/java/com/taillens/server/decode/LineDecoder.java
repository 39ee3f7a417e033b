/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.server.decode;

import com.taillens.common.model.LogRecord;

/**
 * Turns one line of the watched file into a {@link LogRecord}.
 *
 * <p>Implementations must not throw: a line that cannot be decoded degrades to a
 * {@link com.taillens.common.model.RawRecord} instead of being dropped.</p>
 */
@FunctionalInterface
public interface LineDecoder {

    LogRecord decode(String line);
}
