/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.server.query;

import com.taillens.common.model.LogEntry;

import java.io.IOException;
import java.util.List;

/**
 * Receiver of a {@link LogStream}, implemented by the transport. Throwing
 * {@link IOException} means the client is gone and ends the stream.
 */
public interface LogStreamListener {

    /** A non-empty batch of new entries, in ascending id order. */
    void onEntries(List<LogEntry> entries) throws IOException;

    /** Nothing was delivered for a heartbeat interval. */
    void onHeartbeat() throws IOException;
}
