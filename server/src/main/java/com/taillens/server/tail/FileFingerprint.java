/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.server.tail;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;

/**
 * Identity of a file independent of its path. On POSIX systems this is the
 * {@code (dev, ino)} pair exposed as {@link BasicFileAttributes#fileKey()}; where the
 * platform offers no file key the creation time stands in.
 *
 * @param fileKey      platform file key, {@code null} if unsupported
 * @param creationTime creation time, only consulted when there is no file key
 */
public record FileFingerprint(Object fileKey, FileTime creationTime) {

    public static FileFingerprint of(Path path) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
        Object key = attrs.fileKey();
        return key != null
                ? new FileFingerprint(key, null)
                : new FileFingerprint(null, attrs.creationTime());
    }
}
