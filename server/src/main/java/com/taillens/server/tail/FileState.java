/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.server.tail;

import java.nio.file.Path;

/**
 * What the tailer knows about the watched file: how far it has read, which physical
 * file that offset belongs to, and how many times it has had to start over.
 * Owned and mutated by {@link FileTailer} only.
 */
public final class FileState {

    private final Path path;
    // written by the poll thread, read by shutdown and diagnostics
    private volatile long offset;
    private volatile FileFingerprint fingerprint;
    private volatile long generation;

    FileState(Path path) {
        this.path = path;
    }

    public Path path() { return path; }

    /** Bytes consumed so far; always the end of a complete line. */
    public long offset() { return offset; }

    /** Identity of the file the offset refers to, {@code null} when no file is known. */
    public FileFingerprint fingerprint() { return fingerprint; }

    /** Number of rotations, truncations and disappearances handled so far. */
    public long generation() { return generation; }

    void advanceTo(long newOffset) {
        this.offset = newOffset;
    }

    void attach(FileFingerprint newFingerprint, long newOffset) {
        this.fingerprint = newFingerprint;
        this.offset = newOffset;
    }

    void forget() {
        this.fingerprint = null;
        this.offset = 0;
    }

    long nextGeneration() {
        return ++generation;
    }

    @Override
    public String toString() {
        return "FileState{path=" + path + ", offset=" + offset
                + ", fingerprint=" + fingerprint + ", generation=" + generation + "}";
    }
}
