/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.taillens.server.tail;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Reads the complete lines of a byte range of a file.
 *
 * <p>Only lines terminated by {@code \n} are returned; a trailing partial line is left
 * for the next read and {@link Chunk#endOffset()} points at its first byte. Bytes are
 * decoded as UTF-8 with malformed sequences dropped. A {@code \r} before the newline is
 * stripped and blank lines are skipped.</p>
 */
final class LineChunkReader {

    private static final int BUFFER_SIZE = 64 * 1024;

    /**
     * @param lines     decoded lines in file order
     * @param endOffset offset just past the last complete line that was consumed
     */
    record Chunk(List<String> lines, long endOffset) {}

    private LineChunkReader() {}

    /**
     * @param keepLast when positive, only the last {@code keepLast} lines are returned
     *                 (all lines are still consumed)
     */
    static Chunk read(FileChannel channel, long from, long to, int keepLast) throws IOException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.IGNORE)
                .onUnmappableCharacter(CodingErrorAction.IGNORE);
        Deque<String> lines = new ArrayDeque<>();
        ByteArrayOutputStream pending = new ByteArrayOutputStream(256);
        ByteBuffer buf = ByteBuffer.allocate(BUFFER_SIZE);

        long position = from;
        long consumed = from;
        while (position < to) {
            buf.clear();
            buf.limit((int) Math.min(BUFFER_SIZE, to - position));
            int n = channel.read(buf, position);
            if (n <= 0) break;
            for (int i = 0; i < n; i++) {
                byte b = buf.get(i);
                position++;
                if (b == '\n') {
                    consumed = position;
                    String line = decode(decoder, pending);
                    pending.reset();
                    lines.addLast(line);
                    if (keepLast > 0 && lines.size() > keepLast) {
                        lines.removeFirst();
                    }
                } else {
                    pending.write(b);
                }
            }
        }
        return new Chunk(new ArrayList<>(lines), consumed);
    }

    private static String decode(CharsetDecoder decoder, ByteArrayOutputStream bytes) throws IOException {
        byte[] raw = bytes.toByteArray();
        int length = raw.length;
        if (length > 0 && raw[length - 1] == '\r') length--;
        try {
            decoder.reset();
            return decoder.decode(ByteBuffer.wrap(raw, 0, length)).toString();
        } catch (CharacterCodingException e) {
            throw new IOException("UTF-8 decoding failed", e);
        }
    }
}
