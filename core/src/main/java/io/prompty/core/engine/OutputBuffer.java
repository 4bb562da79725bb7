package io.prompty.core.engine;

import io.prompty.core.error.ResourceLimitException;
import io.prompty.core.model.Position;

/** Output accumulator that enforces the UTF-8 output size limit on every append. */
final class OutputBuffer {

    private final StringBuilder text = new StringBuilder();
    private final long maxBytes;
    private long bytes;

    OutputBuffer(long maxBytes) {
        this.maxBytes = maxBytes;
    }

    void append(String chunk, Position position) {
        if (chunk == null || chunk.isEmpty()) {
            return;
        }
        bytes += utf8Length(chunk);
        if (bytes > maxBytes) {
            throw new ResourceLimitException(
                    ResourceLimitException.Limit.OUTPUT_SIZE,
                    String.format("output size exceeded: %d bytes > %d bytes", bytes, maxBytes),
                    position,
                    null);
        }
        text.append(chunk);
    }

    @Override
    public String toString() {
        return text.toString();
    }

    static long utf8Length(CharSequence s) {
        long count = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x80) {
                count += 1;
            } else if (c < 0x800 || Character.isSurrogate(c)) {
                count += 2;
            } else {
                count += 3;
            }
        }
        return count;
    }
}
