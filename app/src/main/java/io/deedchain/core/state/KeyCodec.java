package io.deedchain.core.state;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Encodes a column key into the raw bytes used by byte-oriented stores.
 * Encodings are fixed-width or length-prefixed so distinct keys never collide.
 */
@FunctionalInterface
public interface KeyCodec<K> {

    byte[] encode(K key);

    KeyCodec<Long> LONG = key -> ByteBuffer.allocate(8).putLong(key).array();

    KeyCodec<String> UTF8 = key -> key.getBytes(StandardCharsets.UTF_8);

    /** Length-prefixed string followed by a big-endian long. */
    static byte[] stringAndLong(String s, long value) {
        byte[] str = s.getBytes(StandardCharsets.UTF_8);
        ByteBuffer buf = ByteBuffer.allocate(4 + str.length + 8);
        buf.putInt(str.length);
        buf.put(str);
        buf.putLong(value);
        return buf.array();
    }

    static byte[] longAndString(long value, String s) {
        byte[] str = s.getBytes(StandardCharsets.UTF_8);
        ByteBuffer buf = ByteBuffer.allocate(8 + 4 + str.length);
        buf.putLong(value);
        buf.putInt(str.length);
        buf.put(str);
        return buf.array();
    }
}
