package com.gatehouse.internal.microhttp;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Growable byte buffer with a read cursor, used to split an incoming byte stream into HTTP tokens.
 * <p>
 * {@link #size()} counts every byte held, consumed or not, so it bounds the size of the request being parsed.
 */
class ByteTokenizer {

    private byte[] array = new byte[0];
    private int position;
    private int size;

    int size() {
        return size;
    }

    int capacity() {
        return array.length;
    }

    int remaining() {
        return size - position;
    }

    /**
     * Discards consumed bytes, moving unconsumed bytes to the front.
     */
    void compact() {
        int remaining = size - position;
        System.arraycopy(array, position, array, 0, remaining);
        size = remaining;
        position = 0;
    }

    void add(ByteBuffer buffer) {
        int length = buffer.remaining();
        if (array.length - size < length) {
            array = Arrays.copyOf(array, Math.max(size + length, array.length * 2));
        }
        buffer.get(array, size, length);
        size += length;
    }

    /**
     * Returns the next {@code length} bytes, or {@code null} if not enough bytes have arrived.
     */
    byte[] next(int length) {
        if (size - position < length) {
            return null;
        }
        byte[] result = Arrays.copyOfRange(array, position, position + length);
        position += length;
        return result;
    }

    /**
     * Returns the bytes before the next occurrence of {@code delimiter} and consumes the delimiter,
     * or {@code null} if the delimiter has not arrived.
     */
    byte[] next(byte[] delimiter) {
        int index = indexOf(delimiter);
        if (index < 0) {
            return null;
        }
        byte[] result = Arrays.copyOfRange(array, position, index);
        position = index + delimiter.length;
        return result;
    }

    private int indexOf(byte[] delimiter) {
        outer:
        for (int i = position; i <= size - delimiter.length; i++) {
            for (int j = 0; j < delimiter.length; j++) {
                if (array[i + j] != delimiter[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

}
