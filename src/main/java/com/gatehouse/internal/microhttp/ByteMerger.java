package com.gatehouse.internal.microhttp;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates byte arrays and concatenates them once, on {@link #merge()}.
 */
class ByteMerger {

    private final List<byte[]> arrays = new ArrayList<>();
    private int size;

    void add(byte[] array) {
        arrays.add(array);
        size += array.length;
    }

    int size() {
        return size;
    }

    byte[] merge() {
        byte[] result = new byte[size];
        int offset = 0;
        for (byte[] array : arrays) {
            System.arraycopy(array, 0, result, offset, array.length);
            offset += array.length;
        }
        return result;
    }

}
