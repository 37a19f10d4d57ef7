package com.maxdemarzi.minimizer.kmap;

import org.apache.commons.lang3.Validate;

/**
 * Reflected Gray sequences for one and two axis variables. Neighbours differ
 * in a single bit, including the wrap from last back to first.
 */
public final class GrayCode {

    private static final int[] ONE_BIT = {0, 1};
    private static final int[] TWO_BIT = {0, 1, 3, 2};

    private GrayCode() {
    }

    public static int[] sequence(int bits) {
        Validate.inclusiveBetween(0, 2, bits, "No Gray sequence for %d bits", bits);
        switch (bits) {
            case 0:
                return new int[]{0};
            case 1:
                return ONE_BIT.clone();
            default:
                return TWO_BIT.clone();
        }
    }

    public static boolean isCyclic(int[] sequence) {
        if (sequence.length < 2) {
            return true;
        }
        for (int i = 0; i < sequence.length; i++) {
            int next = sequence[(i + 1) % sequence.length];
            if (Integer.bitCount(sequence[i] ^ next) != 1) {
                return false;
            }
        }
        return true;
    }
}
