package com.maxdemarzi.minimizer.quine;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.Validate;
import org.roaringbitmap.RoaringBitmap;

import java.util.List;
import java.util.Objects;

/**
 * A cube over {@code numVars} variables written as a pattern of '0', '1' and
 * '-' (most significant variable first), together with the minterm indices
 * it was combined from.
 */
public class Implicant {

    public static final char DASH = '-';

    private final String pattern;
    private final RoaringBitmap from;

    public Implicant(int minterm, int numVars) {
        Validate.inclusiveBetween(0, 30, numVars, "Unsupported variable count %d", numVars);
        Validate.isTrue(minterm >= 0 && minterm < (1 << numVars),
                "Minterm %d does not fit in %d variables", minterm, numVars);
        this.pattern = numVars == 0 ? "" : StringUtils.leftPad(Integer.toBinaryString(minterm), numVars, '0');
        this.from = RoaringBitmap.bitmapOf(minterm);
    }

    private Implicant(String pattern, RoaringBitmap from) {
        this.pattern = pattern;
        this.from = from;
    }

    public String getPattern() {
        return pattern;
    }

    public int getNumVars() {
        return pattern.length();
    }

    public RoaringBitmap getFrom() {
        return from.clone();
    }

    public int ones() {
        return StringUtils.countMatches(pattern, '1');
    }

    public int dashes() {
        return StringUtils.countMatches(pattern, DASH);
    }

    /**
     * Two implicants combine when their patterns differ in exactly one place.
     */
    public boolean canCombine(Implicant other) {
        if (other.pattern.length() != pattern.length()) {
            return false;
        }
        int differences = 0;
        for (int i = 0; i < pattern.length(); i++) {
            if (pattern.charAt(i) != other.pattern.charAt(i) && ++differences > 1) {
                return false;
            }
        }
        return differences == 1;
    }

    public Implicant combine(Implicant other) {
        char[] merged = pattern.toCharArray();
        for (int i = 0; i < merged.length; i++) {
            if (merged[i] != other.pattern.charAt(i)) {
                merged[i] = DASH;
            }
        }
        return new Implicant(new String(merged), RoaringBitmap.or(from, other.from));
    }

    public boolean covers(int minterm) {
        int width = pattern.length();
        for (int i = 0; i < width; i++) {
            char symbol = pattern.charAt(i);
            if (symbol == DASH) {
                continue;
            }
            int bit = (minterm >> (width - 1 - i)) & 1;
            if (bit != symbol - '0') {
                return false;
            }
        }
        return true;
    }

    public boolean covers(String bits) {
        if (bits.length() != pattern.length()) {
            return false;
        }
        for (int i = 0; i < pattern.length(); i++) {
            char symbol = pattern.charAt(i);
            if (symbol != DASH && symbol != bits.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    /**
     * All minterm indices this cube stands for, 2^dashes of them.
     */
    public RoaringBitmap coveredMinterms() {
        RoaringBitmap covered = new RoaringBitmap();
        int size = 1 << pattern.length();
        for (int minterm = 0; minterm < size; minterm++) {
            if (covers(minterm)) {
                covered.add(minterm);
            }
        }
        return covered;
    }

    // A'B, or "1" when every position is a dash
    public String getProductTerm(List<String> variables) {
        StringBuilder expr = new StringBuilder();
        for (int i = 0; i < pattern.length(); i++) {
            char symbol = pattern.charAt(i);
            if (symbol == DASH) {
                continue;
            }
            expr.append(variables.get(i));
            if (symbol == '0') {
                expr.append('\'');
            }
        }
        return expr.length() == 0 ? "1" : expr.toString();
    }

    // (A + B'), or "1" when every position is a dash
    public String getSumTerm(List<String> variables) {
        StringBuilder expr = new StringBuilder();

        boolean first = true;
        for (int i = 0; i < pattern.length(); i++) {
            char symbol = pattern.charAt(i);
            if (symbol == DASH) {
                continue;
            }
            if (first) {
                first = false;
            } else {
                expr.append(" + ");
            }
            expr.append(variables.get(i));
            if (symbol == '1') {
                expr.append('\'');
            }
        }
        return first ? "1" : "(" + expr + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Implicant)) return false;
        Implicant other = (Implicant) o;
        return pattern.equals(other.pattern) && from.equals(other.from);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pattern, from);
    }

    @Override
    public String toString() {
        return pattern;
    }
}
