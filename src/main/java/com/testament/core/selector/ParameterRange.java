package com.testament.core.selector;

import java.util.Arrays;

/**
 * The slice of a parameter list a selector asked for, e.g. {@code testAdd[1:4:2]}.
 * <p>
 * Bounds are kept as written; {@link #indices(int)} resolves them against a list with
 * slice semantics (negative bounds count from the end, out-of-range bounds clamp).
 */
public record ParameterRange(int start, int stop, int step) {

    public static final ParameterRange EMPTY = new ParameterRange(0, 0, 1);

    public ParameterRange {
        if (step == 0) {
            throw new IllegalArgumentException("step must not be zero");
        }
    }

    public static ParameterRange full(int size) {
        return new ParameterRange(0, size, 1);
    }

    /**
     * Parses the bracket suffix of a test filter against a parameter list of the given size.
     * <p>
     * No brackets selects everything; {@code name[i]} selects one index; {@code name[a:b]}
     * and {@code name[a:b:c]} select a slice. Anything malformed selects nothing.
     */
    public static ParameterRange parse(String filter, int size) {
        int open = filter.indexOf('[');
        if (open < 0) {
            return filter.indexOf(']') < 0 ? full(size) : EMPTY;
        }
        if (!filter.endsWith("]")) {
            return EMPTY;
        }
        String token = filter.substring(open + 1, filter.length() - 1);
        if (token.isBlank()) {
            return EMPTY;
        }
        try {
            if (!token.contains(":")) {
                int index = Integer.parseInt(token.trim());
                if (index < 0) {
                    index += size;
                }
                return new ParameterRange(index, index + 1, 1);
            }
            String[] segments = token.split(":", -1);
            if (segments.length > 3) {
                return EMPTY;
            }
            int step = segments.length == 3 && !segments[2].isBlank() ? Integer.parseInt(segments[2].trim()) : 1;
            if (step == 0) {
                return EMPTY;
            }
            int start = segments[0].isBlank() ? (step > 0 ? 0 : size - 1) : Integer.parseInt(segments[0].trim());
            int stop = segments[1].isBlank() ? (step > 0 ? size : -size - 1) : Integer.parseInt(segments[1].trim());
            return new ParameterRange(start, stop, step);
        } catch (NumberFormatException e) {
            return EMPTY;
        }
    }

    /** Indices of a list of {@code size} elements selected by this range, in iteration order. */
    public int[] indices(int size) {
        int lower = step > 0 ? 0 : -1;
        int upper = step > 0 ? size : size - 1;
        int from = clamp(start, size, lower, upper);
        int to = clamp(stop, size, lower, upper);
        int[] buffer = new int[Math.max(size, 0)];
        int count = 0;
        for (int i = from; step > 0 ? i < to : i > to; i += step) {
            buffer[count++] = i;
        }
        return Arrays.copyOf(buffer, count);
    }

    public int length(int size) {
        return indices(size).length;
    }

    public boolean isEmpty(int size) {
        return length(size) == 0;
    }

    private static int clamp(int bound, int size, int lower, int upper) {
        int value = bound < 0 ? bound + size : bound;
        if (value < lower) {
            return lower;
        }
        return Math.min(value, upper);
    }

    @Override
    public String toString() {
        return "[" + start + ":" + stop + ":" + step + "]";
    }
}
