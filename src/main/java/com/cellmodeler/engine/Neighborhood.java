package com.cellmodeler.engine;

import java.util.Locale;

/**
 * Neighbor shapes, as (dx, dy) offsets around the cell. The cell itself is never its own neighbor.
 */
public enum Neighborhood {
    VON_NEUMANN(new int[][]{{0, -1}, {-1, 0}, {1, 0}, {0, 1}}),
    MOORE(square(1)),
    EXTENDED_MOORE(square(2));

    private final int[][] offsets;

    Neighborhood(int[][] offsets) {
        this.offsets = offsets;
    }

    public int size() {
        return offsets.length;
    }

    int dx(int i) {
        return offsets[i][0];
    }

    int dy(int i) {
        return offsets[i][1];
    }

    public static Neighborhood parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Neighborhood must not be empty");
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported neighborhood: " + raw, ex);
        }
    }

    private static int[][] square(int radius) {
        int side = 2 * radius + 1;
        int[][] result = new int[side * side - 1][];
        int idx = 0;
        for (int dy = -radius; dy <= radius; dy++) {
            for (int dx = -radius; dx <= radius; dx++) {
                if (dx == 0 && dy == 0) {
                    continue;
                }
                result[idx++] = new int[]{dx, dy};
            }
        }
        return result;
    }
}
