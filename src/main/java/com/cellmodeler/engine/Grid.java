package com.cellmodeler.engine;

import com.cellmodeler.model.AutomatonConfig;
import com.cellmodeler.model.StateDef;
import java.util.Arrays;
import java.util.List;

/**
 * One generation: a dense {@code width x height} array of indices into the config's ordered state list.
 * Cells therefore always hold one of the declared states.
 */
public final class Grid {

    private final List<StateDef> states;
    private final int width;
    private final int height;
    private final int[] cells;

    /**
     * Creates a grid with every cell in the first declared state.
     */
    public Grid(List<StateDef> states, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive");
        }
        if (states == null || states.isEmpty()) {
            throw new IllegalArgumentException("Grid needs at least one state");
        }
        this.states = List.copyOf(states);
        this.width = width;
        this.height = height;
        this.cells = new int[cellCount(width, height)];
    }

    public Grid(AutomatonConfig config) {
        this(config.states(), config.grid().width(), config.grid().height());
    }

    private Grid(List<StateDef> states, int width, int height, int[] cells) {
        this.states = states;
        this.width = width;
        this.height = height;
        this.cells = cells;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int cellCount() {
        return cells.length;
    }

    public List<StateDef> states() {
        return states;
    }

    public int get(int x, int y) {
        return cells[index(x, y)];
    }

    public StateDef state(int x, int y) {
        return states.get(get(x, y));
    }

    public String stateName(int x, int y) {
        return state(x, y).name();
    }

    public void set(int x, int y, int stateIndex) {
        if (stateIndex < 0 || stateIndex >= states.size()) {
            throw new IllegalArgumentException("State index " + stateIndex + " is out of range");
        }
        cells[index(x, y)] = stateIndex;
    }

    public void set(int x, int y, String stateName) {
        set(x, y, indexOf(stateName));
    }

    public int indexOf(String stateName) {
        for (int i = 0; i < states.size(); i++) {
            if (states.get(i).name().equals(stateName)) {
                return i;
            }
        }
        throw new IllegalArgumentException("Unknown state '" + stateName + "'");
    }

    public int countOf(String stateName) {
        int target = indexOf(stateName);
        int count = 0;
        for (int cell : cells) {
            if (cell == target) {
                count++;
            }
        }
        return count;
    }

    /**
     * Row-major copy of the state indices.
     */
    public int[][] toRows() {
        int[][] rows = new int[height][];
        for (int y = 0; y < height; y++) {
            rows[y] = Arrays.copyOfRange(cells, y * width, (y + 1) * width);
        }
        return rows;
    }

    private int index(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("Coordinates out of range: (" + x + ", " + y + ")");
        }
        return y * width + x;
    }

    /**
     * Adds one to {@code counts[state]} for every neighbor of (x, y). Off-grid neighbors are skipped
     * unless {@code wrap} is set, in which case coordinates wrap around both edges.
     */
    void countNeighbors(int x, int y, Neighborhood neighborhood, boolean wrap, int[] counts) {
        for (int i = 0; i < neighborhood.size(); i++) {
            int nx = x + neighborhood.dx(i);
            int ny = y + neighborhood.dy(i);
            if (wrap) {
                nx = wrapCoordinate(nx, width);
                ny = wrapCoordinate(ny, height);
            } else if (nx < 0 || nx >= width || ny < 0 || ny >= height) {
                continue;
            }
            counts[cells[ny * width + nx]]++;
        }
    }

    private static int cellCount(int width, int height) {
        try {
            return Math.multiplyExact(width, height);
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException("Grid " + width + "x" + height + " has too many cells", ex);
        }
    }

    private static int wrapCoordinate(int value, int limit) {
        int mod = value % limit;
        if (mod < 0) {
            mod += limit;
        }
        return mod;
    }

    public Grid copy() {
        return new Grid(states, width, height, Arrays.copyOf(cells, cells.length));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Grid other)) {
            return false;
        }
        return width == other.width && height == other.height && Arrays.equals(cells, other.cells)
                && states.equals(other.states);
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(width);
        result = 31 * result + Integer.hashCode(height);
        result = 31 * result + Arrays.hashCode(cells);
        return result;
    }

    @Override
    public String toString() {
        return "Grid[" + width + "x" + height + ", states=" + states.size() + "]";
    }
}
