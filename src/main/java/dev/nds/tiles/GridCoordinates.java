package dev.nds.tiles;

/**
 * Column and row of a tile in the grid of its level. Column 0 starts at the prime meridian, row 0 at the equator,
 * tiles to the west and south have negative values.
 */
public final class GridCoordinates {

    private final int col;
    private final int row;

    /**
     * Create a new grid position
     * 
     * @param col the column
     * @param row the row
     */
    public GridCoordinates(int col, int row) {
        this.col = col;
        this.row = row;
    }

    public int getCol() {
        return col;
    }

    public int getRow() {
        return row;
    }

    @Override
    public int hashCode() {
        return 31 * col + row;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof GridCoordinates)) {
            return false;
        }
        GridCoordinates other = (GridCoordinates) obj;
        return col == other.col && row == other.row;
    }

    @Override
    public String toString() {
        return "[" + col + ", " + row + "]";
    }
}
