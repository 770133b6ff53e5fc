package dev.nds.tiles;

import java.util.logging.Level;
import java.util.logging.Logger;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A tile of the NDS tiling scheme, following the NDS Format Specification, Version 2.5.4, §7.3.1.
 * 
 * Level 0 splits the world at the prime meridian into two tiles, every further level splits each tile into four. The
 * tile number of a level is the Morton code of the tile's south west corner with the fine bits dropped, so a level l
 * tile number has 2l+1 bits. The packed tile id marks the level by setting bit 16+l on top of the tile number:
 * 
 * <pre>
 *     packed id = tile number | 1 &lt;&lt; (16 + level)
 * </pre>
 * 
 * For level 15 the marker is bit 31, packed ids of level 15 tiles are negative ints.
 * 
 * Immutable, the center is computed on first use.
 */
public final class NdsTile {

    private static final Logger LOGGER = Logger.getLogger(NdsTile.class.getName());

    private final int level;
    private final int tileNumber;

    private volatile NdsCoordinate center;

    /**
     * Private constructor, use the factories
     * 
     * @param level the level, already validated
     * @param tileNumber the tile number, already validated
     */
    private NdsTile(int level, int tileNumber) {
        this.level = level;
        this.tileNumber = tileNumber;
    }

    /**
     * Create a tile from its packed id
     * 
     * @param packedId the packed id
     * @return a new NdsTile
     * @throws MalformedTileIdException if no level marker bit is set
     * @throws OutOfRangeException if the bits below the marker are not a tile number of the level
     */
    @NotNull
    public static NdsTile fromPackedId(int packedId) {
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.log(Level.FINE, "Packed ID binary: {0}", Bits.toBinaryString(packedId & 0xFFFFFFFFL));
        }
        int level = extractLevel(packedId);
        if (level < 0) {
            throw new MalformedTileIdException(packedId);
        }
        return of(level, packedId ^ levelMarker(level));
    }

    /**
     * Create a tile from a level and tile number
     * 
     * @param level the level, 0 to {@link Const#MAX_LEVEL}
     * @param tileNumber the tile number, 0 to 2^(2*level+1)-1
     * @return a new NdsTile
     * @throws OutOfRangeException if level or tile number are out of range
     */
    @NotNull
    public static NdsTile of(int level, int tileNumber) {
        checkLevel(level);
        if (tileNumber < 0) {
            throw new OutOfRangeException("The Tile id " + tileNumber + " must be positive (Max length is 31 bits).");
        }
        long maxTileNumber = maxTileNumber(level);
        if (tileNumber > maxTileNumber) {
            throw new OutOfRangeException("Invalid Tile number for level " + level + ", numbers 0 .. " + maxTileNumber + " are allowed.");
        }
        return new NdsTile(level, tileNumber);
    }

    /**
     * Create the tile of a level that contains a coordinate
     * 
     * @param level the level, 0 to {@link Const#MAX_LEVEL}
     * @param coordinate the coordinate
     * @return a new NdsTile
     * @throws OutOfRangeException if the level is out of range
     */
    @NotNull
    public static NdsTile of(int level, @NotNull NdsCoordinate coordinate) {
        checkLevel(level);
        return new NdsTile(level, tileNumber(level, coordinate));
    }

    /**
     * Create the tile of a level that contains a WGS84 coordinate
     * 
     * @param level the level, 0 to {@link Const#MAX_LEVEL}
     * @param coordinate the coordinate
     * @return a new NdsTile
     * @throws OutOfRangeException if the level is out of range
     */
    @NotNull
    public static NdsTile of(int level, @NotNull Wgs84Coordinate coordinate) {
        return of(level, NdsCoordinate.fromWgs84(coordinate));
    }

    /**
     * Get the level from a packed tile id, the highest marker bit wins
     * 
     * @param packedId the packed id
     * @return the level or -1 if no marker bit is set
     */
    static int extractLevel(int packedId) {
        if (packedId < 0) {
            // sign bit is the marker of the highest level
            return Const.MAX_LEVEL;
        }
        for (int l = Const.MAX_LEVEL; l >= 0; l--) {
            if ((packedId & levelMarker(l)) != 0) {
                return l;
            }
        }
        return -1;
    }

    private static void checkLevel(int level) {
        if (level < 0 || level > Const.MAX_LEVEL) {
            throw new OutOfRangeException("The Tile level " + level + " exceeds the range [0, " + Const.MAX_LEVEL + "].");
        }
    }

    private static int levelMarker(int level) {
        return 1 << (Const.LEVEL_MARKER_OFFSET + level);
    }

    private static long maxTileNumber(int level) {
        return (1L << (2 * level + 1)) - 1;
    }

    /**
     * @param level the level
     * @return the number of Morton code bits below the tile number of a level
     */
    private static int shift(int level) {
        return Const.MORTON_BASE_SHIFT + (Const.MAX_LEVEL - level) * 2;
    }

    private static int tileNumber(int level, @NotNull NdsCoordinate coordinate) {
        return (int) (coordinate.getMortonCode() >>> shift(level));
    }

    public int getLevel() {
        return level;
    }

    public int getTileNumber() {
        return tileNumber;
    }

    /**
     * Check if a coordinate is in this tile, exact as it compares Morton code prefixes
     * 
     * @param coordinate the coordinate
     * @return true if the coordinate is in this tile
     */
    public boolean contains(@NotNull NdsCoordinate coordinate) {
        return tileNumber == tileNumber(level, coordinate);
    }

    /**
     * @return the packed id of this tile, negative for level 15
     */
    public int getPackedId() {
        return tileNumber + levelMarker(level);
    }

    /**
     * @return the Morton code of the south west corner of this tile
     */
    public long southWestAsMorton() {
        return ((long) tileNumber) << shift(level);
    }

    /**
     * Get the center of the tile, the result is cached.
     * 
     * Integer division loses a unit when the south west corner is negative, it is added back.
     * 
     * @return the center as NdsCoordinate
     */
    @NotNull
    public NdsCoordinate getCenter() {
        NdsCoordinate result = center;
        if (result == null) {
            result = computeCenter();
            center = result;
        }
        return result;
    }

    @NotNull
    private NdsCoordinate computeCenter() {
        if (level == 0) {
            return tileNumber == 0 ? NdsCoordinate.fromUnits(Const.MAX_LONGITUDE / 2, 0) : NdsCoordinate.fromUnits(Const.MIN_LONGITUDE / 2, 0);
        }
        NdsCoordinate sw = southWest();
        long lat = sw.getLatitude() + Const.LATITUDE_RANGE / (1L << (level + 1)) + (sw.getLatitude() < 0 ? 1 : 0);
        long lon = sw.getLongitude() + Const.LONGITUDE_RANGE / (1L << (level + 2)) + (sw.getLongitude() < 0 ? 1 : 0);
        return NdsCoordinate.fromUnits(lon, lat);
    }

    /**
     * Create the bounding box of this tile
     * 
     * @return a NdsBBox, for level 0 one of the hemisphere boxes
     */
    @NotNull
    public NdsBBox getBBox() {
        if (level == 0) {
            return tileNumber == 0 ? NdsBBox.EAST_HEMISPHERE : NdsBBox.WEST_HEMISPHERE;
        }
        NdsCoordinate sw = southWest();
        long north = sw.getLatitude() + Const.LATITUDE_RANGE / (1L << level) + (sw.getLatitude() < 0 ? 1 : 0);
        long east = sw.getLongitude() + Const.LONGITUDE_RANGE / (1L << (level + 1)) + (sw.getLongitude() < 0 ? 1 : 0);
        return new NdsBBox((int) north, (int) east, sw.getLatitude(), sw.getLongitude());
    }

    @NotNull
    private NdsCoordinate southWest() {
        long morton = southWestAsMorton();
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.log(Level.FINE, "South west morton code binary: {0}", Bits.toBinaryString(morton));
        }
        return NdsCoordinate.fromMorton(morton);
    }

    /*-
     * Decodes the tile number into the column and row of the tile in its level's grid. Level 1:
     *
     *     [-2,  0] [-1,  0] [0,  0] [1,  0]
     *     [-2, -1] [-1, -1] [0, -1] [1, -1]
     *
     * with the tile numbers
     *
     *     4 5 0 1
     *     6 7 2 3
     *
     * Level 2:
     *
     *     [-4,  1] [-3,  1] [-2,  1] [-1,  1] [0,  1] [1,  1] [2,  1] [3,  1]
     *     [-4,  0] [-3,  0] [-2,  0] [-1,  0] [0,  0] [1,  0] [2,  0] [3,  0]
     *     [-4, -1] [-3, -1] [-2, -1] [-1, -1] [0, -1] [1, -1] [2, -1] [3, -1]
     *     [-4, -2] [-3, -2] [-2, -2] [-1, -2] [0, -2] [1, -2] [2, -2] [3, -2]
     *
     * with the tile numbers
     *
     *     18 19 22 23  2  3  6  7
     *     16 17 20 21  0  1  4  5
     *     26 27 30 31 10 11 14 15
     *     24 25 28 29  8  9 12 13
     */
    @NotNull
    public GridCoordinates getGridCoordinates() {
        if (level == 0) {
            return tileNumber == 0 ? new GridCoordinates(0, 0) : new GridCoordinates(-1, 0);
        }
        int col = 0;
        int row = 0;
        long mask = 1;
        int bit = 1;
        for (int i = 0; i <= level; i++) {
            if ((tileNumber & mask) != 0) {
                col |= bit;
            }
            mask <<= 1;
            if ((tileNumber & mask) != 0) {
                row |= bit;
            }
            mask <<= 1;
            bit <<= 1;
        }
        if (col >= 1 << level) {
            col -= 1 << (level + 1);
        }
        if (row >= 1 << (level - 1)) {
            row -= 1 << level;
        }
        return new GridCoordinates(col, row);
    }

    /**
     * @return a GeoJSON "Polygon" feature for the bounding box of this tile
     */
    @NotNull
    public String toGeoJson() {
        return getBBox().toGeoJson();
    }

    @Override
    public int hashCode() {
        return getPackedId();
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof NdsTile)) {
            return false;
        }
        NdsTile other = (NdsTile) obj;
        return level == other.level && tileNumber == other.tileNumber;
    }

    @Override
    public String toString() {
        return "NdsTile [level=" + level + ", tileNumber=" + tileNumber + "]";
    }
}
