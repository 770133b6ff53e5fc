package dev.nds.tiles;

/**
 * Fixed ranges of the NDS coordinate and tile scheme.
 */
public final class Const {

    /*
     * a coordinate unit is 360/2^32 degrees on both axes, longitude uses the full signed 32 bit range
     */
    public static final int MAX_LONGITUDE = Integer.MAX_VALUE;
    public static final int MIN_LONGITUDE = Integer.MIN_VALUE;

    /*
     * latitude only covers 180 degrees, so it only needs half of the range
     */
    public static final int MAX_LATITUDE = MAX_LONGITUDE / 2;
    public static final int MIN_LATITUDE = MIN_LONGITUDE / 2;

    // used as divisors, they don't fit in an int
    public static final long LONGITUDE_RANGE = (long) MAX_LONGITUDE - MIN_LONGITUDE;
    public static final long LATITUDE_RANGE  = (long) MAX_LATITUDE - MIN_LATITUDE;

    /**
     * the finest tile level, a level 15 tile number uses 31 bits and the level marker ends up in bit 31 of the packed id
     */
    public static final int MAX_LEVEL = 15;

    /** the level marker of level 0 sits in this bit of a packed tile id */
    static final int LEVEL_MARKER_OFFSET = 16;

    /** number of low Morton code bits that are never part of a tile number */
    static final int MORTON_BASE_SHIFT = 32;

    /**
     * Private constructor to stop instantiation
     */
    private Const() {
        // nothing
    }
}
