package dev.nds.tiles;

import org.jetbrains.annotations.NotNull;

/**
 * A bounding box in NDS units. Immutable.
 * 
 * Kept separate from {@link NdsTile} so that tiles don't carry their box around. West may be larger than east, the
 * level 0 hemisphere boxes are stored as they are and not normalized.
 */
public final class NdsBBox {

    /** bounding box of level 0 tile 0 */
    public static final NdsBBox EAST_HEMISPHERE = new NdsBBox(Const.MAX_LATITUDE, Const.MAX_LONGITUDE, Const.MIN_LATITUDE, 0);

    /** bounding box of level 0 tile 1 */
    public static final NdsBBox WEST_HEMISPHERE = new NdsBBox(Const.MAX_LATITUDE, 0, Const.MIN_LATITUDE, Const.MIN_LONGITUDE);

    private final int north;
    private final int east;
    private final int south;
    private final int west;

    /**
     * Create a new bounding box
     * 
     * @param north northern boundary (latitude)
     * @param east eastern boundary (longitude)
     * @param south southern boundary (latitude)
     * @param west western boundary (longitude)
     * @throws OutOfRangeException if a latitude bound is outside the latitude domain or north is south of south
     */
    public NdsBBox(int north, int east, int south, int west) {
        checkLatitude(north);
        checkLatitude(south);
        if (north < south) {
            throw new OutOfRangeException("The northern boundary " + north + " is south of the southern boundary " + south + ".");
        }
        this.north = north;
        this.east = east;
        this.south = south;
        this.west = west;
    }

    private static void checkLatitude(int latitude) {
        if (latitude < Const.MIN_LATITUDE || latitude > Const.MAX_LATITUDE) {
            throw new OutOfRangeException(
                    "Latitude bound " + latitude + " exceeds allowed range [" + Const.MIN_LATITUDE + ", " + Const.MAX_LATITUDE + "].");
        }
    }

    public int getNorth() {
        return north;
    }

    public int getEast() {
        return east;
    }

    public int getSouth() {
        return south;
    }

    public int getWest() {
        return west;
    }

    @NotNull
    public NdsCoordinate southWest() {
        return NdsCoordinate.fromUnits(west, south);
    }

    @NotNull
    public NdsCoordinate southEast() {
        return NdsCoordinate.fromUnits(east, south);
    }

    @NotNull
    public NdsCoordinate northWest() {
        return NdsCoordinate.fromUnits(west, north);
    }

    @NotNull
    public NdsCoordinate northEast() {
        return NdsCoordinate.fromUnits(east, north);
    }

    /**
     * @return the center of the box, halves are rounded towards negative infinity
     */
    @NotNull
    public NdsCoordinate center() {
        return NdsCoordinate.fromUnits(Math.floorDiv((long) east + west, 2L), Math.floorDiv((long) north + south, 2L));
    }

    /**
     * Convert this box to WGS84 via its north east and south west corners
     * 
     * @return a new Wgs84BBox
     */
    @NotNull
    public Wgs84BBox toWgs84() {
        Wgs84Coordinate ne = northEast().toWgs84();
        Wgs84Coordinate sw = southWest().toWgs84();
        return new Wgs84BBox(ne.getLatitude(), ne.getLongitude(), sw.getLatitude(), sw.getLongitude());
    }

    /**
     * @return a GeoJSON "Polygon" feature for this box
     */
    @NotNull
    public String toGeoJson() {
        return toWgs84().toGeoJson();
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + east;
        result = prime * result + north;
        result = prime * result + south;
        result = prime * result + west;
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof NdsBBox)) {
            return false;
        }
        NdsBBox other = (NdsBBox) obj;
        return east == other.east && north == other.north && south == other.south && west == other.west;
    }

    @Override
    public String toString() {
        return "NdsBBox [north=" + north + ", east=" + east + ", south=" + south + ", west=" + west + "]";
    }
}
