package dev.nds.tiles;

import java.util.logging.Level;
import java.util.logging.Logger;

import org.jetbrains.annotations.NotNull;

/**
 * A coordinate in NDS units, following the NDS Format Specification, Version 2.5.4, §7.2.1.
 * 
 * The 360° range is divided into 2^32 steps, a unit is 360/2^32 = 90/2^30 degrees on both axes. Longitude uses the
 * full signed int range, latitude only half of it, in favour of equally sized units along both axes.
 * 
 * Immutable, all factories validate their input.
 */
public final class NdsCoordinate {

    private static final Logger LOGGER = Logger.getLogger(NdsCoordinate.class.getName());

    private final int longitude;
    private final int latitude;

    /**
     * Private constructor, use the factories
     * 
     * @param longitude longitude in NDS units, already validated
     * @param latitude latitude in NDS units, already validated
     */
    private NdsCoordinate(int longitude, int latitude) {
        this.longitude = longitude;
        this.latitude = latitude;
    }

    /**
     * Create a coordinate from raw NDS units.
     * 
     * Both values are wrapped to 32 bit two's complement first, values above the axis maximum are then clamped to it.
     * 
     * @param longitude longitude in NDS units
     * @param latitude latitude in NDS units
     * @return a new NdsCoordinate
     * @throws OutOfRangeException if a value is below the axis minimum after wrapping
     */
    @NotNull
    public static NdsCoordinate fromUnits(long longitude, long latitude) {
        int lon = Math.min(Bits.toSigned32(longitude), Const.MAX_LONGITUDE);
        int lat = Math.min(Bits.toSigned32(latitude), Const.MAX_LATITUDE);
        verify(lon, lat);
        return new NdsCoordinate(lon, lat);
    }

    /**
     * Create a coordinate from WGS84 degrees, fractions of a unit are truncated towards zero
     * 
     * @param longitude longitude within [-180, 180]
     * @param latitude latitude within [-90, 90]
     * @return a new NdsCoordinate
     * @throws OutOfRangeException if a value is outside its range
     */
    @NotNull
    public static NdsCoordinate fromDegrees(double longitude, double latitude) {
        Wgs84Coordinate.checkLongitude(longitude);
        Wgs84Coordinate.checkLatitude(latitude);
        long lat = (long) (latitude / 180.0 * Const.LATITUDE_RANGE);
        long lon = (long) (longitude / 360.0 * Const.LONGITUDE_RANGE);
        return fromUnits(lon, lat);
    }

    /**
     * Create a coordinate from a WGS84 coordinate
     * 
     * @param coordinate the WGS84 coordinate
     * @return a new NdsCoordinate
     */
    @NotNull
    public static NdsCoordinate fromWgs84(@NotNull Wgs84Coordinate coordinate) {
        return fromDegrees(coordinate.getLongitude(), coordinate.getLatitude());
    }

    /**
     * Create a coordinate from its Morton code
     * 
     * @param mortonCode the code as returned by {@link #getMortonCode()}
     * @return a new NdsCoordinate
     * @throws OutOfRangeException if the decoded values are outside the coordinate domain
     */
    @NotNull
    public static NdsCoordinate fromMorton(long mortonCode) {
        int lon = MortonCode.decodeLongitude(mortonCode);
        int lat = MortonCode.decodeLatitude(mortonCode);
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.log(Level.FINE, "lat binary: {0}", Bits.toBinaryString(lat));
            LOGGER.log(Level.FINE, "lon binary: {0}", Bits.toBinaryString(lon));
            LOGGER.log(Level.FINE, "lat: {0}, lon: {1}", new Object[] { lat, lon });
        }
        return fromUnits(lon, lat);
    }

    /**
     * Check that both values are inside the coordinate domain
     * 
     * @param longitude longitude in NDS units
     * @param latitude latitude in NDS units
     */
    private static void verify(long longitude, long latitude) {
        if (longitude < Const.MIN_LONGITUDE || longitude > Const.MAX_LONGITUDE) {
            throw new OutOfRangeException(
                    "Longitude value " + longitude + " exceeds allowed range [" + Const.MIN_LONGITUDE + ", " + Const.MAX_LONGITUDE + "].");
        }
        if (latitude < Const.MIN_LATITUDE || latitude > Const.MAX_LATITUDE) {
            throw new OutOfRangeException(
                    "Latitude value " + latitude + " exceeds allowed range [" + Const.MIN_LATITUDE + ", " + Const.MAX_LATITUDE + "].");
        }
    }

    public int getLongitude() {
        return longitude;
    }

    public int getLatitude() {
        return latitude;
    }

    /**
     * Add an offset to this coordinate, useful when decoding coordinates stored relative to a tile
     * 
     * @param deltaLongitude longitude offset in NDS units
     * @param deltaLatitude latitude offset in NDS units
     * @return a new NdsCoordinate, this one is unchanged
     * @throws OutOfRangeException as for {@link #fromUnits(long, long)}
     */
    @NotNull
    public NdsCoordinate add(long deltaLongitude, long deltaLatitude) {
        return fromUnits(longitude + deltaLongitude, latitude + deltaLatitude);
    }

    /**
     * @return the Morton code of this coordinate
     */
    public long getMortonCode() {
        return MortonCode.encode(longitude, latitude);
    }

    /**
     * Convert this coordinate to WGS84.
     * 
     * Positive and negative values are scaled by their own bound as |MIN| is one larger than MAX.
     * 
     * @return a new Wgs84Coordinate
     */
    @NotNull
    public Wgs84Coordinate toWgs84() {
        double lon = longitude >= 0 ? ((double) longitude / Const.MAX_LONGITUDE) * 180.0 : ((double) longitude / Const.MIN_LONGITUDE) * -180.0;
        double lat = latitude >= 0 ? ((double) latitude / Const.MAX_LATITUDE) * 90.0 : ((double) latitude / Const.MIN_LATITUDE) * -90.0;
        return new Wgs84Coordinate(lon, lat);
    }

    /**
     * @return a GeoJSON "Point" feature for this coordinate
     */
    @NotNull
    public String toGeoJson() {
        return toWgs84().toGeoJson();
    }

    @Override
    public int hashCode() {
        return 31 * longitude + latitude;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof NdsCoordinate)) {
            return false;
        }
        NdsCoordinate other = (NdsCoordinate) obj;
        return longitude == other.longitude && latitude == other.latitude;
    }

    @Override
    public String toString() {
        return "NdsCoordinate [longitude=" + longitude + ", latitude=" + latitude + "]";
    }
}
