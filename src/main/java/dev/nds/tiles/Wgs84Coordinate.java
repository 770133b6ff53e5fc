package dev.nds.tiles;

import org.jetbrains.annotations.NotNull;

/**
 * A WGS84 longitude/latitude pair in degrees. Immutable.
 * 
 * @see <a href="https://en.wikipedia.org/wiki/World_Geodetic_System">World Geodetic System</a>
 */
public final class Wgs84Coordinate {

    private final double longitude;
    private final double latitude;

    /**
     * Create a new coordinate
     * 
     * @param longitude the longitude value within [-180, 180]
     * @param latitude the latitude value within [-90, 90]
     * @throws OutOfRangeException if a value is outside its range
     */
    public Wgs84Coordinate(double longitude, double latitude) {
        checkLongitude(longitude);
        checkLatitude(latitude);
        this.longitude = longitude;
        this.latitude = latitude;
    }

    /**
     * Check a longitude value
     * 
     * @param longitude the value in degrees
     * @throws OutOfRangeException if the value is not within [-180, 180]
     */
    static void checkLongitude(double longitude) {
        if (!(longitude >= -180 && longitude <= 180)) {
            throw new OutOfRangeException("The longitude value " + longitude + " exceeds the valid range of [-180, 180].");
        }
    }

    /**
     * Check a latitude value
     * 
     * @param latitude the value in degrees
     * @throws OutOfRangeException if the value is not within [-90, 90]
     */
    static void checkLatitude(double latitude) {
        if (!(latitude >= -90 && latitude <= 90)) {
            throw new OutOfRangeException("The latitude value " + latitude + " exceeds the valid range of [-90, 90].");
        }
    }

    public double getLongitude() {
        return longitude;
    }

    public double getLatitude() {
        return latitude;
    }

    /**
     * Create a GeoJSON "Point" feature for this coordinate
     * 
     * @return the feature as a String
     */
    @NotNull
    public String toGeoJson() {
        StringBuilder json = new StringBuilder();
        json.append("{\n");
        json.append("  \"type\": \"Feature\",\n");
        json.append("  \"properties\": {},\n");
        json.append("  \"geometry\": {\n");
        json.append("    \"type\": \"Point\",\n");
        json.append("    \"coordinates\": [\n");
        json.append("      ").append(longitude).append(", ").append(latitude).append('\n');
        json.append("    ]\n");
        json.append("  }\n");
        json.append("}");
        return json.toString();
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        long temp;
        temp = Double.doubleToLongBits(latitude);
        result = prime * result + (int) (temp ^ (temp >>> 32));
        temp = Double.doubleToLongBits(longitude);
        result = prime * result + (int) (temp ^ (temp >>> 32));
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Wgs84Coordinate)) {
            return false;
        }
        Wgs84Coordinate other = (Wgs84Coordinate) obj;
        return Double.doubleToLongBits(longitude) == Double.doubleToLongBits(other.longitude)
                && Double.doubleToLongBits(latitude) == Double.doubleToLongBits(other.latitude);
    }

    @Override
    public String toString() {
        return "Wgs84Coordinate [longitude=" + longitude + ", latitude=" + latitude + "]";
    }
}
