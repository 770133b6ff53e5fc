package dev.nds.tiles;

import org.jetbrains.annotations.NotNull;

/**
 * A bounding box in WGS84 degrees. Immutable.
 */
public final class Wgs84BBox {

    private final double north;
    private final double east;
    private final double south;
    private final double west;

    /**
     * Create a new bounding box, west may be larger than east for boxes crossing the antimeridian
     * 
     * @param north northern boundary (latitude)
     * @param east eastern boundary (longitude)
     * @param south southern boundary (latitude)
     * @param west western boundary (longitude)
     * @throws OutOfRangeException if north is south of south
     */
    public Wgs84BBox(double north, double east, double south, double west) {
        if (north < south) {
            throw new OutOfRangeException("The northern boundary " + north + " is south of the southern boundary " + south + ".");
        }
        this.north = north;
        this.east = east;
        this.south = south;
        this.west = west;
    }

    public double getNorth() {
        return north;
    }

    public double getEast() {
        return east;
    }

    public double getSouth() {
        return south;
    }

    public double getWest() {
        return west;
    }

    /**
     * Create a GeoJSON "Polygon" feature for this box, the ring starts and ends in the south west corner
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
        json.append("    \"type\": \"Polygon\",\n");
        json.append("    \"coordinates\": [\n");
        json.append("      [\n");
        appendPosition(json, west, south).append(",\n");
        appendPosition(json, east, south).append(",\n");
        appendPosition(json, east, north).append(",\n");
        appendPosition(json, west, north).append(",\n");
        appendPosition(json, west, south).append('\n');
        json.append("      ]\n");
        json.append("    ]\n");
        json.append("  }\n");
        json.append("}");
        return json.toString();
    }

    private static StringBuilder appendPosition(@NotNull StringBuilder json, double longitude, double latitude) {
        return json.append("        [").append(longitude).append(", ").append(latitude).append(']');
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        long temp;
        temp = Double.doubleToLongBits(east);
        result = prime * result + (int) (temp ^ (temp >>> 32));
        temp = Double.doubleToLongBits(north);
        result = prime * result + (int) (temp ^ (temp >>> 32));
        temp = Double.doubleToLongBits(south);
        result = prime * result + (int) (temp ^ (temp >>> 32));
        temp = Double.doubleToLongBits(west);
        result = prime * result + (int) (temp ^ (temp >>> 32));
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Wgs84BBox)) {
            return false;
        }
        Wgs84BBox other = (Wgs84BBox) obj;
        return Double.doubleToLongBits(east) == Double.doubleToLongBits(other.east)
                && Double.doubleToLongBits(north) == Double.doubleToLongBits(other.north)
                && Double.doubleToLongBits(south) == Double.doubleToLongBits(other.south)
                && Double.doubleToLongBits(west) == Double.doubleToLongBits(other.west);
    }

    @Override
    public String toString() {
        return "Wgs84BBox [north=" + north + ", east=" + east + ", south=" + south + ", west=" + west + "]";
    }
}
