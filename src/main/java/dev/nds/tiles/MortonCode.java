package dev.nds.tiles;

/*-
 * provides methods for interleaving a NDS longitude/latitude pair into a Morton code and back
 *
 * Structure of a code:
 *
 *     bit  63  62  61  60  59  58  57  ...   3   2   1   0
 *           0   X   Y   x   y   x   y  ...   y   x   y   x
 *
 *     x - longitude bit i in code bit 2i, i in [0, 30]
 *     y - latitude bit i in code bit 2i+1, i in [0, 30]
 *     X - longitude sign (longitude bit 31)
 *     Y - latitude sign, this is the same bit as latitude bit 30 for any value in the latitude domain
 */
public final class MortonCode {

    private static final int PAYLOAD_BITS       = 31;
    private static final int LONGITUDE_SIGN_BIT = 62;
    private static final int LATITUDE_SIGN_BIT  = 61;

    /** prevents instantiation */
    private MortonCode() {}

    /**
     * Interleave a coordinate pair
     * 
     * @param longitude longitude in NDS units
     * @param latitude latitude in NDS units, expected to be in the latitude domain
     * @return the Morton code, always &gt;= 0
     */
    public static long encode(int longitude, int latitude) {
        long code = 0;
        for (int pos = 0; pos < PAYLOAD_BITS; pos++) {
            if ((longitude & (1 << pos)) != 0) {
                code |= 1L << (2 * pos);
            }
            if ((latitude & (1 << pos)) != 0) {
                code |= 1L << (2 * pos + 1);
            }
        }
        if (longitude < 0) {
            code |= 1L << LONGITUDE_SIGN_BIT;
        }
        if (latitude < 0) {
            code |= 1L << LATITUDE_SIGN_BIT;
        }
        return code;
    }

    /**
     * Extract the longitude from a code, bit 62 supplies the 32nd bit
     * 
     * @param code the Morton code
     * @return the longitude in NDS units
     */
    public static int decodeLongitude(long code) {
        long longitude = deinterleave(code);
        longitude |= ((code >>> LONGITUDE_SIGN_BIT) & 1L) << PAYLOAD_BITS;
        return Bits.toSigned32(longitude);
    }

    /**
     * Extract the latitude from a code, its bit 30 is the sign of a 31 bit value
     * 
     * @param code the Morton code
     * @return the latitude in NDS units
     */
    public static int decodeLatitude(long code) {
        long latitude = deinterleave(code >>> 1);
        if (latitude >= 1L << (PAYLOAD_BITS - 1)) {
            latitude -= 1L << PAYLOAD_BITS;
        }
        return (int) latitude;
    }

    /**
     * Collect the even bits 0 to 60 of a value
     * 
     * @param value the interleaved value
     * @return the 31 bit payload
     */
    private static long deinterleave(long value) {
        long result = 0;
        for (int pos = 0; pos < PAYLOAD_BITS; pos++) {
            result |= ((value >>> (2 * pos)) & 1L) << pos;
        }
        return result;
    }
}
