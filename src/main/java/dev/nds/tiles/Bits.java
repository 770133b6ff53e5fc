package dev.nds.tiles;

import org.jetbrains.annotations.NotNull;

/**
 * small bit twiddling helpers
 */
public final class Bits {

    private static final long INT_MASK = 0xFFFFFFFFL;
    private static final long SIGN_BIT = 1L << 31;

    /** prevents instantiation */
    private Bits() {}

    /**
     * Interpret the low 32 bits of a value as a two's complement int, higher bits are dropped
     * 
     * @param value the value to wrap
     * @return the wrapped value
     */
    public static int toSigned32(long value) {
        long low = value & INT_MASK;
        if ((low & SIGN_BIT) != 0) {
            low -= 1L << 32;
        }
        return (int) low;
    }

    /**
     * Render the bits of a value in groups of four, counted from the least significant bit. Negative values are shown
     * with all 64 bits.
     * 
     * @param value the value
     * @return a String like "1 0000 0000"
     */
    @NotNull
    public static String toBinaryString(long value) {
        String digits = Long.toBinaryString(value);
        StringBuilder result = new StringBuilder(digits.length() + digits.length() / 4);
        int lead = digits.length() % 4;
        if (lead == 0) {
            lead = 4;
        }
        result.append(digits, 0, lead);
        for (int i = lead; i < digits.length(); i += 4) {
            result.append(' ');
            result.append(digits, i, i + 4);
        }
        return result.toString();
    }
}
