package dev.nds.tiles;

/**
 * Thrown when a numeric value lies outside the domain it is used in, for example degrees outside [-180, 180] or a
 * tile number that doesn't exist on its level.
 */
public class OutOfRangeException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * Create a new exception
     * 
     * @param message description of the value and the allowed range
     */
    public OutOfRangeException(String message) {
        super(message);
    }
}
