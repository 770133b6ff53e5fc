package dev.nds.tiles;

/**
 * Thrown when a packed tile id doesn't carry a level marker bit.
 */
public class MalformedTileIdException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * Create a new exception
     * 
     * @param packedId the offending id
     */
    public MalformedTileIdException(int packedId) {
        super("Invalid packed Tile ID " + packedId + ": No Level bit present.");
    }
}
