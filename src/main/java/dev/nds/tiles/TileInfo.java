package dev.nds.tiles;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

import org.jetbrains.annotations.NotNull;

/**
 * Command line tool that shows information about NDS tiles: id, level, number, grid position, center and bounding
 * box.
 * 
 * Negative packed ids (level 15) have to be given after "--".
 */
public final class TileInfo {

    private static final Logger LOGGER = Logger.getLogger(TileInfo.class.getName());

    /** shown when nothing was selected on the command line, level 2 in the southern hemisphere */
    static final int DEFAULT_PACKED_ID = 262154;

    private final PrintStream out;

    /**
     * Create a new instance
     * 
     * @param out where the tile information is printed to
     */
    TileInfo(@NotNull PrintStream out) {
        this.out = out;
    }

    /**
     * Main class (what else?)
     * 
     * @param args command line arguments
     */
    public static void main(String[] args) {
        LogManager.getLogManager().reset();
        Logger packageLogger = Logger.getLogger(TileInfo.class.getPackage().getName());
        setupLogging(packageLogger, Level.INFO);

        CommandLineParams params;
        try {
            params = new CommandLineParams(args, LOGGER);
        } catch (IllegalArgumentException e) {
            System.exit(1);
            return;
        }
        if (params.help) {
            return;
        }
        setupLogging(packageLogger, params.logLevel);

        int failed = new TileInfo(System.out).run(params);
        if (failed > 0) {
            System.exit(1);
        }
    }

    /**
     * Show all tiles selected by the parameters
     * 
     * @param params the parsed command line
     * @return the number of tiles that could not be shown
     */
    int run(@NotNull CommandLineParams params) {
        List<Integer> packedIds = new ArrayList<>(params.packedIds);
        if (!params.hasTileSelection()) {
            out.println("No packed IDs specified, using default values.");
            out.println();
            packedIds.add(DEFAULT_PACKED_ID);
        }
        int failed = 0;
        if (params.level != null) {
            try {
                if (params.tileNumber != null) {
                    describe(NdsTile.of(params.level, params.tileNumber));
                } else if (params.coordinate != null) {
                    describe(NdsTile.of(params.level, params.coordinate));
                } else {
                    LOGGER.log(Level.WARNING, "Level {0} given without --number or --coordinate, ignored", params.level);
                }
            } catch (IllegalArgumentException e) {
                LOGGER.log(Level.WARNING, e.getMessage());
                failed++;
            }
        }
        for (int id : packedIds) {
            try {
                describe(NdsTile.fromPackedId(id));
            } catch (IllegalArgumentException e) {
                LOGGER.log(Level.WARNING, e.getMessage());
                failed++;
            }
        }
        return failed;
    }

    /**
     * Print the information for one tile
     * 
     * @param tile the tile
     */
    void describe(@NotNull NdsTile tile) {
        NdsCoordinate center = tile.getCenter();
        out.println("Tile ID: " + tile.getPackedId() + ", Level: " + tile.getLevel() + ", Tile Number: " + tile.getTileNumber());
        out.println("Tile Grid Coordinates: " + tile.getGridCoordinates());
        out.println("Center in NDSCoordinates: " + center.getLongitude() + ", " + center.getLatitude());
        out.println("Center: " + center.toGeoJson());
        out.println("Bounding Box: " + tile.toGeoJson());
        out.println();
    }

    /**
     * Set up logging, replaces any handlers the logger already has
     * 
     * @param logger the Logger to use
     * @param level messages below this level are dropped
     */
    public static void setupLogging(@NotNull Logger logger, @NotNull Level level) {
        for (Handler h : logger.getHandlers()) {
            logger.removeHandler(h);
        }
        logger.setLevel(level);
        SimpleFormatter fmt = new SimpleFormatter();
        logger.addHandler(new FlushStreamHandler(System.out, fmt, level)); // NOSONAR
        logger.addHandler(new FlushStreamHandler(System.err, fmt, Level.WARNING)); // NOSONAR
    }
}
