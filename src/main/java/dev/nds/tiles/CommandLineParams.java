package dev.nds.tiles;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * a set of command line parameters. Immutable after construction.
 */
final class CommandLineParams {

    private static final String OPT_LOG_LEVEL       = "l";
    private static final String LONG_OPT_LOG_LEVEL  = "log-level";
    private static final String OPT_LEVEL           = "z";
    private static final String LONG_OPT_LEVEL      = "level";
    private static final String OPT_NUMBER          = "n";
    private static final String LONG_OPT_NUMBER     = "number";
    private static final String OPT_COORDINATE      = "c";
    private static final String LONG_OPT_COORDINATE = "coordinate";
    private static final String OPT_HELP            = "h";
    private static final String LONG_OPT_HELP       = "help";

    static final String COMMAND_NAME = "ndstiles";

    /** packed ids of the tiles to show */
    final @NotNull List<Integer> packedIds;

    /** tile level for a tile given by number or coordinate */
    final @Nullable Integer level;

    /** tile number, requires level */
    final @Nullable Integer tileNumber;

    /** WGS84 coordinate whose tile should be shown, requires level */
    final @Nullable Wgs84Coordinate coordinate;

    /** the log level */
    final @NotNull Level logLevel;

    /** only print the help */
    final boolean help;

    /**
     * constructs a set of parameters from the program arguments.
     * 
     * @param args arguments as passed to a main method
     * @param logger the logger to use for warnings in case of invalid arguments
     * 
     * @throws IllegalArgumentException if the parameters do not allow a run
     */
    CommandLineParams(@NotNull String[] args, @NotNull Logger logger) throws IllegalArgumentException {

        /* define the available arguments */

        Option helpOption = Option.builder(OPT_HELP).longOpt(LONG_OPT_HELP).desc("this help").build();
        Option logLevelOption = Option.builder(OPT_LOG_LEVEL).longOpt(LONG_OPT_LOG_LEVEL).hasArg()
                .desc("set the logging level (debug, info, warning, error, critical), default is info").build();
        Option levelOption = Option.builder(OPT_LEVEL).longOpt(LONG_OPT_LEVEL).hasArg()
                .desc("tile level between 0 and " + Const.MAX_LEVEL + " (inclusive), required for --number and --coordinate").build();
        Option numberOption = Option.builder(OPT_NUMBER).longOpt(LONG_OPT_NUMBER).hasArg().desc("show the tile with this number on the given level").build();
        Option coordinateOption = Option.builder(OPT_COORDINATE).longOpt(LONG_OPT_COORDINATE).hasArg()
                .desc("lon,lat in WGS84 degrees, show the tile of the given level containing it").build();

        Options options = new Options();

        options.addOption(helpOption);
        options.addOption(logLevelOption);
        options.addOption(levelOption);
        options.addOption(numberOption);
        options.addOption(coordinateOption);

        /* parse the command line arguments */

        CommandLineParser parser = new DefaultParser();

        try {
            CommandLine line = parser.parse(options, args);
            help = line.hasOption(OPT_HELP);
            if (help) {
                new HelpFormatter().printHelp(COMMAND_NAME + " [options] [packed ids]", options);
            }

            if (line.hasOption(OPT_LOG_LEVEL)) {
                logLevel = parseLevel(line.getOptionValue(LONG_OPT_LOG_LEVEL));
            } else {
                logLevel = Level.INFO;
            }

            if (line.hasOption(OPT_LEVEL)) {
                level = Integer.valueOf(line.getOptionValue(LONG_OPT_LEVEL));
            } else {
                level = null;
            }

            if (line.hasOption(OPT_NUMBER)) {
                tileNumber = Integer.valueOf(line.getOptionValue(LONG_OPT_NUMBER));
            } else {
                tileNumber = null;
            }

            if (line.hasOption(OPT_COORDINATE)) {
                String[] vals = line.getOptionValue(LONG_OPT_COORDINATE).split(",");
                if (vals.length != 2) {
                    throw new ParseException("coordinate needs to be given as lon,lat");
                }
                coordinate = new Wgs84Coordinate(Double.parseDouble(vals[0].trim()), Double.parseDouble(vals[1].trim()));
            } else {
                coordinate = null;
            }

            if ((tileNumber != null || coordinate != null) && level == null) {
                throw new ParseException("--" + LONG_OPT_NUMBER + " and --" + LONG_OPT_COORDINATE + " require --" + LONG_OPT_LEVEL);
            }
            if (tileNumber != null && coordinate != null) {
                throw new ParseException("only one of --" + LONG_OPT_NUMBER + " and --" + LONG_OPT_COORDINATE + " can be used");
            }

            List<Integer> ids = new ArrayList<>();
            for (String arg : line.getArgList()) {
                ids.add(Integer.valueOf(arg));
            }
            packedIds = Collections.unmodifiableList(ids);

        } catch (ParseException | IllegalArgumentException exp) {
            logger.log(Level.WARNING, exp.getMessage());
            new HelpFormatter().printHelp(COMMAND_NAME + " [options] [packed ids]", options);
            throw new IllegalArgumentException(exp);
        }
    }

    /**
     * @return true if a tile was selected on the command line
     */
    boolean hasTileSelection() {
        return !packedIds.isEmpty() || level != null;
    }

    /**
     * Map a level name to a JUL level, the usual names of other logging frameworks are accepted too
     * 
     * @param name the name
     * @return the Level
     * @throws IllegalArgumentException if the name is not known
     */
    @NotNull
    static Level parseLevel(@NotNull String name) {
        switch (name.toLowerCase(Locale.ROOT)) {
        case "debug":
            return Level.FINE;
        case "info":
            return Level.INFO;
        case "warning":
        case "warn":
            return Level.WARNING;
        case "error":
        case "critical":
            return Level.SEVERE;
        default:
            return Level.parse(name.toUpperCase(Locale.ROOT));
        }
    }
}
