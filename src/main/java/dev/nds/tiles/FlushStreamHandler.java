package dev.nds.tiles;

import java.io.PrintStream;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.StreamHandler;

import org.jetbrains.annotations.NotNull;

/**
 * StreamHandler that flushes after each log message, so log output and regular output of the shell stay in order
 */
public class FlushStreamHandler extends StreamHandler {

    /**
     * Create a new handler
     * 
     * @param out where we want to print to
     * @param fmt how to format
     * @param level the minimum level this handler publishes
     */
    public FlushStreamHandler(@NotNull PrintStream out, @NotNull Formatter fmt, @NotNull Level level) {
        super(out, fmt);
        setLevel(level);
    }

    @Override
    public synchronized void publish(final LogRecord record) {
        super.publish(record);
        flush();
    }
}
