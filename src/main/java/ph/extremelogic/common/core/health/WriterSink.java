package ph.extremelogic.common.core.health;

import ph.extremelogic.common.core.health.api.CompletionStatus;
import ph.extremelogic.common.core.health.api.LogLevel;
import ph.extremelogic.common.core.health.layout.LineLayout;
import ph.extremelogic.common.core.health.output.ByteSink;
import ph.extremelogic.common.core.health.output.WriteErrorHandler;

import java.io.IOException;
import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Writes events as human-readable lines to a {@link ByteSink}.
 *
 * <p>To stdout:
 * <pre>
 * EventSink sink = new WriterSink(OutputStreamByteSink.stdout(), LogLevel.INFO);
 * </pre>
 * To a file:
 * <pre>
 * EventSink sink = new WriterSink(
 *         new OutputStreamByteSink(new FileOutputStream("jobs.log", true)), LogLevel.INFO);
 * </pre>
 *
 * <p>An event carrying a {@code "level"} entry in its metadata is written only
 * when that level is at or above this sink's level. Events without one, or with
 * text that is not a level, are always written.
 *
 * <p>Each line goes to the byte sink in a single {@code write} call. Write
 * failures never reach the caller; they are handed to the
 * {@link WriteErrorHandler}. Instances hold no mutable state and are safe to
 * share between threads when the byte sink is.
 */
public final class WriterSink implements EventSink {
    public static final String LEVEL_KEY = "level";

    private final ByteSink byteSink;
    private final LogLevel level;
    private final LineLayout layout;
    private final Clock clock;
    private final WriteErrorHandler errorHandler;

    public WriterSink(ByteSink byteSink, LogLevel level) {
        this(byteSink, level, Clock.systemUTC(), WriteErrorHandler.STDERR);
    }

    public WriterSink(ByteSink byteSink, LogLevel level, Clock clock, WriteErrorHandler errorHandler) {
        this.byteSink = Objects.requireNonNull(byteSink, "byteSink");
        this.level = Objects.requireNonNull(level, "level");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.errorHandler = Objects.requireNonNull(errorHandler, "errorHandler");
        this.layout = new LineLayout();
    }

    public static Builder builder(ByteSink byteSink) {
        return new Builder(byteSink);
    }

    @Override
    public void emitEvent(String job, String event, Map<String, String> kvs) {
        if (!shouldLogEvent(kvs)) return;
        write(SinkEvent.event(clock.instant(), job, event, kvs));
    }

    @Override
    public void emitEventErr(String job, String event, Throwable err, Map<String, String> kvs) {
        Objects.requireNonNull(err, "err");
        if (!shouldLogEvent(kvs)) return;
        write(SinkEvent.eventErr(clock.instant(), job, event, err, kvs));
    }

    @Override
    public void emitTiming(String job, String event, long nanos, Map<String, String> kvs) {
        if (!shouldLogEvent(kvs)) return;
        write(SinkEvent.timing(clock.instant(), job, event, nanos, kvs));
    }

    @Override
    public void emitComplete(String job, CompletionStatus status, long nanos, Map<String, String> kvs) {
        Objects.requireNonNull(status, "status");
        if (!shouldLogEvent(kvs)) return;
        write(SinkEvent.complete(clock.instant(), job, status, nanos, kvs));
    }

    /**
     * Decides whether an event with the given metadata is written. Only an
     * explicit, recognizable {@code "level"} below this sink's level suppresses it.
     */
    public boolean shouldLogEvent(Map<String, String> kvs) {
        if (kvs == null) return true;

        String levelText = kvs.get(LEVEL_KEY);
        if (levelText == null) return true;

        Optional<LogLevel> eventLevel = LogLevel.parse(levelText);
        // Unknown levels are written rather than silently lost
        return eventLevel.map(l -> l.isMoreSpecificThan(level)).orElse(true);
    }

    private void write(SinkEvent event) {
        byte[] line = layout.toBytes(event);
        try {
            byteSink.write(line);
        } catch (IOException | RuntimeException e) {
            errorHandler.onWriteError(line, e);
        }
    }

    public LogLevel getLevel() {
        return level;
    }

    public ByteSink getByteSink() {
        return byteSink;
    }

    public static class Builder {
        private final ByteSink byteSink;
        private LogLevel level = LogLevel.TRACE;
        private Clock clock = Clock.systemUTC();
        private WriteErrorHandler errorHandler = WriteErrorHandler.STDERR;

        public Builder(ByteSink byteSink) {
            this.byteSink = byteSink;
        }

        public Builder level(LogLevel level) {
            this.level = level;
            return this;
        }

        public Builder level(String levelText) {
            this.level = LogLevel.fromText(levelText);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder errorHandler(WriteErrorHandler errorHandler) {
            this.errorHandler = errorHandler;
            return this;
        }

        public WriterSink build() {
            return new WriterSink(byteSink, level, clock, errorHandler);
        }
    }
}
