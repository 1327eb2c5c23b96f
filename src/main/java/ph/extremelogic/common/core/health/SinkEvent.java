package ph.extremelogic.common.core.health;

import ph.extremelogic.common.core.health.api.CompletionStatus;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A single emission, captured at the moment it passed the level filter.
 */
public final class SinkEvent {

    public enum Kind {
        EVENT,
        EVENT_ERR,
        TIMING,
        COMPLETE
    }

    private final Kind kind;
    private final Instant timestamp;
    private final String job;
    private final String event;
    private final String errorText;
    private final long nanos;
    private final CompletionStatus status;
    private final Map<String, String> kvs;

    private SinkEvent(Kind kind, Instant timestamp, String job, String event, String errorText,
                      long nanos, CompletionStatus status, Map<String, String> kvs) {
        this.kind = kind;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.job = job;
        this.event = event;
        this.errorText = errorText;
        this.nanos = nanos;
        this.status = status;
        this.kvs = kvs;
    }

    public static SinkEvent event(Instant timestamp, String job, String event, Map<String, String> kvs) {
        return new SinkEvent(Kind.EVENT, timestamp, job, event, null, 0L, null, kvs);
    }

    public static SinkEvent eventErr(Instant timestamp, String job, String event, Throwable err,
                                     Map<String, String> kvs) {
        Objects.requireNonNull(err, "err");
        return new SinkEvent(Kind.EVENT_ERR, timestamp, job, event, errorText(err), 0L, null, kvs);
    }

    public static SinkEvent timing(Instant timestamp, String job, String event, long nanos,
                                   Map<String, String> kvs) {
        return new SinkEvent(Kind.TIMING, timestamp, job, event, null, nanos, null, kvs);
    }

    public static SinkEvent complete(Instant timestamp, String job, CompletionStatus status, long nanos,
                                     Map<String, String> kvs) {
        Objects.requireNonNull(status, "status");
        return new SinkEvent(Kind.COMPLETE, timestamp, job, null, null, nanos, status, kvs);
    }

    // Throwables without a message are shown by class name rather than as an empty err segment
    private static String errorText(Throwable err) {
        String message = err.getMessage();
        return message != null ? message : err.getClass().getName();
    }

    public Kind getKind() { return kind; }
    public Instant getTimestamp() { return timestamp; }
    public String getJob() { return job; }
    public String getEvent() { return event; }
    public String getErrorText() { return errorText; }
    public long getNanos() { return nanos; }
    public CompletionStatus getStatus() { return status; }
    public Map<String, String> getKvs() { return kvs; }
}
