package ph.extremelogic.common.core.health;

import ph.extremelogic.common.core.health.api.CompletionStatus;

import java.util.Map;

/**
 * Destination for job events. A dispatcher may hold several sinks and forward
 * every event to each of them.
 *
 * <p>The {@code kvs} argument is optional metadata and may be {@code null}.
 */
public interface EventSink {
    void emitEvent(String job, String event, Map<String, String> kvs);

    void emitEventErr(String job, String event, Throwable err, Map<String, String> kvs);

    void emitTiming(String job, String event, long nanos, Map<String, String> kvs);

    void emitComplete(String job, CompletionStatus status, long nanos, Map<String, String> kvs);
}
