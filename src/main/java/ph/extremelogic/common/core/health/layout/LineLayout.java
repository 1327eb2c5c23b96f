package ph.extremelogic.common.core.health.layout;

import ph.extremelogic.common.core.health.SinkEvent;

import java.nio.charset.StandardCharsets;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One-line text layout meant for people reading a log file:
 *
 * <pre>
 * [2024-03-01T12:34:56.123456789Z]: job:import event:row_parsed err:bad row time:34 ms kvs:[a:1 b:2]
 * [2024-03-01T12:34:56.123456789Z]: job:import status:success time:34 ms kvs:[a:1 b:2]
 * </pre>
 *
 * The {@code kvs} segment is written whenever the metadata map is non-null, so an
 * empty map still shows as {@code kvs:[]}. Keys are sorted so the same map always
 * renders the same way. Nothing is escaped.
 */
public final class LineLayout implements Layout<String> {
    // ISO_INSTANT prints UTC with a Z designator and up to nine fraction digits
    private static final DateTimeFormatter TIMESTAMP_FORMATTER = DateTimeFormatter.ISO_INSTANT;

    private static final ThreadLocal<StringBuilder> BUFFER_POOL =
            ThreadLocal.withInitial(() -> new StringBuilder(256));

    private static final String JOB_PREFIX = "]: job:";
    private static final String EVENT_PREFIX = " event:";
    private static final String ERR_PREFIX = " err:";
    private static final String STATUS_PREFIX = " status:";
    private static final String TIME_PREFIX = " time:";
    private static final String KVS_PREFIX = " kvs:[";

    @Override
    public String toSerializable(SinkEvent event) {
        StringBuilder sb = BUFFER_POOL.get();
        sb.setLength(0);

        sb.append('[');
        TIMESTAMP_FORMATTER.formatTo(event.getTimestamp(), sb);
        sb.append(JOB_PREFIX).append(event.getJob());

        switch (event.getKind()) {
            case EVENT:
                sb.append(EVENT_PREFIX).append(event.getEvent());
                break;
            case EVENT_ERR:
                sb.append(EVENT_PREFIX).append(event.getEvent())
                        .append(ERR_PREFIX).append(event.getErrorText());
                break;
            case TIMING:
                sb.append(EVENT_PREFIX).append(event.getEvent()).append(TIME_PREFIX);
                DurationFormatter.appendTo(sb, event.getNanos());
                break;
            case COMPLETE:
                sb.append(STATUS_PREFIX).append(event.getStatus().getText()).append(TIME_PREFIX);
                DurationFormatter.appendTo(sb, event.getNanos());
                break;
            default:
                throw new IllegalStateException("Unknown event kind: " + event.getKind());
        }

        Map<String, String> kvs = event.getKvs();
        if (kvs != null) {
            appendKvs(sb, kvs);
        }

        sb.append('\n');
        return sb.toString();
    }

    public byte[] toBytes(SinkEvent event) {
        return toSerializable(event).getBytes(StandardCharsets.UTF_8);
    }

    private static void appendKvs(StringBuilder sb, Map<String, String> kvs) {
        List<String> keys = new ArrayList<>(kvs.keySet());
        Collections.sort(keys);

        sb.append(KVS_PREFIX);
        boolean first = true;
        for (String key : keys) {
            if (!first) sb.append(' ');
            sb.append(key).append(':').append(kvs.get(key));
            first = false;
        }
        sb.append(']');
    }

    @Override
    public String getContentType() { return "text/plain; charset=UTF-8"; }
}
