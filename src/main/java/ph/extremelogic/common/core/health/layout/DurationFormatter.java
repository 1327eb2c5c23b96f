package ph.extremelogic.common.core.health.layout;

/**
 * Renders elapsed nanoseconds in ms above 2ms, in μs above 2μs, and in ns
 * otherwise. Values are truncated, never rounded.
 */
public final class DurationFormatter {
    private static final long MILLIS_THRESHOLD = 2_000_000L;
    private static final long MICROS_THRESHOLD = 2_000L;

    private DurationFormatter() {
    }

    public static String format(long nanos) {
        StringBuilder sb = new StringBuilder(16);
        appendTo(sb, nanos);
        return sb.toString();
    }

    public static void appendTo(StringBuilder sb, long nanos) {
        if (nanos > MILLIS_THRESHOLD) {
            sb.append(nanos / 1_000_000L).append(" ms");
        } else if (nanos > MICROS_THRESHOLD) {
            sb.append(nanos / 1_000L).append(" μs");
        } else {
            sb.append(nanos).append(" ns");
        }
    }
}
