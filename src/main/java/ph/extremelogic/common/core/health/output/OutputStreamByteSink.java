package ph.extremelogic.common.core.health.output;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * Writes each line to an {@link OutputStream} and flushes it. Writes are
 * serialized on the stream, so concurrent lines are never interleaved.
 *
 * <p>The stream is not closed by this class.
 */
public final class OutputStreamByteSink implements ByteSink {
    private final OutputStream out;

    public OutputStreamByteSink(OutputStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    public static OutputStreamByteSink stdout() {
        return new OutputStreamByteSink(System.out);
    }

    public static OutputStreamByteSink stderr() {
        return new OutputStreamByteSink(System.err);
    }

    @Override
    public void write(byte[] bytes) throws IOException {
        synchronized (out) {
            out.write(bytes);
            out.flush();
        }
    }

    public OutputStream getOutputStream() {
        return out;
    }
}
