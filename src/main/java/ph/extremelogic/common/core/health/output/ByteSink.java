package ph.extremelogic.common.core.health.output;

import java.io.IOException;

/**
 * Anything that accepts a whole rendered line at once.
 */
@FunctionalInterface
public interface ByteSink {
    void write(byte[] bytes) throws IOException;
}
