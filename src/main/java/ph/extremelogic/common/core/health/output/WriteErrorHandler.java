package ph.extremelogic.common.core.health.output;

/**
 * Receives failures from a {@link ByteSink} that the writing sink absorbed.
 */
@FunctionalInterface
public interface WriteErrorHandler {

    // Goes to stderr rather than back through a sink to avoid recursion
    WriteErrorHandler STDERR = (line, cause) ->
            System.err.println("WriterSink failed to write: " + cause.getMessage());

    WriteErrorHandler IGNORE = (line, cause) -> { };

    void onWriteError(byte[] line, Exception cause);
}
