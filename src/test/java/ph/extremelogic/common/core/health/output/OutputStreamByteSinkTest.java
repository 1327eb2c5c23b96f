package ph.extremelogic.common.core.health.output;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import ph.extremelogic.common.core.health.WriterSink;
import ph.extremelogic.common.core.health.api.CompletionStatus;
import ph.extremelogic.common.core.health.api.LogLevel;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class OutputStreamByteSinkTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should write then flush each line")
    void testWriteAndFlush() throws IOException {
        OutputStream out = mock(OutputStream.class);
        byte[] line = "line\n".getBytes(StandardCharsets.UTF_8);

        new OutputStreamByteSink(out).write(line);

        InOrder order = inOrder(out);
        order.verify(out).write(line);
        order.verify(out).flush();
        verify(out, never()).close();
    }

    @Test
    @DisplayName("Should propagate stream failures to the caller")
    void testFailurePropagates() throws IOException {
        OutputStream out = mock(OutputStream.class);
        doThrow(new IOException("closed")).when(out).write(any(byte[].class));

        OutputStreamByteSink sink = new OutputStreamByteSink(out);

        IOException exception = assertThrows(IOException.class, () -> sink.write(new byte[]{1}));
        assertEquals("closed", exception.getMessage());
    }

    @Test
    @DisplayName("Should append lines to a file")
    void testAppendToFile() throws IOException {
        Path logFile = tempDir.resolve("jobs.log");
        Files.writeString(logFile, "existing\n");

        try (OutputStream out = Files.newOutputStream(logFile,
                StandardOpenOption.APPEND)) {
            WriterSink sink = new WriterSink(new OutputStreamByteSink(out), LogLevel.INFO);
            sink.emitComplete("import", CompletionStatus.SUCCESS, 500, null);
            sink.emitTiming("import", "parse", 5_000_000, null);
        }

        List<String> lines = Files.readAllLines(logFile, StandardCharsets.UTF_8);
        assertEquals(3, lines.size());
        assertEquals("existing", lines.get(0));
        assertTrue(lines.get(1).endsWith("]: job:import status:success time:500 ns"), lines.get(1));
        assertTrue(lines.get(2).endsWith("]: job:import event:parse time:5 ms"), lines.get(2));
    }

    @Test
    void testStandardStreams() {
        assertSame(System.out, OutputStreamByteSink.stdout().getOutputStream());
        assertSame(System.err, OutputStreamByteSink.stderr().getOutputStream());
        assertThrows(NullPointerException.class, () -> new OutputStreamByteSink(null));
    }

    @Test
    @DisplayName("Should leave the stream usable after writes")
    void testDoesNotClose() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        OutputStreamByteSink sink = new OutputStreamByteSink(out);

        sink.write("a\n".getBytes(StandardCharsets.UTF_8));
        sink.write("b\n".getBytes(StandardCharsets.UTF_8));

        assertEquals("a\nb\n", out.toString(StandardCharsets.UTF_8));
    }
}
