package io.helmttl.cli;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Byte sink writing to the command output. Bytes are decoded as UTF-8 on each flush.
 */
class PrintWriterOutputStream extends OutputStream {
    private final PrintWriter writer;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    PrintWriterOutputStream(PrintWriter writer) {
        this.writer = writer;
    }

    @Override
    public synchronized void write(int b) {
        buffer.write(b);
    }

    @Override
    public synchronized void write(byte[] b, int off, int len) {
        buffer.write(b, off, len);
    }

    @Override
    public synchronized void flush() {
        if (buffer.size() > 0) {
            writer.print(buffer.toString(StandardCharsets.UTF_8));
            buffer.reset();
        }
        writer.flush();
    }

    @Override
    public void close() {
        this.flush();
    }
}
