package io.helmttl.services;

import org.slf4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Output stream sending each line written to an SLF4J logger at INFO, with an optional prefix.
 * Used as the container log sink when no other output is wired.
 */
public class LoggingOutputStream extends OutputStream {
    private final Logger logger;
    private final String prefix;
    private final ByteArrayOutputStream baos = new ByteArrayOutputStream();

    public LoggingOutputStream(Logger logger, String prefix) {
        this.logger = logger;
        this.prefix = prefix;
    }

    @Override
    public synchronized void write(int b) {
        if (b == '\n') {
            this.send();
        } else {
            baos.write(b);
        }
    }

    @Override
    public synchronized void write(byte[] b, int off, int len) {
        for (int i = 0; i < len; i++) {
            write(b[off + i]);
        }
    }

    private synchronized void send() {
        if (baos.size() == 0) {
            return;
        }

        String line = baos.toString(StandardCharsets.UTF_8).stripTrailing();
        baos.reset();

        if (line.isEmpty()) {
            return;
        }

        if (prefix == null) {
            logger.info("{}", line);
        } else {
            logger.info("{} {}", prefix, line);
        }
    }

    @Override
    public void flush() {
        this.send();
    }

    @Override
    public void close() {
        this.send();
    }
}
