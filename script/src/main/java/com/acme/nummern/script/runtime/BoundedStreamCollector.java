package com.acme.nummern.script.runtime;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Drains one process stream on its own daemon thread. Keeps at most
 * {@code maxBytes}; the rest is read and dropped so the child never blocks on
 * a full pipe.
 */
final class BoundedStreamCollector implements Runnable {
    private static final Logger LOG = Logger.getLogger(BoundedStreamCollector.class.getName());
    private static final int CHUNK = 8192;

    private final InputStream in;
    private final int maxBytes;
    private final ByteArrayOutputStream kept;
    private final AtomicLong dropped = new AtomicLong();
    private final Thread thread;

    BoundedStreamCollector(InputStream in, int maxBytes, String threadName) {
        this.in = Objects.requireNonNull(in, "in");
        this.maxBytes = Math.max(0, maxBytes);
        this.kept = new ByteArrayOutputStream(Math.min(this.maxBytes, CHUNK));
        this.thread = new Thread(this, threadName);
        this.thread.setDaemon(true);
    }

    void start() {
        thread.start();
    }

    /** Waits up to {@code millis} for the stream to reach end-of-file. */
    boolean join(long millis) throws InterruptedException {
        thread.join(millis);
        return !thread.isAlive();
    }

    @Override
    public void run() {
        byte[] buf = new byte[CHUNK];
        try (InputStream stream = in) {
            int n;
            while ((n = stream.read(buf)) >= 0) {
                synchronized (kept) {
                    int room = maxBytes - kept.size();
                    int take = Math.max(0, Math.min(room, n));
                    kept.write(buf, 0, take);
                    if (take < n) {
                        dropped.addAndGet(n - take);
                    }
                }
            }
        } catch (IOException e) {
            // the process was killed or closed its end early
            LOG.fine(() -> "Stream reader " + thread.getName() + " stopped: " + e.getMessage());
        }
    }

    /** Kept output. When bytes were dropped, a UTF-8 sequence cut at the budget is left out. */
    String text() {
        byte[] bytes;
        synchronized (kept) {
            bytes = kept.toByteArray();
        }
        int end = dropped.get() > 0 ? completeUtf8Length(bytes) : bytes.length;
        return new String(bytes, 0, end, StandardCharsets.UTF_8);
    }

    /** Length of {@code bytes} without a trailing incomplete UTF-8 sequence. */
    static int completeUtf8Length(byte[] bytes) {
        int n = bytes.length;
        for (int back = 1; back <= 3 && back <= n; back++) {
            int b = bytes[n - back] & 0xFF;
            if ((b & 0xC0) == 0x80) {
                continue;
            }
            int expected = b >= 0xF0 ? 4 : b >= 0xE0 ? 3 : b >= 0xC0 ? 2 : 1;
            return expected > back ? n - back : n;
        }
        return n;
    }

    long droppedBytes() {
        return dropped.get();
    }
}
