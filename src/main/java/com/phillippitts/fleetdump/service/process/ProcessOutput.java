package com.phillippitts.fleetdump.service.process;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;

/**
 * Drains a process output stream on a daemon thread and keeps a bounded window of the most recent
 * lines.
 *
 * <p>The stream is always read to the end, even once the window is full, so a chatty process can
 * never block on a full pipe. The oldest lines are dropped first.
 */
public final class ProcessOutput {

    private static final Logger LOG = LogManager.getLogger(ProcessOutput.class);

    private final String name;
    private final int maxChars;
    private final Deque<String> lines = new ArrayDeque<>();
    private int retainedChars;
    private boolean truncated;
    private Thread reader;

    private ProcessOutput(String name, int maxChars) {
        this.name = name;
        this.maxChars = maxChars;
    }

    /**
     * Starts draining the given stream.
     *
     * @param inputStream process output
     * @param name thread name, also used in log messages
     * @param maxChars size of the retained window
     * @param lineListener receives every line as it is read (may be null)
     */
    public static ProcessOutput collect(InputStream inputStream, String name, int maxChars,
                                        Consumer<String> lineListener) {
        ProcessOutput output = new ProcessOutput(name, maxChars);
        Thread thread = new Thread(() -> output.drain(inputStream, lineListener), name);
        thread.setDaemon(true);
        output.reader = thread;
        thread.start();
        return output;
    }

    private void drain(InputStream inputStream, Consumer<String> lineListener) {
        try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = br.readLine()) != null) {
                append(line);
                if (lineListener != null) {
                    lineListener.accept(line);
                }
            }
        } catch (IOException e) {
            LOG.debug("Output reader '{}' stopped: {}", name, e.toString());
        }
    }

    private synchronized void append(String line) {
        lines.addLast(line);
        retainedChars += line.length() + 1;
        while (retainedChars > maxChars && lines.size() > 1) {
            retainedChars -= lines.removeFirst().length() + 1;
            if (!truncated) {
                LOG.debug("Output '{}' exceeded {} chars; keeping most recent lines only", name, maxChars);
                truncated = true;
            }
        }
    }

    /**
     * Returns the retained output, oldest line first.
     */
    public synchronized String text() {
        return String.join("\n", lines);
    }

    public synchronized boolean isTruncated() {
        return truncated;
    }

    /**
     * Waits for the reader to reach end of stream, bounded by the timeout.
     */
    public void await(Duration timeout) {
        Thread thread = reader;
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
