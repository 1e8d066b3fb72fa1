package com.edgechat.chat;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import com.edgechat.inference.ResultListener;

/**
 * Collects a streamed answer and lets a caller wait for its terminal callback.
 */
public class StreamingResponseCollector implements ResultListener {
    private final Consumer<String> chunkSink;
    private final CountDownLatch done = new CountDownLatch(1);
    private final StringBuilder text = new StringBuilder();
    private final long startNanos = System.nanoTime();
    private long firstChunkNanos = -1;
    private long finishedNanos = -1;
    private int chunkCount;
    private String terminalMessage = "";

    public StreamingResponseCollector() {
        this(chunk -> {
        });
    }

    public StreamingResponseCollector(Consumer<String> chunkSink) {
        this.chunkSink = chunkSink;
    }

    @Override
    public void onResult(String partialResult, boolean isDone) {
        synchronized (this) {
            if (done.getCount() == 0) {
                return;
            }
            String chunk = partialResult == null ? "" : partialResult;
            if (!isDone && !chunk.isEmpty()) {
                if (firstChunkNanos < 0) {
                    firstChunkNanos = System.nanoTime();
                }
                chunkCount++;
            }
            text.append(chunk);
            if (isDone) {
                terminalMessage = chunk;
                finishedNanos = System.nanoTime();
            }
            if (!chunk.isEmpty()) {
                chunkSink.accept(chunk);
            }
        }
        if (isDone) {
            done.countDown();
        }
    }

    /**
     * @return true if the terminal callback arrived within the timeout
     */
    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        return done.await(timeout, unit);
    }

    public boolean isDone() {
        return done.getCount() == 0;
    }

    public synchronized String text() {
        return text.toString();
    }

    /**
     * Text of the terminal invocation; empty for a normal completion.
     */
    public synchronized String terminalMessage() {
        return terminalMessage;
    }

    public synchronized boolean isError() {
        return terminalMessage.startsWith("Error");
    }

    /**
     * Number of generated chunks; the terminal message is not counted.
     */
    public synchronized int chunkCount() {
        return chunkCount;
    }

    public synchronized long firstChunkLatencyMs() {
        return firstChunkNanos < 0 ? -1 : (firstChunkNanos - startNanos) / 1_000_000;
    }

    public synchronized double chunksPerSecond() {
        long end = finishedNanos < 0 ? System.nanoTime() : finishedNanos;
        return chunkCount * 1_000_000_000d / Math.max(1L, end - startNanos);
    }
}
