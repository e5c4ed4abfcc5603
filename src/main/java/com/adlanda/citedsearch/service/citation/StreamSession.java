package com.adlanda.citedsearch.service.citation;

/**
 * Accumulates the text of one streamed answer.
 *
 * One session per question/answer exchange. Deltas are appended by a single writer in arrival
 * order; readers may look at the partial text at any time. Once the session is done (completed
 * or failed) the text is frozen.
 */
public class StreamSession {

    private final StringBuilder buffer = new StringBuilder();
    private boolean done;
    private Throwable error;

    /**
     * @throws IllegalStateException if the session is already done
     */
    public synchronized void append(String delta) {
        if (done) {
            throw new IllegalStateException("Cannot append to a finished stream session");
        }
        if (delta != null) {
            buffer.append(delta);
        }
    }

    public synchronized String current() {
        return buffer.toString();
    }

    public synchronized boolean isDone() {
        return done;
    }

    /**
     * Marks the stream as finished. No-op if the session is already done.
     */
    public synchronized void complete() {
        done = true;
    }

    /**
     * Marks the stream as failed, keeping the partial text. The first terminal signal wins.
     */
    public synchronized void fail(Throwable cause) {
        if (done) {
            return;
        }
        done = true;
        error = cause;
    }

    /**
     * @return The failure cause, or null if the stream is running or completed normally
     */
    public synchronized Throwable error() {
        return error;
    }
}
