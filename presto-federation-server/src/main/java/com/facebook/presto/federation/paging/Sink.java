/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.facebook.presto.federation.paging;

import com.facebook.airlift.log.Logger;
import com.facebook.presto.federation.protocol.Stats;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Bounded handoff of sealed pages from the split reader (producer) to the response sender (consumer).
 * <p>
 * The producer side ({@link #addRow}, {@link #finish}, {@link #fail}) runs on the split reader task only.
 * It blocks when {@code capacity} pages are waiting, which is the only backpressure between backend and network.
 * The consumer side ({@link #next}, {@link #poll}, {@link #close}) runs on the request task.
 * The terminal result is queued after every page, so it is observed only once all pages are drained.
 */
public class Sink
{
    private static final Logger log = Logger.get(Sink.class);
    private static final long PUT_RETRY_MILLIS = 100;

    private final ColumnarBufferFactory bufferFactory;
    private final TrafficTracker trafficTracker;
    private final ReadLimiter readLimiter;
    private final BlockingQueue<ReadResult> queue;

    private volatile boolean closed;

    // producer state
    private ColumnarBuffer buffer;
    private int pagesSent;
    private boolean finished;

    public Sink(ColumnarBufferFactory bufferFactory, TrafficTracker trafficTracker, ReadLimiter readLimiter, int capacity)
    {
        this.bufferFactory = requireNonNull(bufferFactory, "bufferFactory is null");
        this.trafficTracker = requireNonNull(trafficTracker, "trafficTracker is null");
        this.readLimiter = requireNonNull(readLimiter, "readLimiter is null");
        checkArgument(capacity >= 1, "capacity must be at least 1");
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Accounts the current row of the transformer and appends it to the page being built,
     * sealing and queueing the page first when the row would cross a paging threshold.
     */
    public void addRow(RowTransformer transformer)
    {
        checkState(!finished, "sink is finished");
        checkNotCanceled();

        readLimiter.addRow();
        if (!trafficTracker.tryAddRow(transformer.getAcceptors())) {
            flush();
            checkState(trafficTracker.tryAddRow(transformer.getAcceptors()), "row does not fit an empty page");
        }
        if (buffer == null) {
            buffer = bufferFactory.createBuffer();
        }
        buffer.addRow(transformer);
    }

    /**
     * Flushes the last partial page and signals successful completion.
     * A split without rows still yields one empty page carrying the schema.
     */
    public void finish()
    {
        checkState(!finished, "sink is finished");
        checkNotCanceled();
        if (buffer != null || pagesSent == 0) {
            flush();
        }
        finished = true;
        put(ReadResult.success());
    }

    /**
     * Signals a failed split read. Rows not yet sealed are discarded.
     */
    public void fail(Throwable error)
    {
        requireNonNull(error, "error is null");
        releaseBuffer();
        if (finished) {
            return;
        }
        finished = true;
        if (closed) {
            log.debug("Dropping failure of closed sink: %s", error.getMessage());
            return;
        }
        try {
            put(ReadResult.failure(error));
        }
        catch (CancellationException e) {
            log.debug("Sink closed while reporting failure: %s", error.getMessage());
        }
    }

    /**
     * Blocks until the next page or the terminal result is available.
     */
    public ReadResult next()
            throws InterruptedException
    {
        return queue.take();
    }

    /**
     * @return the next result, or null if none arrived within the timeout
     */
    public ReadResult poll(long timeout, TimeUnit unit)
            throws InterruptedException
    {
        return queue.poll(timeout, unit);
    }

    /**
     * Stops the exchange. Queued pages are discarded and the producer fails on its next row or page.
     * Closing more than once is a no-op.
     */
    public void close()
    {
        if (closed) {
            return;
        }
        closed = true;
        queue.clear();
    }

    public boolean isClosed()
    {
        return closed;
    }

    public Stats getTotalStats()
    {
        return trafficTracker.getTotalStats();
    }

    private void flush()
    {
        ColumnarBuffer page = buffer == null ? bufferFactory.createBuffer() : buffer;
        buffer = null;
        byte[] data;
        try {
            data = page.seal();
        }
        finally {
            page.close();
        }
        Stats stats = trafficTracker.flush();
        pagesSent++;
        log.debug("Sealed page %s with %s rows and %s bytes", pagesSent, stats.getRows(), stats.getBytes());
        put(ReadResult.page(data, stats));
    }

    private void put(ReadResult result)
    {
        try {
            while (!queue.offer(result, PUT_RETRY_MILLIS, MILLISECONDS)) {
                checkNotCanceled();
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while queueing a page");
        }
        if (closed) {
            queue.clear();
        }
    }

    private void checkNotCanceled()
    {
        if (closed || Thread.currentThread().isInterrupted()) {
            releaseBuffer();
            throw new CancellationException("Split read was canceled");
        }
    }

    private void releaseBuffer()
    {
        if (buffer != null) {
            buffer.close();
            buffer = null;
        }
    }
}
