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
package com.facebook.presto.federation.streaming;

import com.facebook.airlift.log.Logger;
import com.facebook.presto.federation.datasource.DataSource;
import com.facebook.presto.federation.paging.ReadResult;
import com.facebook.presto.federation.paging.Sink;
import com.facebook.presto.federation.paging.SinkFactory;
import com.facebook.presto.federation.protocol.ApiError;
import com.facebook.presto.federation.protocol.ReadSplitsRequest;
import com.facebook.presto.federation.protocol.ReadSplitsResponse;
import com.facebook.presto.federation.protocol.Split;
import com.facebook.presto.federation.protocol.Stats;
import com.facebook.presto.federation.server.FederationConnectorStats;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.facebook.presto.federation.ApiErrors.toApiError;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Streams one split: the data source reads it into the sink on a split reader thread
 * while the calling thread drains the sink and sends one response per page.
 * A failure is sent as exactly one error response after the pages sealed before it.
 */
public class ReadSplitsStreamer
{
    private static final Logger log = Logger.get(ReadSplitsStreamer.class);
    private static final long POLL_MILLIS = 100;
    private static final long READER_STOP_MILLIS = 10_000;

    private final DataSource dataSource;
    private final String queryId;
    private final ReadSplitsRequest request;
    private final Split split;
    private final int splitIndex;
    private final Sink sink;
    private final ReadSplitsResponseSender sender;
    private final ExecutorService splitReaderExecutor;
    private final FederationConnectorStats stats;

    public ReadSplitsStreamer(
            DataSource dataSource,
            String queryId,
            ReadSplitsRequest request,
            Split split,
            int splitIndex,
            Sink sink,
            ReadSplitsResponseSender sender,
            ExecutorService splitReaderExecutor,
            FederationConnectorStats stats)
    {
        this.dataSource = requireNonNull(dataSource, "dataSource is null");
        this.queryId = requireNonNull(queryId, "queryId is null");
        this.request = requireNonNull(request, "request is null");
        this.split = requireNonNull(split, "split is null");
        this.splitIndex = splitIndex;
        this.sink = requireNonNull(sink, "sink is null");
        this.sender = requireNonNull(sender, "sender is null");
        this.splitReaderExecutor = requireNonNull(splitReaderExecutor, "splitReaderExecutor is null");
        this.stats = requireNonNull(stats, "stats is null");
    }

    public StreamOutcome run()
    {
        Future<?> producer = splitReaderExecutor.submit(this::readSplit);
        Stats total = Stats.empty();
        try {
            while (true) {
                if (sender.isCancelled()) {
                    log.debug("Query %s: split %s canceled after %s", queryId, splitIndex, total);
                    stats.splitCanceled();
                    return StreamOutcome.canceled(total);
                }

                ReadResult result = sink.poll(POLL_MILLIS, MILLISECONDS);
                if (result == null) {
                    continue;
                }

                if (result.isTerminal()) {
                    if (result.getError().isPresent()) {
                        Throwable error = result.getError().get();
                        ApiError apiError = toApiError(error);
                        log.error(error, "Query %s: split %s failed with %s", queryId, splitIndex, apiError.getStatus());
                        stats.splitFailed();
                        sender.send(ReadSplitsResponse.failure(splitIndex, apiError));
                        return StreamOutcome.failed(total, apiError);
                    }
                    log.debug("Query %s: split %s finished with %s", queryId, splitIndex, total);
                    return StreamOutcome.completed(total);
                }

                sender.send(ReadSplitsResponse.page(result.getPage(), splitIndex, result.getStats()));
                stats.pageSent(result.getStats());
                total = total.add(result.getStats());
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stats.splitCanceled();
            return StreamOutcome.canceled(total);
        }
        finally {
            sink.close();
            awaitReader(producer);
        }
    }

    /**
     * A closed sink stops the reader at its next row. A reader blocked in the backend is interrupted after a grace period.
     */
    private void awaitReader(Future<?> producer)
    {
        try {
            producer.get(READER_STOP_MILLIS, MILLISECONDS);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            producer.cancel(true);
        }
        catch (TimeoutException e) {
            log.warn("Query %s: reader of split %s did not stop within %sms, interrupting it", queryId, splitIndex, READER_STOP_MILLIS);
            producer.cancel(true);
        }
        catch (ExecutionException | CancellationException e) {
            log.warn(e, "Query %s: reader of split %s ended abnormally", queryId, splitIndex);
        }
    }

    private void readSplit()
    {
        AtomicBoolean sinkIssued = new AtomicBoolean();
        SinkFactory sinkFactory = () -> {
            checkState(sinkIssued.compareAndSet(false, true), "sink already created for split %s", splitIndex);
            return sink;
        };
        try {
            dataSource.readSplit(queryId, request, split, sinkFactory);
            sink.finish();
        }
        catch (Throwable t) {
            sink.fail(t);
        }
    }
}
