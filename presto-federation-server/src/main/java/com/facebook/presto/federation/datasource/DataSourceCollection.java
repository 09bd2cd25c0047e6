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
package com.facebook.presto.federation.datasource;

import com.facebook.airlift.log.Logger;
import com.facebook.presto.federation.FederationException;
import com.facebook.presto.federation.observation.QueryObserver;
import com.facebook.presto.federation.paging.ColumnarBufferFactory;
import com.facebook.presto.federation.paging.PagingConfig;
import com.facebook.presto.federation.paging.ReadLimiter;
import com.facebook.presto.federation.paging.ReadLimiterFactory;
import com.facebook.presto.federation.paging.Sink;
import com.facebook.presto.federation.paging.TrafficTracker;
import com.facebook.presto.federation.protocol.ApiError;
import com.facebook.presto.federation.protocol.DataSourceKind;
import com.facebook.presto.federation.protocol.DescribeTableRequest;
import com.facebook.presto.federation.protocol.ListSplitsRequest;
import com.facebook.presto.federation.protocol.ListSplitsResponse;
import com.facebook.presto.federation.protocol.ReadSplitsFormat;
import com.facebook.presto.federation.protocol.ReadSplitsRequest;
import com.facebook.presto.federation.protocol.ReadSplitsResponse;
import com.facebook.presto.federation.protocol.Select;
import com.facebook.presto.federation.protocol.Split;
import com.facebook.presto.federation.protocol.Stats;
import com.facebook.presto.federation.protocol.TableSchema;
import com.facebook.presto.federation.server.FederationConnectorConfig;
import com.facebook.presto.federation.server.FederationConnectorStats;
import com.facebook.presto.federation.server.ForSplitReader;
import com.facebook.presto.federation.streaming.ReadSplitsResponseSender;
import com.facebook.presto.federation.streaming.ReadSplitsStreamer;
import com.facebook.presto.federation.streaming.StreamOutcome;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import org.apache.arrow.memory.BufferAllocator;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;

import static com.facebook.presto.federation.ApiErrors.toApiError;
import static com.facebook.presto.federation.FederationErrorCode.DATA_SOURCE_NOT_SUPPORTED;
import static com.facebook.presto.federation.FederationErrorCode.INVALID_REQUEST;
import static com.facebook.presto.federation.datasource.RequestValidator.getDataSourceInstance;
import static com.facebook.presto.federation.datasource.RequestValidator.validateDescribeTableRequest;
import static com.facebook.presto.federation.datasource.RequestValidator.validateListSplitsRequest;
import static com.facebook.presto.federation.datasource.RequestValidator.validateReadSplitsRequest;
import static java.util.Objects.requireNonNull;

/**
 * Entry point of the three RPCs: validates requests, resolves the data source of the requested kind and delegates.
 * The splits of a ReadSplits request are streamed one after another and share one read limiter.
 */
public class DataSourceCollection
{
    private static final Logger log = Logger.get(DataSourceCollection.class);

    private final Map<DataSourceKind, DataSourceFactory> dataSourceFactories;
    private final PagingConfig pagingConfig;
    private final ReadSplitsFormat defaultFormat;
    private final ReadLimiterFactory readLimiterFactory;
    private final BufferAllocator allocator;
    private final ExecutorService splitReaderExecutor;
    private final QueryObserver queryObserver;
    private final FederationConnectorStats stats;

    @Inject
    public DataSourceCollection(
            Map<DataSourceKind, DataSourceFactory> dataSourceFactories,
            PagingConfig pagingConfig,
            FederationConnectorConfig config,
            BufferAllocator allocator,
            @ForSplitReader ExecutorService splitReaderExecutor,
            QueryObserver queryObserver,
            FederationConnectorStats stats)
    {
        this.dataSourceFactories = ImmutableMap.copyOf(requireNonNull(dataSourceFactories, "dataSourceFactories is null"));
        this.pagingConfig = requireNonNull(pagingConfig, "pagingConfig is null").validate();
        this.defaultFormat = requireNonNull(config, "config is null").getDefaultFormat();
        this.readLimiterFactory = new ReadLimiterFactory(config.getReadLimitRows());
        this.allocator = requireNonNull(allocator, "allocator is null");
        this.splitReaderExecutor = requireNonNull(splitReaderExecutor, "splitReaderExecutor is null");
        this.queryObserver = requireNonNull(queryObserver, "queryObserver is null");
        this.stats = requireNonNull(stats, "stats is null");
    }

    public TableSchema describeTable(DescribeTableRequest request)
    {
        validateDescribeTableRequest(request);
        log.debug("DescribeTable %s", request);
        return getDataSource(request.getDataSourceInstance().getKind()).describeTable(request);
    }

    /**
     * Sends one response per select. The first failing select is reported as an error response and ends the stream.
     */
    public void listSplits(ListSplitsRequest request, Consumer<ListSplitsResponse> responses)
    {
        try {
            validateListSplitsRequest(request);
        }
        catch (FederationException e) {
            responses.accept(ListSplitsResponse.failure(toApiError(e)));
            return;
        }

        long[] nextSplitId = {0};
        for (Select select : request.getSelects()) {
            ImmutableList.Builder<Split> splits = ImmutableList.builder();
            try {
                DataSource dataSource = getDataSource(select.getDataSourceInstance().getKind());
                if (request.getMaxSplitCount() > 1 && !dataSource.supportsSplitCount()) {
                    throw new FederationException(INVALID_REQUEST, "maxSplitCount is not supported by " + select.getDataSourceInstance().getKind());
                }
                dataSource.listSplits(request, select, (splitSelect, description) -> splits.add(new Split(nextSplitId[0]++, splitSelect, description)));
            }
            catch (RuntimeException e) {
                log.error(e, "ListSplits failed for %s", select.getFrom());
                responses.accept(ListSplitsResponse.failure(toApiError(e)));
                return;
            }
            List<Split> result = splits.build();
            log.debug("Listed %s splits for %s", result.size(), select.getFrom());
            responses.accept(ListSplitsResponse.success(result));
        }
    }

    /**
     * Streams the splits of the request in order. Reading stops at the first failed or canceled split.
     *
     * @return rows and bytes sent over all splits
     */
    public Stats readSplits(String queryId, ReadSplitsRequest request, ReadSplitsResponseSender sender)
    {
        queryObserver.queryStarted(queryId, request);
        Stats total = Stats.empty();

        ReadSplitsFormat format;
        ReadLimiter readLimiter;
        try {
            validateReadSplitsRequest(request);
            format = request.getFormat() == ReadSplitsFormat.UNSPECIFIED ? defaultFormat : request.getFormat();
            readLimiter = readLimiterFactory.makeReadLimiter(queryId);
        }
        catch (FederationException e) {
            ApiError error = toApiError(e);
            sender.send(ReadSplitsResponse.failure(0, error));
            queryObserver.queryFailed(queryId, error);
            return total;
        }

        List<Split> splits = request.getSplits();
        for (int splitIndex = 0; splitIndex < splits.size(); splitIndex++) {
            Split split = splits.get(splitIndex);
            ReadSplitsStreamer streamer;
            try {
                DataSource dataSource = getDataSource(getDataSourceInstance(request, split).getKind());
                Sink sink = new Sink(
                        new ColumnarBufferFactory(allocator, format, split.getSelect().getWhat()),
                        new TrafficTracker(pagingConfig),
                        readLimiter,
                        pagingConfig.getPrefetchQueueCapacity());
                streamer = new ReadSplitsStreamer(dataSource, queryId, request, split, splitIndex, sink, sender, splitReaderExecutor, stats);
            }
            catch (RuntimeException e) {
                ApiError error = toApiError(e);
                log.error(e, "Query %s: cannot read split %s", queryId, splitIndex);
                stats.splitFailed();
                sender.send(ReadSplitsResponse.failure(splitIndex, error));
                queryObserver.queryFailed(queryId, error);
                return total;
            }

            StreamOutcome outcome = streamer.run();
            total = total.add(outcome.getStats());
            switch (outcome.getState()) {
                case COMPLETED:
                    queryObserver.splitFinished(queryId, split, outcome.getStats());
                    break;
                case FAILED:
                    queryObserver.queryFailed(queryId, outcome.getError().get());
                    return total;
                case CANCELED:
                    queryObserver.queryCanceled(queryId);
                    return total;
            }
        }

        queryObserver.queryFinished(queryId, total);
        return total;
    }

    private DataSource getDataSource(DataSourceKind kind)
    {
        DataSourceFactory factory = dataSourceFactories.get(kind);
        if (factory == null) {
            throw new FederationException(DATA_SOURCE_NOT_SUPPORTED, "Data source kind is not supported: " + kind);
        }
        return factory.create(kind);
    }
}
