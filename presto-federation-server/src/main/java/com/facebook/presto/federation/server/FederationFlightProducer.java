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
package com.facebook.presto.federation.server;

import com.facebook.airlift.json.JsonCodec;
import com.facebook.airlift.log.Logger;
import com.facebook.presto.federation.datasource.DataSourceCollection;
import com.facebook.presto.federation.protocol.DescribeTableRequest;
import com.facebook.presto.federation.protocol.DescribeTableResponse;
import com.facebook.presto.federation.protocol.ListSplitsRequest;
import com.facebook.presto.federation.protocol.ReadSplitsRequest;
import com.facebook.presto.federation.protocol.ReadSplitsResponse;
import com.facebook.presto.federation.protocol.Stats;
import com.facebook.presto.federation.streaming.ReadSplitsResponseSender;
import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import org.apache.arrow.flight.Action;
import org.apache.arrow.flight.ActionType;
import org.apache.arrow.flight.BackpressureStrategy;
import org.apache.arrow.flight.CallStatus;
import org.apache.arrow.flight.NoOpFlightProducer;
import org.apache.arrow.flight.Result;
import org.apache.arrow.flight.Ticket;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VectorSchemaRoot;

import java.util.UUID;
import java.util.concurrent.ExecutorService;

import static com.facebook.presto.federation.ApiErrors.toApiError;
import static com.facebook.presto.federation.client.FederationConnectorClient.DESCRIBE_TABLE_REQUEST_CODEC;
import static com.facebook.presto.federation.client.FederationConnectorClient.DESCRIBE_TABLE_RESPONSE_CODEC;
import static com.facebook.presto.federation.client.FederationConnectorClient.LIST_SPLITS_REQUEST_CODEC;
import static com.facebook.presto.federation.client.FederationConnectorClient.LIST_SPLITS_RESPONSE_CODEC;
import static com.facebook.presto.federation.client.FederationConnectorClient.READ_SPLITS_REQUEST_CODEC;
import static com.facebook.presto.federation.client.FederationConnectorClient.READ_SPLITS_RESPONSE_CODEC;
import static com.facebook.presto.federation.client.ReadSplitsResponseIterator.RESPONSE_COLUMN;
import static com.facebook.presto.federation.client.ReadSplitsResponseIterator.RESPONSE_SCHEMA;
import static com.facebook.presto.federation.protocol.ConnectorActions.DESCRIBE_TABLE;
import static com.facebook.presto.federation.protocol.ConnectorActions.LIST_SPLITS;
import static java.util.Objects.requireNonNull;

/**
 * Serves DescribeTable and ListSplits as Flight actions with JSON bodies, and ReadSplits as a DoGet stream
 * whose ticket is the JSON request. Each ReadSplits response is one row of a binary column, sent only when
 * the client is ready for it.
 * <p>
 * Logical failures travel in the error envelope of a response; only transport level problems become a {@link CallStatus}.
 */
public class FederationFlightProducer
        extends NoOpFlightProducer
{
    private static final Logger log = Logger.get(FederationFlightProducer.class);
    private static final long CLIENT_POLL_MILLIS = 1000;

    private final DataSourceCollection dataSources;
    private final BufferAllocator allocator;
    private final ExecutorService readSplitsExecutor;

    @Inject
    public FederationFlightProducer(DataSourceCollection dataSources, BufferAllocator allocator, @ForReadSplitsStream ExecutorService readSplitsExecutor)
    {
        this.dataSources = requireNonNull(dataSources, "dataSources is null");
        this.allocator = requireNonNull(allocator, "allocator is null");
        this.readSplitsExecutor = requireNonNull(readSplitsExecutor, "readSplitsExecutor is null");
    }

    @Override
    public void doAction(CallContext context, Action action, StreamListener<Result> listener)
    {
        try {
            switch (action.getType()) {
                case DESCRIBE_TABLE:
                    describeTable(parse(DESCRIBE_TABLE_REQUEST_CODEC, action), listener);
                    break;
                case LIST_SPLITS:
                    listSplits(parse(LIST_SPLITS_REQUEST_CODEC, action), listener);
                    break;
                default:
                    throw CallStatus.UNIMPLEMENTED.withDescription("Unknown action type: " + action.getType()).toRuntimeException();
            }
            listener.onCompleted();
        }
        catch (RuntimeException e) {
            log.error(e, "Action %s failed", action.getType());
            listener.onError(e);
        }
    }

    @Override
    public void listActions(CallContext context, StreamListener<ActionType> listener)
    {
        for (String type : ImmutableList.of(DESCRIBE_TABLE, LIST_SPLITS)) {
            listener.onNext(new ActionType(type, type + " request, JSON encoded"));
        }
        listener.onCompleted();
    }

    @Override
    public void getStream(CallContext context, Ticket ticket, ServerStreamListener listener)
    {
        // the stream thread parks while the client is not ready, which must not hold a transport thread
        readSplitsExecutor.submit(() -> readSplits(ticket, listener));
    }

    private void describeTable(DescribeTableRequest request, StreamListener<Result> listener)
    {
        DescribeTableResponse response;
        try {
            response = DescribeTableResponse.success(dataSources.describeTable(request));
        }
        catch (RuntimeException e) {
            log.debug("DescribeTable of %s failed: %s", request.getTable(), e.getMessage());
            response = DescribeTableResponse.failure(toApiError(e));
        }
        listener.onNext(new Result(DESCRIBE_TABLE_RESPONSE_CODEC.toJsonBytes(response)));
    }

    private void listSplits(ListSplitsRequest request, StreamListener<Result> listener)
    {
        dataSources.listSplits(request, response -> listener.onNext(new Result(LIST_SPLITS_RESPONSE_CODEC.toJsonBytes(response))));
    }

    private void readSplits(Ticket ticket, ServerStreamListener listener)
    {
        BackpressureStrategy backpressureStrategy = new BackpressureStrategy.CallbackBackpressureStrategy();
        backpressureStrategy.register(listener);

        ReadSplitsRequest request;
        try {
            request = READ_SPLITS_REQUEST_CODEC.fromJson(ticket.getBytes());
        }
        catch (IllegalArgumentException e) {
            log.debug("Malformed ReadSplits request: %s", e.getMessage());
            listener.error(CallStatus.INVALID_ARGUMENT
                    .withDescription("Malformed ReadSplits request: " + e.getMessage())
                    .withCause(e)
                    .toRuntimeException());
            return;
        }

        String queryId = UUID.randomUUID().toString();
        log.debug("Query %s: reading %s splits", queryId, request.getSplits().size());
        try (VectorSchemaRoot root = VectorSchemaRoot.create(RESPONSE_SCHEMA, allocator)) {
            listener.start(root);
            Stats stats = dataSources.readSplits(queryId, request, new StreamResponseSender(queryId, listener, backpressureStrategy, root));
            if (listener.isCancelled()) {
                log.debug("Query %s: canceled by the client after %s rows", queryId, stats.getRows());
                return;
            }
            listener.completed();
            log.debug("Query %s: sent %s rows, %s bytes", queryId, stats.getRows(), stats.getBytes());
        }
        catch (RuntimeException e) {
            log.error(e, "Query %s: ReadSplits failed", queryId);
            listener.error(CallStatus.INTERNAL
                    .withDescription("ReadSplits failed: " + e.getMessage())
                    .withCause(e)
                    .toRuntimeException());
        }
    }

    private static <T> T parse(JsonCodec<T> codec, Action action)
    {
        try {
            return codec.fromJson(action.getBody());
        }
        catch (IllegalArgumentException e) {
            throw CallStatus.INVALID_ARGUMENT
                    .withDescription("Malformed " + action.getType() + " request: " + e.getMessage())
                    .withCause(e)
                    .toRuntimeException();
        }
    }

    /**
     * Writes each response as a one row batch once the client is ready for it.
     * A response is dropped when the client goes away while it waits.
     */
    private static class StreamResponseSender
            implements ReadSplitsResponseSender
    {
        private final String queryId;
        private final ServerStreamListener listener;
        private final BackpressureStrategy backpressureStrategy;
        private final VectorSchemaRoot root;
        private final VarBinaryVector responses;

        StreamResponseSender(String queryId, ServerStreamListener listener, BackpressureStrategy backpressureStrategy, VectorSchemaRoot root)
        {
            this.queryId = requireNonNull(queryId, "queryId is null");
            this.listener = requireNonNull(listener, "listener is null");
            this.backpressureStrategy = requireNonNull(backpressureStrategy, "backpressureStrategy is null");
            this.root = requireNonNull(root, "root is null");
            this.responses = (VarBinaryVector) root.getVector(RESPONSE_COLUMN);
        }

        @Override
        public void send(ReadSplitsResponse response)
        {
            if (!awaitClient()) {
                return;
            }
            responses.setSafe(0, READ_SPLITS_RESPONSE_CODEC.toJsonBytes(response));
            root.setRowCount(1);
            listener.putNext();
        }

        @Override
        public boolean isCancelled()
        {
            return listener.isCancelled();
        }

        private boolean awaitClient()
        {
            BackpressureStrategy.WaitResult waitResult;
            while ((waitResult = backpressureStrategy.waitForListener(CLIENT_POLL_MILLIS)) == BackpressureStrategy.WaitResult.TIMEOUT) {
                if (listener.isCancelled()) {
                    return false;
                }
                log.debug("Query %s: waiting for the client to read", queryId);
            }
            if (waitResult != BackpressureStrategy.WaitResult.READY) {
                log.debug("Query %s: stopped sending on client wait result %s", queryId, waitResult);
                return false;
            }
            return true;
        }
    }
}
