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
package com.facebook.presto.federation.client;

import com.facebook.airlift.json.JsonCodec;
import com.facebook.presto.federation.protocol.DescribeTableRequest;
import com.facebook.presto.federation.protocol.DescribeTableResponse;
import com.facebook.presto.federation.protocol.ListSplitsRequest;
import com.facebook.presto.federation.protocol.ListSplitsResponse;
import com.facebook.presto.federation.protocol.ReadSplitsRequest;
import com.facebook.presto.federation.protocol.ReadSplitsResponse;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import org.apache.arrow.flight.Action;
import org.apache.arrow.flight.CallOption;
import org.apache.arrow.flight.FlightClient;
import org.apache.arrow.flight.Location;
import org.apache.arrow.flight.Result;
import org.apache.arrow.flight.Ticket;
import org.apache.arrow.memory.BufferAllocator;

import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

import static com.facebook.airlift.json.JsonCodec.jsonCodec;
import static com.facebook.presto.federation.protocol.ConnectorActions.DESCRIBE_TABLE;
import static com.facebook.presto.federation.protocol.ConnectorActions.LIST_SPLITS;
import static java.util.Objects.requireNonNull;

/**
 * Client for the describe/list/read RPCs. DescribeTable and ListSplits are Flight actions with JSON bodies,
 * ReadSplits is a Flight stream.
 */
public class FederationConnectorClient
        implements AutoCloseable
{
    public static final JsonCodec<DescribeTableRequest> DESCRIBE_TABLE_REQUEST_CODEC = jsonCodec(DescribeTableRequest.class);
    public static final JsonCodec<DescribeTableResponse> DESCRIBE_TABLE_RESPONSE_CODEC = jsonCodec(DescribeTableResponse.class);
    public static final JsonCodec<ListSplitsRequest> LIST_SPLITS_REQUEST_CODEC = jsonCodec(ListSplitsRequest.class);
    public static final JsonCodec<ListSplitsResponse> LIST_SPLITS_RESPONSE_CODEC = jsonCodec(ListSplitsResponse.class);
    public static final JsonCodec<ReadSplitsRequest> READ_SPLITS_REQUEST_CODEC = jsonCodec(ReadSplitsRequest.class);
    public static final JsonCodec<ReadSplitsResponse> READ_SPLITS_RESPONSE_CODEC = jsonCodec(ReadSplitsResponse.class);

    private final FlightClient flightClient;

    public FederationConnectorClient(FlightClient flightClient)
    {
        this.flightClient = requireNonNull(flightClient, "flightClient is null");
    }

    public static FederationConnectorClient create(BufferAllocator allocator, Location location, Optional<InputStream> trustedCertificate)
    {
        FlightClient.Builder builder = FlightClient.builder(allocator, location);
        trustedCertificate.ifPresent(certificate -> builder.trustedCertificates(certificate).useTls());
        return new FederationConnectorClient(builder.build());
    }

    public DescribeTableResponse describeTable(DescribeTableRequest request, CallOption... options)
    {
        Iterator<Result> results = flightClient.doAction(new Action(DESCRIBE_TABLE, DESCRIBE_TABLE_REQUEST_CODEC.toJsonBytes(request)), options);
        DescribeTableResponse response = DESCRIBE_TABLE_RESPONSE_CODEC.fromJson(results.next().getBody());
        // drain so the call completes
        Iterators.size(results);
        return response;
    }

    public List<ListSplitsResponse> listSplits(ListSplitsRequest request, CallOption... options)
    {
        Iterator<Result> results = flightClient.doAction(new Action(LIST_SPLITS, LIST_SPLITS_REQUEST_CODEC.toJsonBytes(request)), options);
        return ImmutableList.copyOf(Iterators.transform(results, result -> LIST_SPLITS_RESPONSE_CODEC.fromJson(result.getBody())));
    }

    /**
     * Served as a DoGet stream whose ticket is the JSON request. Responses are decoded lazily as the server streams them,
     * and the server produces no further than the client reads.
     */
    public ReadSplitsResponseIterator readSplits(ReadSplitsRequest request, CallOption... options)
    {
        return new ReadSplitsResponseIterator(flightClient.getStream(new Ticket(READ_SPLITS_REQUEST_CODEC.toJsonBytes(request)), options));
    }

    @Override
    public void close()
            throws InterruptedException, IOException
    {
        flightClient.close();
    }
}
