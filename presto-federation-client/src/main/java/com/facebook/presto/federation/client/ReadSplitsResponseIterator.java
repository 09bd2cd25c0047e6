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

import com.facebook.presto.federation.protocol.ReadSplitsResponse;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import org.apache.arrow.flight.FlightStream;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;

import static com.facebook.presto.federation.client.FederationConnectorClient.READ_SPLITS_RESPONSE_CODEC;
import static com.google.common.base.Throwables.throwIfUnchecked;
import static java.util.Objects.requireNonNull;

/**
 * ReadSplits responses as they arrive on a Flight DoGet stream.
 * <p>
 * The stream carries record batches of {@link #RESPONSE_SCHEMA}, one JSON encoded response per row.
 * Closing the iterator before the end cancels the call.
 */
public class ReadSplitsResponseIterator
        extends AbstractIterator<ReadSplitsResponse>
        implements AutoCloseable
{
    public static final String RESPONSE_COLUMN = "response";
    public static final Schema RESPONSE_SCHEMA = new Schema(ImmutableList.of(Field.notNullable(RESPONSE_COLUMN, ArrowType.Binary.INSTANCE)));

    private final FlightStream stream;
    private VectorSchemaRoot root;
    private int position;
    private boolean closed;

    public ReadSplitsResponseIterator(FlightStream stream)
    {
        this.stream = requireNonNull(stream, "stream is null");
    }

    @Override
    protected ReadSplitsResponse computeNext()
    {
        while (root == null || position >= root.getRowCount()) {
            if (!stream.next()) {
                close();
                return endOfData();
            }
            root = stream.getRoot();
            position = 0;
        }
        VarBinaryVector responses = (VarBinaryVector) root.getVector(RESPONSE_COLUMN);
        return READ_SPLITS_RESPONSE_CODEC.fromJson(responses.get(position++));
    }

    @Override
    public void close()
    {
        if (closed) {
            return;
        }
        closed = true;
        try {
            stream.close();
        }
        catch (Exception e) {
            throwIfUnchecked(e);
            throw new RuntimeException(e);
        }
    }
}
