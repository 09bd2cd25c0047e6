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
package com.facebook.presto.federation.datasource.objectstorage;

import au.com.bytecode.opencsv.CSVReader;
import com.facebook.airlift.log.Logger;
import com.facebook.presto.federation.FederationException;
import com.facebook.presto.federation.conversion.NativeKind;
import com.facebook.presto.federation.datasource.DataSource;
import com.facebook.presto.federation.datasource.SplitConsumer;
import com.facebook.presto.federation.paging.Acceptor;
import com.facebook.presto.federation.paging.DefaultRowTransformer;
import com.facebook.presto.federation.paging.Sink;
import com.facebook.presto.federation.paging.SinkFactory;
import com.facebook.presto.federation.protocol.Column;
import com.facebook.presto.federation.protocol.DescribeTableRequest;
import com.facebook.presto.federation.protocol.Filtering;
import com.facebook.presto.federation.protocol.ListSplitsRequest;
import com.facebook.presto.federation.protocol.ReadSplitsRequest;
import com.facebook.presto.federation.protocol.Select;
import com.facebook.presto.federation.protocol.Split;
import com.facebook.presto.federation.protocol.TableSchema;
import com.google.common.collect.ImmutableList;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.util.List;
import java.util.Optional;

import static com.facebook.presto.federation.FederationErrorCode.BACKEND_ERROR;
import static com.facebook.presto.federation.FederationErrorCode.INVALID_REQUEST;
import static com.facebook.presto.federation.FederationErrorCode.METHOD_NOT_SUPPORTED;
import static com.facebook.presto.federation.FederationErrorCode.TABLE_DOES_NOT_EXIST;
import static com.facebook.presto.federation.FederationErrorCode.UNSUPPORTED_PREDICATE;
import static com.facebook.presto.federation.datasource.RequestValidator.getDataSourceInstance;
import static java.lang.String.format;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * Reads CSV objects whose first record names the columns. Objects carry no types, so the select lists its columns.
 */
public class CsvObjectStorageDataSource
        implements DataSource
{
    private static final Logger log = Logger.get(CsvObjectStorageDataSource.class);

    private final ObjectStorageClient client;

    public CsvObjectStorageDataSource(ObjectStorageClient client)
    {
        this.client = requireNonNull(client, "client is null");
    }

    @Override
    public TableSchema describeTable(DescribeTableRequest request)
    {
        throw new FederationException(METHOD_NOT_SUPPORTED, "DescribeTable is not supported for schemaless object storage");
    }

    @Override
    public void listSplits(ListSplitsRequest request, Select select, SplitConsumer consumer)
    {
        consumer.accept(select, select.getFrom().getBytes(UTF_8));
    }

    @Override
    public void readSplit(String queryId, ReadSplitsRequest request, Split split, SinkFactory sinkFactory)
    {
        Select select = split.getSelect();
        if (select.getWhere().isPresent()) {
            if (request.getFiltering() == Filtering.MANDATORY) {
                throw new FederationException(UNSUPPORTED_PREDICATE, "Predicates cannot be pushed down to object storage");
            }
            log.warn("Query %s: dropping predicate on %s", queryId, select.getFrom());
        }

        String key = split.getDescription() == null || split.getDescription().length == 0
                ? select.getFrom()
                : new String(split.getDescription(), UTF_8);

        try (CSVReader reader = new CSVReader(new InputStreamReader(client.openObject(getDataSourceInstance(request, split), key), UTF_8))) {
            String[] header = reader.readNext();
            if (header == null) {
                header = new String[0];
            }
            List<Acceptor> acceptors = createAcceptors(header.length);
            DefaultRowTransformer transformer = DefaultRowTransformer.create(acceptors, select.getWhat(), Optional.of(wantedColumnIds(header, select.getWhat(), key)));

            Sink sink = sinkFactory.makeSink();
            for (String[] record = reader.readNext(); record != null; record = reader.readNext()) {
                for (int i = 0; i < acceptors.size(); i++) {
                    if (i < record.length) {
                        acceptors.get(i).set(record[i]);
                    }
                    else {
                        acceptors.get(i).setNull();
                    }
                }
                sink.addRow(transformer);
            }
        }
        catch (FileNotFoundException e) {
            throw new FederationException(TABLE_DOES_NOT_EXIST, "Object not found: " + key, e);
        }
        catch (IOException e) {
            throw new FederationException(BACKEND_ERROR, format("Failed to read object %s: %s", key, e.getMessage()), e);
        }
    }

    private static List<Acceptor> createAcceptors(int count)
    {
        ImmutableList.Builder<Acceptor> acceptors = ImmutableList.builder();
        for (int i = 0; i < count; i++) {
            acceptors.add(new Acceptor(NativeKind.STRING));
        }
        return acceptors.build();
    }

    private static List<Integer> wantedColumnIds(String[] header, List<Column> columns, String key)
    {
        ImmutableList.Builder<Integer> ids = ImmutableList.builder();
        for (Column column : columns) {
            int position = indexOf(header, column.getName());
            if (position < 0) {
                throw new FederationException(INVALID_REQUEST, format("Invalid request: column %s not found in object %s", column.getName(), key));
            }
            ids.add(position);
        }
        return ids.build();
    }

    private static int indexOf(String[] header, String name)
    {
        for (int i = 0; i < header.length; i++) {
            if (header[i].trim().equals(name)) {
                return i;
            }
        }
        return -1;
    }
}
