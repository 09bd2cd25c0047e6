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

import com.facebook.presto.federation.FederationErrorCode;
import com.facebook.presto.federation.FederationException;
import com.facebook.presto.federation.datasource.DataSource;
import com.facebook.presto.federation.paging.ColumnarBufferFactory;
import com.facebook.presto.federation.paging.NoOpReadLimiter;
import com.facebook.presto.federation.paging.PagingConfig;
import com.facebook.presto.federation.paging.ReadResult;
import com.facebook.presto.federation.paging.Sink;
import com.facebook.presto.federation.paging.TrafficTracker;
import com.facebook.presto.federation.protocol.Column;
import com.facebook.presto.federation.protocol.ColumnExpression;
import com.facebook.presto.federation.protocol.Credentials;
import com.facebook.presto.federation.protocol.DataSourceInstance;
import com.facebook.presto.federation.protocol.DataSourceKind;
import com.facebook.presto.federation.protocol.DescribeTableRequest;
import com.facebook.presto.federation.protocol.Endpoint;
import com.facebook.presto.federation.protocol.Filtering;
import com.facebook.presto.federation.protocol.IsNullPredicate;
import com.facebook.presto.federation.protocol.ListSplitsRequest;
import com.facebook.presto.federation.protocol.PrimitiveTypeId;
import com.facebook.presto.federation.protocol.ReadSplitsFormat;
import com.facebook.presto.federation.protocol.ReadSplitsRequest;
import com.facebook.presto.federation.protocol.Select;
import com.facebook.presto.federation.protocol.Split;
import com.facebook.presto.federation.protocol.TypeMappingSettings;
import com.facebook.presto.federation.protocol.WireType;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static com.facebook.presto.federation.client.ArrowIpcPages.readRows;
import static com.google.common.io.MoreFiles.deleteRecursively;
import static com.google.common.io.RecursiveDeleteOption.ALLOW_INSECURE;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.fail;

@Test(singleThreaded = true)
public class TestCsvObjectStorageDataSource
{
    private static final DataSourceInstance INSTANCE = new DataSourceInstance(
            DataSourceKind.S3,
            new Endpoint("storage.example.com", 9000),
            "bucket",
            new Credentials("access", "secret"),
            false,
            ImmutableMap.of());
    private static final Column NAME = new Column("name", WireType.optional(PrimitiveTypeId.UTF8));
    private static final Column CITY = new Column("city", WireType.optional(PrimitiveTypeId.UTF8));
    private static final Column NAME_BYTES = new Column("name", WireType.optional(PrimitiveTypeId.STRING));

    private Path storage;
    private BufferAllocator allocator;
    private DataSource dataSource;

    @BeforeClass
    public void setUp()
            throws IOException
    {
        storage = Files.createTempDirectory("object-storage");
        Path bucket = Files.createDirectories(storage.resolve("bucket").resolve("people"));
        Files.write(bucket.resolve("data.csv"), "id, name,city\n1,alice,Paris\n2,\"bob, jr\",Oslo\n3,carol\n".getBytes(UTF_8));
        Files.write(bucket.resolve("empty.csv"), new byte[0]);

        allocator = new RootAllocator(Long.MAX_VALUE);
        ObjectStorageClient client = new UrlObjectStorageClient(new ObjectStorageConfig().setEndpoint(storage.toUri()));
        dataSource = new CsvObjectStorageDataSourceFactory(client).create(DataSourceKind.S3);
    }

    @AfterClass(alwaysRun = true)
    public void tearDown()
            throws IOException
    {
        allocator.close();
        deleteRecursively(storage, ALLOW_INSECURE);
    }

    @Test
    public void testReadColumns()
    {
        List<List<Object>> rows = read(select("people/data.csv", CITY, NAME), Filtering.OPTIONAL);

        assertEquals(rows.size(), 3);
        assertEquals(rows.get(0).get(0).toString(), "Paris");
        assertEquals(rows.get(0).get(1).toString(), "alice");
        assertEquals(rows.get(1).get(1).toString(), "bob, jr");
        // short record
        assertNull(rows.get(2).get(0));
        assertEquals(rows.get(2).get(1).toString(), "carol");
    }

    @Test
    public void testReadAsBytes()
    {
        List<List<Object>> rows = read(select("people/data.csv", NAME_BYTES), Filtering.OPTIONAL);
        assertEquals((byte[]) rows.get(0).get(0), "alice".getBytes(UTF_8));
    }

    @Test
    public void testListSplits()
    {
        Select select = select("people/data.csv", NAME);
        List<Split> splits = new ArrayList<>();
        dataSource.listSplits(new ListSplitsRequest(ImmutableList.of(select)), select, (splitSelect, description) -> splits.add(new Split(0, splitSelect, description)));

        assertEquals(splits.size(), 1);
        assertEquals(new String(splits.get(0).getDescription(), UTF_8), "people/data.csv");
    }

    @Test
    public void testEmptyObject()
    {
        assertEquals(read(select("people/empty.csv"), Filtering.OPTIONAL).size(), 0);
    }

    @Test
    public void testMissingObject()
    {
        assertFailure(() -> read(select("people/missing.csv", NAME), Filtering.OPTIONAL), FederationErrorCode.TABLE_DOES_NOT_EXIST);
    }

    @Test
    public void testMissingColumn()
    {
        Column age = new Column("age", WireType.optional(PrimitiveTypeId.UTF8));
        assertFailure(() -> read(select("people/data.csv", age), Filtering.OPTIONAL), FederationErrorCode.INVALID_REQUEST);
    }

    @Test
    public void testPredicates()
    {
        Select select = select("people/data.csv", NAME).withWhere(new IsNullPredicate(new ColumnExpression("name")));
        assertEquals(read(select, Filtering.OPTIONAL).size(), 3);
        assertFailure(() -> read(select, Filtering.MANDATORY), FederationErrorCode.UNSUPPORTED_PREDICATE);
    }

    @Test
    public void testDescribeTableNotSupported()
    {
        assertFailure(
                () -> dataSource.describeTable(new DescribeTableRequest(INSTANCE, "people/data.csv", TypeMappingSettings.defaults())),
                FederationErrorCode.METHOD_NOT_SUPPORTED);
    }

    @Test
    public void testObjectUrl()
            throws IOException
    {
        UrlObjectStorageClient client = new UrlObjectStorageClient(new ObjectStorageConfig());
        assertEquals(
                client.getObjectUrl(INSTANCE, "people/2024 q1.csv").toString(),
                "http://storage.example.com:9000/bucket/people/2024%20q1.csv");

        client = new UrlObjectStorageClient(new ObjectStorageConfig().setEndpoint(URI.create("https://minio.local/")));
        assertEquals(client.getObjectUrl(INSTANCE, "data.csv").toString(), "https://minio.local/bucket/data.csv");
    }

    @Test
    public void testOnlyObjectStorageKinds()
    {
        CsvObjectStorageDataSourceFactory factory = new CsvObjectStorageDataSourceFactory((instance, key) -> {
            throw new IOException("unused");
        });
        assertFailure(() -> factory.create(DataSourceKind.POSTGRESQL), FederationErrorCode.DATA_SOURCE_NOT_SUPPORTED);
    }

    private static Select select(String key, Column... columns)
    {
        return new Select(INSTANCE, key, ImmutableList.copyOf(columns));
    }

    private List<List<Object>> read(Select select, Filtering filtering)
    {
        Split split = new Split(0, select, null);
        ReadSplitsRequest request = new ReadSplitsRequest(INSTANCE, ImmutableList.of(split), ReadSplitsFormat.ARROW_IPC_STREAMING, filtering);
        AtomicReference<Sink> sink = new AtomicReference<>();
        try {
            dataSource.readSplit("query", request, split, () -> {
                sink.set(new Sink(
                        new ColumnarBufferFactory(allocator, ReadSplitsFormat.ARROW_IPC_STREAMING, select.getWhat()),
                        new TrafficTracker(new PagingConfig()),
                        NoOpReadLimiter.INSTANCE,
                        4));
                return sink.get();
            });
        }
        catch (RuntimeException e) {
            if (sink.get() != null) {
                sink.get().fail(e);
            }
            throw e;
        }
        sink.get().finish();

        List<List<Object>> rows = new ArrayList<>();
        try {
            for (ReadResult result = sink.get().poll(10, SECONDS); !result.isTerminal(); result = sink.get().poll(10, SECONDS)) {
                rows.addAll(readRows(allocator, result.getPage()));
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(e);
        }
        return rows;
    }

    private static void assertFailure(Runnable action, FederationErrorCode expected)
    {
        try {
            action.run();
            fail("expected " + expected);
        }
        catch (FederationException e) {
            assertEquals(e.getErrorCode(), expected);
        }
    }
}
