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

import com.facebook.presto.federation.FederationErrorCode;
import com.facebook.presto.federation.FederationException;
import com.facebook.presto.federation.observation.NoOpQueryObserver;
import com.facebook.presto.federation.paging.PagingConfig;
import com.facebook.presto.federation.paging.TestingRows;
import com.facebook.presto.federation.protocol.ApiError;
import com.facebook.presto.federation.protocol.ColumnExpression;
import com.facebook.presto.federation.protocol.ComparisonPredicate;
import com.facebook.presto.federation.protocol.DataSourceInstance;
import com.facebook.presto.federation.protocol.DataSourceKind;
import com.facebook.presto.federation.protocol.DescribeTableRequest;
import com.facebook.presto.federation.protocol.Filtering;
import com.facebook.presto.federation.protocol.ListSplitsRequest;
import com.facebook.presto.federation.protocol.ListSplitsResponse;
import com.facebook.presto.federation.protocol.PrimitiveTypeId;
import com.facebook.presto.federation.protocol.ReadSplitsFormat;
import com.facebook.presto.federation.protocol.ReadSplitsRequest;
import com.facebook.presto.federation.protocol.ReadSplitsResponse;
import com.facebook.presto.federation.protocol.Select;
import com.facebook.presto.federation.protocol.Split;
import com.facebook.presto.federation.protocol.StatusCode;
import com.facebook.presto.federation.protocol.TypeMappingSettings;
import com.facebook.presto.federation.protocol.ValueExpression;
import com.facebook.presto.federation.server.FederationConnectorConfig;
import com.facebook.presto.federation.server.FederationConnectorStats;
import com.facebook.presto.federation.streaming.CollectingResponseSender;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

import static com.facebook.airlift.concurrent.Threads.daemonThreadsNamed;
import static com.facebook.presto.federation.client.ArrowIpcPages.countRows;
import static com.facebook.presto.federation.datasource.TestingDataSource.TABLE;
import static com.facebook.presto.federation.datasource.TestingDataSource.instance;
import static com.facebook.presto.federation.datasource.TestingDataSource.select;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.concurrent.Executors.newCachedThreadPool;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

@Test(singleThreaded = true)
public class TestDataSourceCollection
{
    private static final ComparisonPredicate ID_EQUALS_ONE = new ComparisonPredicate(
            ComparisonPredicate.Operator.EQUAL,
            new ColumnExpression("id"),
            new ValueExpression(PrimitiveTypeId.INT64, 1L));

    private BufferAllocator allocator;
    private ExecutorService executor;

    @BeforeClass
    public void setUp()
    {
        allocator = new RootAllocator(Long.MAX_VALUE);
        executor = newCachedThreadPool(daemonThreadsNamed("test-split-reader-%s"));
    }

    @AfterClass(alwaysRun = true)
    public void tearDown()
            throws InterruptedException
    {
        executor.shutdownNow();
        assertTrue(executor.awaitTermination(10, SECONDS));
        allocator.close();
    }

    @Test
    public void testDescribeTable()
    {
        DataSourceCollection collection = createCollection(new TestingDataSource(5));
        assertEquals(
                collection.describeTable(new DescribeTableRequest(instance(), TABLE, TypeMappingSettings.defaults())).getColumns(),
                TestingRows.COLUMNS);
    }

    @Test
    public void testDescribeMissingTable()
    {
        DataSourceCollection collection = createCollection(new TestingDataSource(5));
        assertFailure(
                () -> collection.describeTable(new DescribeTableRequest(instance(), "missing", TypeMappingSettings.defaults())),
                FederationErrorCode.TABLE_DOES_NOT_EXIST);
        assertEquals(FederationErrorCode.TABLE_DOES_NOT_EXIST.getStatusCode(), StatusCode.NOT_FOUND);
    }

    @Test
    public void testDescribeInvalidRequest()
    {
        DataSourceCollection collection = createCollection(new TestingDataSource(5));
        assertFailure(
                () -> collection.describeTable(new DescribeTableRequest(instance(), "", TypeMappingSettings.defaults())),
                FederationErrorCode.INVALID_REQUEST);
    }

    @Test
    public void testUnknownKind()
    {
        DataSourceCollection collection = createCollection(new TestingDataSource(5));
        DataSourceInstance mysql = new DataSourceInstance(
                DataSourceKind.MYSQL,
                instance().getEndpoint(),
                instance().getDatabase(),
                instance().getCredentials(),
                false,
                ImmutableMap.of());
        assertFailure(
                () -> collection.describeTable(new DescribeTableRequest(mysql, TABLE, TypeMappingSettings.defaults())),
                FederationErrorCode.DATA_SOURCE_NOT_SUPPORTED);
    }

    @Test
    public void testListSplitsAssignsSequentialIds()
    {
        DataSourceCollection collection = createCollection(new TestingDataSource(4));
        List<ListSplitsResponse> responses = listSplits(collection, new ListSplitsRequest(ImmutableList.of(select(), select()), 2, 0, 0));

        assertEquals(responses.size(), 2);
        assertEquals(splitIds(responses.get(0)), ImmutableList.of(0L, 1L));
        assertEquals(splitIds(responses.get(1)), ImmutableList.of(2L, 3L));
        for (ListSplitsResponse response : responses) {
            assertTrue(response.getError().isSuccess());
            for (Split split : response.getSplits()) {
                assertEquals(split.getSelect().getFrom(), TABLE);
            }
        }
    }

    @Test
    public void testListSplitsRejectsUnsupportedSplitCount()
    {
        DataSource wholeTableOnly = new TestingDataSource(4)
        {
            @Override
            public boolean supportsSplitCount()
            {
                return false;
            }
        };
        DataSourceCollection collection = createCollection(wholeTableOnly);
        List<ListSplitsResponse> responses = listSplits(collection, new ListSplitsRequest(ImmutableList.of(select()), 2, 0, 0));

        assertEquals(responses.size(), 1);
        assertEquals(responses.get(0).getError().getStatus(), StatusCode.BAD_REQUEST);
        assertTrue(responses.get(0).getSplits().isEmpty());
    }

    @Test
    public void testListSplitsInvalidRequest()
    {
        DataSourceCollection collection = createCollection(new TestingDataSource(4));
        List<ListSplitsResponse> responses = listSplits(collection, new ListSplitsRequest(ImmutableList.of(select()), 0, 1024, 0));

        assertEquals(responses.size(), 1);
        assertEquals(responses.get(0).getError().getStatus(), StatusCode.BAD_REQUEST);
    }

    @Test
    public void testReadSplitsRejectsColumnSet()
    {
        DataSourceCollection collection = createCollection(new TestingDataSource(5));
        CollectingResponseSender sender = new CollectingResponseSender();
        ReadSplitsRequest request = new ReadSplitsRequest(instance(), ImmutableList.of(new Split(0, select(), null)), ReadSplitsFormat.COLUMN_SET, Filtering.OPTIONAL);
        collection.readSplits("query", request, sender);

        assertEquals(sender.getResponses().size(), 1);
        ReadSplitsResponse response = sender.getResponses().get(0);
        assertEquals(response.getSplitIndexNumber(), 0);
        assertEquals(response.getError().getStatus(), StatusCode.BAD_REQUEST);
    }

    @Test
    public void testReadSplitsInOrder()
    {
        DataSourceCollection collection = createCollection(new TestingDataSource(5));
        List<Split> splits = listSplits(collection, new ListSplitsRequest(ImmutableList.of(select()), 2, 0, 0)).get(0).getSplits();
        assertEquals(splits.size(), 2);

        CollectingResponseSender sender = new CollectingResponseSender();
        ReadSplitsRequest request = new ReadSplitsRequest(instance(), splits, ReadSplitsFormat.UNSPECIFIED, Filtering.OPTIONAL);
        assertEquals(collection.readSplits("query", request, sender).getRows(), 5);

        assertTrue(sender.getErrors().isEmpty());
        assertEquals(pageSizes(sender), ImmutableList.of(2, 1, 2));
        assertEquals(
                sender.getPages().stream().map(ReadSplitsResponse::getSplitIndexNumber).collect(toImmutableList()),
                ImmutableList.of(0, 0, 1));
    }

    @Test
    public void testReadLimitIsSharedAcrossSplits()
    {
        DataSourceCollection collection = createCollection(new TestingDataSource(5), 4L);
        List<Split> splits = listSplits(collection, new ListSplitsRequest(ImmutableList.of(select()), 2, 0, 0)).get(0).getSplits();

        CollectingResponseSender sender = new CollectingResponseSender();
        collection.readSplits("query", new ReadSplitsRequest(instance(), splits, ReadSplitsFormat.ARROW_IPC_STREAMING, Filtering.OPTIONAL), sender);

        assertEquals(pageSizes(sender), ImmutableList.of(2, 1));
        List<ReadSplitsResponse> responses = sender.getResponses();
        ReadSplitsResponse last = responses.get(responses.size() - 1);
        assertEquals(last.getSplitIndexNumber(), 1);
        assertEquals(last.getError().getStatus(), StatusCode.BAD_REQUEST);
        assertEquals(sender.getErrors().size(), 1);
    }

    @Test
    public void testMandatoryFilteringWithUnsupportedPredicate()
    {
        DataSourceCollection collection = createCollection(new TestingDataSource(5));
        CollectingResponseSender sender = new CollectingResponseSender();
        Split split = new Split(0, select().withWhere(ID_EQUALS_ONE), null);
        collection.readSplits("query", new ReadSplitsRequest(instance(), ImmutableList.of(split), ReadSplitsFormat.ARROW_IPC_STREAMING, Filtering.MANDATORY), sender);

        assertTrue(sender.getPages().isEmpty());
        List<ApiError> errors = sender.getErrors();
        assertEquals(errors.size(), 1);
        assertEquals(errors.get(0).getStatus(), StatusCode.UNSUPPORTED);
    }

    @Test
    public void testOptionalFilteringWithUnsupportedPredicate()
    {
        DataSourceCollection collection = createCollection(new TestingDataSource(5));
        CollectingResponseSender sender = new CollectingResponseSender();
        Split split = new Split(0, select().withWhere(ID_EQUALS_ONE), null);
        collection.readSplits("query", new ReadSplitsRequest(instance(), ImmutableList.of(split), ReadSplitsFormat.ARROW_IPC_STREAMING, Filtering.OPTIONAL), sender);

        assertTrue(sender.getErrors().isEmpty());
        assertEquals(pageSizes(sender), ImmutableList.of(2, 2, 1));
    }

    @Test
    public void testReadWithoutColumns()
    {
        DataSourceCollection collection = createCollection(new TestingDataSource(3));
        CollectingResponseSender sender = new CollectingResponseSender();
        Split split = new Split(0, new Select(instance(), TABLE, ImmutableList.of()), null);
        collection.readSplits("query", new ReadSplitsRequest(instance(), ImmutableList.of(split), ReadSplitsFormat.ARROW_IPC_STREAMING, Filtering.OPTIONAL), sender);

        assertTrue(sender.getErrors().isEmpty());
        assertEquals(pageSizes(sender), ImmutableList.of(2, 1));
    }

    private DataSourceCollection createCollection(DataSource dataSource)
    {
        return createCollection(dataSource, null);
    }

    private DataSourceCollection createCollection(DataSource dataSource, Long readLimitRows)
    {
        Map<DataSourceKind, DataSourceFactory> factories = ImmutableMap.of(DataSourceKind.POSTGRESQL, kind -> dataSource);
        return new DataSourceCollection(
                factories,
                new PagingConfig().setRowsPerPage(2),
                new FederationConnectorConfig().setReadLimitRows(readLimitRows),
                allocator,
                executor,
                new NoOpQueryObserver(),
                new FederationConnectorStats());
    }

    private static List<ListSplitsResponse> listSplits(DataSourceCollection collection, ListSplitsRequest request)
    {
        List<ListSplitsResponse> responses = new ArrayList<>();
        collection.listSplits(request, responses::add);
        return responses;
    }

    private static List<Long> splitIds(ListSplitsResponse response)
    {
        return response.getSplits().stream().map(Split::getId).collect(toImmutableList());
    }

    private List<Integer> pageSizes(CollectingResponseSender sender)
    {
        return sender.getPages().stream()
                .map(page -> countRows(allocator, page.getArrowIpcStreaming()))
                .collect(toImmutableList());
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
