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

import com.facebook.presto.federation.datasource.DataSource;
import com.facebook.presto.federation.datasource.TestingDataSource;
import com.facebook.presto.federation.paging.ColumnarBufferFactory;
import com.facebook.presto.federation.paging.NoOpReadLimiter;
import com.facebook.presto.federation.paging.PagingConfig;
import com.facebook.presto.federation.paging.ReadLimiter;
import com.facebook.presto.federation.paging.RowCountReadLimiter;
import com.facebook.presto.federation.paging.Sink;
import com.facebook.presto.federation.paging.TestingRows;
import com.facebook.presto.federation.paging.TrafficTracker;
import com.facebook.presto.federation.protocol.ApiError;
import com.facebook.presto.federation.protocol.Filtering;
import com.facebook.presto.federation.protocol.ReadSplitsFormat;
import com.facebook.presto.federation.protocol.ReadSplitsRequest;
import com.facebook.presto.federation.protocol.ReadSplitsResponse;
import com.facebook.presto.federation.protocol.Split;
import com.facebook.presto.federation.protocol.StatusCode;
import com.facebook.presto.federation.server.FederationConnectorStats;
import com.google.common.collect.ImmutableList;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.ExecutorService;

import static com.facebook.airlift.concurrent.Threads.daemonThreadsNamed;
import static com.facebook.presto.federation.client.ArrowIpcPages.countRows;
import static com.facebook.presto.federation.client.ArrowIpcPages.readRows;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.concurrent.Executors.newCachedThreadPool;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;

@Test(singleThreaded = true)
public class TestReadSplitsStreamer
{
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
    public void testPagesFollowRowsPerPage()
    {
        CollectingResponseSender sender = new CollectingResponseSender();
        StreamOutcome outcome = stream(new TestingDataSource(5), 2, NoOpReadLimiter.INSTANCE, sender);

        assertEquals(outcome.getState(), StreamOutcome.State.COMPLETED);
        assertEquals(outcome.getStats().getRows(), 5);
        assertEquals(pageSizes(sender), ImmutableList.of(2, 2, 1));
        assertTrue(sender.getErrors().isEmpty());

        List<Object> lastRow = readRows(allocator, sender.getPages().get(2).getArrowIpcStreaming()).get(0);
        assertEquals(lastRow.get(0), 4L);
        assertEquals(lastRow.get(1).toString(), "row-4");
        for (ReadSplitsResponse page : sender.getPages()) {
            assertEquals(page.getSplitIndexNumber(), 0);
            assertTrue(page.getStats().getBytes() > 0);
        }
    }

    @Test
    public void testReadLimitExceeded()
    {
        CollectingResponseSender sender = new CollectingResponseSender();
        StreamOutcome outcome = stream(new TestingDataSource(10), 2, new RowCountReadLimiter(3), sender);

        assertEquals(outcome.getState(), StreamOutcome.State.FAILED);
        assertEquals(pageSizes(sender), ImmutableList.of(2));
        assertEquals(sender.getErrors().size(), 1);
        assertEquals(sender.getErrors().get(0).getStatus(), StatusCode.BAD_REQUEST);
        assertTrue(sender.getErrors().get(0).getMessage().contains("Read limit exceeded"), sender.getErrors().get(0).getMessage());

        // the error is the last response
        List<ReadSplitsResponse> responses = sender.getResponses();
        assertEquals(responses.get(responses.size() - 1).getError(), outcome.getError().get());
    }

    @Test
    public void testEmptySplit()
    {
        CollectingResponseSender sender = new CollectingResponseSender();
        StreamOutcome outcome = stream(new TestingDataSource(0), 2, NoOpReadLimiter.INSTANCE, sender);

        assertEquals(outcome.getState(), StreamOutcome.State.COMPLETED);
        assertEquals(pageSizes(sender), ImmutableList.of(0));
    }

    @Test
    public void testFailureIsTerminal()
    {
        CollectingResponseSender sender = new CollectingResponseSender();
        StreamOutcome outcome = stream(new TestingDataSource(10, OptionalLong.of(5)), 2, NoOpReadLimiter.INSTANCE, sender);

        assertEquals(outcome.getState(), StreamOutcome.State.FAILED);
        assertEquals(outcome.getStats().getRows(), 4);
        assertEquals(pageSizes(sender), ImmutableList.of(2, 2));
        List<ApiError> errors = sender.getErrors();
        assertEquals(errors.size(), 1);
        assertEquals(errors.get(0).getStatus(), StatusCode.INTERNAL_ERROR);
    }

    @Test(timeOut = 30_000)
    public void testCancellation()
            throws Exception
    {
        FederationConnectorStats stats = new FederationConnectorStats();
        TestingDataSource dataSource = new TestingDataSource(Long.MAX_VALUE);
        CollectingResponseSender sender = new CollectingResponseSender(2);
        StreamOutcome outcome = stream(dataSource, 2, NoOpReadLimiter.INSTANCE, sender, stats);

        assertEquals(outcome.getState(), StreamOutcome.State.CANCELED);
        assertEquals(sender.getPages().size(), 2);
        assertTrue(sender.getErrors().isEmpty());
        assertEquals(stats.getCanceledSplits().getTotalCount(), 1);

        // the reader has stopped by the time the split reports CANCELED
        assertTrue(dataSource.isReadFinished());
    }

    private StreamOutcome stream(DataSource dataSource, long rowsPerPage, ReadLimiter readLimiter, CollectingResponseSender sender)
    {
        return stream(dataSource, rowsPerPage, readLimiter, sender, new FederationConnectorStats());
    }

    private StreamOutcome stream(DataSource dataSource, long rowsPerPage, ReadLimiter readLimiter, CollectingResponseSender sender, FederationConnectorStats stats)
    {
        PagingConfig pagingConfig = new PagingConfig().setRowsPerPage(rowsPerPage);
        Split split = new Split(0, TestingDataSource.select(), new byte[0]);
        ReadSplitsRequest request = new ReadSplitsRequest(TestingDataSource.instance(), ImmutableList.of(split), ReadSplitsFormat.ARROW_IPC_STREAMING, Filtering.OPTIONAL);
        Sink sink = new Sink(
                new ColumnarBufferFactory(allocator, ReadSplitsFormat.ARROW_IPC_STREAMING, TestingRows.COLUMNS),
                new TrafficTracker(pagingConfig),
                readLimiter,
                pagingConfig.getPrefetchQueueCapacity());
        return new ReadSplitsStreamer(dataSource, "test-query", request, split, 0, sink, sender, executor, stats).run();
    }

    private List<Integer> pageSizes(CollectingResponseSender sender)
    {
        return sender.getPages().stream()
                .map(page -> countRows(allocator, page.getArrowIpcStreaming()))
                .collect(toImmutableList());
    }
}
