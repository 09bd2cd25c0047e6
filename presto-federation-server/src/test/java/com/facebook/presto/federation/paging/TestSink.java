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

import com.facebook.presto.federation.FederationErrorCode;
import com.facebook.presto.federation.FederationException;
import com.facebook.presto.federation.protocol.ReadSplitsFormat;
import com.facebook.presto.federation.protocol.Stats;
import com.google.common.collect.ImmutableList;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.types.pojo.Field;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import static com.facebook.airlift.concurrent.Threads.daemonThreadsNamed;
import static com.facebook.presto.federation.client.ArrowIpcPages.readRows;
import static com.facebook.presto.federation.client.ArrowIpcPages.readSchema;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.concurrent.Executors.newCachedThreadPool;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertThrows;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

@Test(singleThreaded = true)
public class TestSink
{
    private BufferAllocator allocator;
    private ExecutorService executor;

    @BeforeClass
    public void setUp()
    {
        allocator = new RootAllocator(Long.MAX_VALUE);
        executor = newCachedThreadPool(daemonThreadsNamed("test-sink-%s"));
    }

    @AfterClass(alwaysRun = true)
    public void tearDown()
    {
        executor.shutdownNow();
        allocator.close();
    }

    @Test
    public void testPagesPrecedeTerminalResult()
            throws Exception
    {
        Sink sink = createSink(new PagingConfig().setRowsPerPage(2), NoOpReadLimiter.INSTANCE, 10);
        TestingRows rows = new TestingRows();
        for (int i = 0; i < 5; i++) {
            sink.addRow(rows.row(i));
        }
        sink.finish();

        ReadResult first = sink.next();
        assertEquals(first.getStats().getRows(), 2);
        assertEquals(readRows(allocator, first.getPage()).stream().map(row -> row.get(0)).collect(toImmutableList()), ImmutableList.of(0L, 1L));
        assertEquals(sink.next().getStats().getRows(), 2);
        ReadResult last = sink.next();
        assertEquals(last.getStats().getRows(), 1);
        assertEquals(readRows(allocator, last.getPage()).get(0).get(1).toString(), "row-4");

        ReadResult terminal = sink.next();
        assertTrue(terminal.isTerminal());
        assertFalse(terminal.getError().isPresent());
        assertEquals(sink.getTotalStats().getRows(), 5);
    }

    @Test
    public void testEmptySplitYieldsSchemaPage()
            throws Exception
    {
        Sink sink = createSink(new PagingConfig(), NoOpReadLimiter.INSTANCE, 2);
        sink.finish();

        ReadResult page = sink.next();
        assertFalse(page.isTerminal());
        assertEquals(page.getStats(), Stats.empty());
        assertEquals(readRows(allocator, page.getPage()).size(), 0);
        List<String> fields = readSchema(allocator, page.getPage()).getFields().stream().map(Field::getName).collect(toImmutableList());
        assertEquals(fields, ImmutableList.of("id", "name"));
        assertTrue(sink.next().isTerminal());
    }

    @Test
    public void testFailureDiscardsUnsealedRows()
            throws Exception
    {
        Sink sink = createSink(new PagingConfig().setRowsPerPage(2), NoOpReadLimiter.INSTANCE, 10);
        TestingRows rows = new TestingRows();
        for (int i = 0; i < 3; i++) {
            sink.addRow(rows.row(i));
        }
        sink.fail(new IllegalStateException("backend went away"));

        assertEquals(sink.next().getStats().getRows(), 2);
        ReadResult terminal = sink.next();
        assertTrue(terminal.isTerminal());
        assertEquals(terminal.getError().get().getMessage(), "backend went away");
        assertNull(sink.poll(100, MILLISECONDS));
    }

    @Test
    public void testReadLimit()
    {
        Sink sink = createSink(new PagingConfig(), new RowCountReadLimiter(3), 10);
        TestingRows rows = new TestingRows();
        sink.addRow(rows.row(1));
        sink.addRow(rows.row(2));
        sink.addRow(rows.row(3));
        try {
            sink.addRow(rows.row(4));
            fail("expected the read limit to be exceeded");
        }
        catch (FederationException e) {
            assertEquals(e.getErrorCode(), FederationErrorCode.READ_LIMIT_EXCEEDED);
            sink.fail(e);
        }
        sink.close();
    }

    @Test
    public void testClose()
    {
        Sink sink = createSink(new PagingConfig(), NoOpReadLimiter.INSTANCE, 2);
        TestingRows rows = new TestingRows();
        sink.addRow(rows.row(1));
        sink.close();
        sink.close();
        assertTrue(sink.isClosed());

        assertThrows(CancellationException.class, () -> sink.addRow(rows.row(2)));
        sink.fail(new RuntimeException("ignored after close"));
    }

    @Test(timeOut = 10_000)
    public void testCloseReleasesBlockedProducer()
            throws Exception
    {
        Sink sink = createSink(new PagingConfig().setRowsPerPage(1), NoOpReadLimiter.INSTANCE, 1);
        TestingRows rows = new TestingRows();
        Future<?> producer = executor.submit(() -> {
            for (int i = 0; i < 100; i++) {
                sink.addRow(rows.row(i));
            }
            sink.finish();
        });

        assertEquals(sink.next().getStats().getRows(), 1);
        sink.close();
        try {
            producer.get(5, SECONDS);
            fail("expected the producer to be canceled");
        }
        catch (ExecutionException e) {
            assertTrue(e.getCause() instanceof CancellationException, "unexpected failure: " + e.getCause());
        }
    }

    private Sink createSink(PagingConfig config, ReadLimiter readLimiter, int capacity)
    {
        return new Sink(
                new ColumnarBufferFactory(allocator, ReadSplitsFormat.ARROW_IPC_STREAMING, TestingRows.COLUMNS),
                new TrafficTracker(config),
                readLimiter,
                capacity);
    }
}
