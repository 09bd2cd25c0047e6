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
import com.facebook.presto.federation.conversion.NativeKind;
import com.facebook.presto.federation.protocol.Column;
import com.facebook.presto.federation.protocol.PrimitiveTypeId;
import com.facebook.presto.federation.protocol.ReadSplitsFormat;
import com.facebook.presto.federation.protocol.WireType;
import com.google.common.collect.ImmutableList;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static com.facebook.presto.federation.client.ArrowIpcPages.countRows;
import static com.facebook.presto.federation.client.ArrowIpcPages.readRows;
import static com.facebook.presto.federation.client.ArrowIpcPages.readSchema;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.fail;

@Test(singleThreaded = true)
public class TestColumnarBuffer
{
    private BufferAllocator allocator;

    @BeforeClass
    public void setUp()
    {
        allocator = new RootAllocator(Long.MAX_VALUE);
    }

    @AfterClass(alwaysRun = true)
    public void tearDown()
    {
        allocator.close();
    }

    @Test
    public void testAllTypes()
    {
        List<Column> columns = ImmutableList.of(
                new Column("flag", WireType.optional(PrimitiveTypeId.BOOL)),
                new Column("small", WireType.optional(PrimitiveTypeId.INT8)),
                new Column("price", WireType.optional(WireType.decimal(10, 2))),
                new Column("day", WireType.optional(PrimitiveTypeId.DATE)),
                new Column("ts", WireType.optional(PrimitiveTypeId.TIMESTAMP)),
                new Column("payload", WireType.optional(PrimitiveTypeId.STRING)),
                new Column("note", WireType.optional(PrimitiveTypeId.UTF8)));
        List<Acceptor> acceptors = ImmutableList.of(
                new Acceptor(NativeKind.BOOLEAN),
                new Acceptor(NativeKind.LONG),
                new Acceptor(NativeKind.DECIMAL),
                new Acceptor(NativeKind.DATE),
                new Acceptor(NativeKind.TIMESTAMP),
                new Acceptor(NativeKind.BYTES),
                new Acceptor(NativeKind.STRING));
        RowTransformer transformer = DefaultRowTransformer.create(acceptors, columns, Optional.empty());

        ColumnarBufferFactory factory = new ColumnarBufferFactory(allocator, ReadSplitsFormat.ARROW_IPC_STREAMING, columns);
        byte[] page;
        try (ColumnarBuffer buffer = factory.createBuffer()) {
            acceptors.get(0).set(true);
            acceptors.get(1).set(5L);
            acceptors.get(2).set(new BigDecimal("12.345"));
            acceptors.get(3).set(LocalDate.of(2020, 1, 2));
            acceptors.get(4).set(LocalDateTime.of(1970, 1, 1, 0, 0, 1));
            acceptors.get(5).set("ab".getBytes(UTF_8));
            acceptors.get(6).set("hello");
            buffer.addRow(transformer);

            acceptors.forEach(Acceptor::setNull);
            // out of INT8 range, written as NULL without failing the row
            acceptors.get(1).set(300L);
            acceptors.get(6).set("second");
            buffer.addRow(transformer);

            assertEquals(buffer.getRowCount(), 2);
            page = buffer.seal();
        }

        assertEquals(readSchema(allocator, page), factory.getSchema());
        List<List<Object>> rows = readRows(allocator, page);
        assertEquals(rows.size(), 2);

        List<Object> first = rows.get(0);
        assertEquals(first.get(0), (byte) 1);
        assertEquals(first.get(1), (byte) 5);
        assertEquals(first.get(2), new BigDecimal("12.35"));
        assertEquals(first.get(3), (char) LocalDate.of(2020, 1, 2).toEpochDay());
        assertEquals(first.get(4), 1_000_000L);
        assertEquals((byte[]) first.get(5), "ab".getBytes(UTF_8));
        assertEquals(first.get(6).toString(), "hello");

        List<Object> second = rows.get(1);
        for (int i = 0; i < 6; i++) {
            assertNull(second.get(i), "column " + columns.get(i).getName());
        }
        assertEquals(second.get(6).toString(), "second");
    }

    @Test
    public void testUnsignedBigint()
    {
        List<Column> columns = ImmutableList.of(new Column("counter", WireType.optional(PrimitiveTypeId.UINT64)));
        List<Acceptor> acceptors = ImmutableList.of(new Acceptor(NativeKind.BIG_INTEGER));
        RowTransformer transformer = DefaultRowTransformer.create(acceptors, columns, Optional.empty());

        byte[] page;
        try (ColumnarBuffer buffer = new ColumnarBufferFactory(allocator, ReadSplitsFormat.ARROW_IPC_STREAMING, columns).createBuffer()) {
            acceptors.get(0).set(new BigInteger("18446744073709551615"));
            buffer.addRow(transformer);
            acceptors.get(0).set(BigInteger.ONE.shiftLeft(64));
            buffer.addRow(transformer);
            page = buffer.seal();
        }

        List<List<Object>> rows = readRows(allocator, page);
        assertEquals(Long.toUnsignedString((Long) rows.get(0).get(0)), "18446744073709551615");
        assertNull(rows.get(1).get(0));
    }

    @Test
    public void testReorderedColumns()
    {
        List<Column> columns = ImmutableList.of(TestingRows.COLUMNS.get(1), TestingRows.COLUMNS.get(0));
        TestingRows rows = new TestingRows(columns);
        byte[] page;
        try (ColumnarBuffer buffer = new ColumnarBufferFactory(allocator, ReadSplitsFormat.ARROW_IPC_STREAMING, columns).createBuffer()) {
            buffer.addRow(rows.row(1));
            page = buffer.seal();
        }

        List<Object> row = readRows(allocator, page).get(0);
        assertEquals(row.get(0).toString(), "row-1");
        assertEquals(row.get(1), 1L);
    }

    @Test
    public void testEmptyColumns()
    {
        TestingRows rows = new TestingRows(ImmutableList.of());
        ColumnarBufferFactory factory = new ColumnarBufferFactory(allocator, ReadSplitsFormat.ARROW_IPC_STREAMING, ImmutableList.of());
        byte[] page;
        try (ColumnarBuffer buffer = factory.createBuffer()) {
            assertTrue(buffer instanceof EmptyColumnsBuffer);
            for (int i = 0; i < 3; i++) {
                buffer.addRow(rows.row(i));
            }
            page = buffer.seal();
        }

        assertEquals(readSchema(allocator, page).getFields().size(), 0);
        assertEquals(countRows(allocator, page), 3);
    }

    @Test
    public void testColumnSetFormatRejected()
    {
        try {
            new ColumnarBufferFactory(allocator, ReadSplitsFormat.COLUMN_SET, TestingRows.COLUMNS);
            fail("expected COLUMN_SET to be rejected");
        }
        catch (FederationException e) {
            assertEquals(e.getErrorCode(), FederationErrorCode.INVALID_REQUEST);
        }
    }

    @Test
    public void testUnsupportedConversion()
    {
        try {
            Appenders.forColumn(NativeKind.BYTES, WireType.optional(PrimitiveTypeId.INT32));
            fail("expected the conversion to be unsupported");
        }
        catch (FederationException e) {
            assertEquals(e.getErrorCode(), FederationErrorCode.DATA_TYPE_NOT_SUPPORTED);
        }
    }
}
