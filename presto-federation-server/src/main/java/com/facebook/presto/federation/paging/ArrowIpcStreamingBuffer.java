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

import com.facebook.presto.federation.FederationException;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowStreamWriter;
import org.apache.arrow.vector.types.pojo.Schema;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.channels.Channels;

import static com.facebook.presto.federation.FederationErrorCode.GENERIC_INTERNAL_ERROR;
import static com.google.common.base.Preconditions.checkState;

/**
 * Accumulates rows in Arrow vectors and seals them as an Arrow IPC stream: schema message, one record batch, end of stream.
 */
public class ArrowIpcStreamingBuffer
        implements ColumnarBuffer
{
    private final VectorSchemaRoot root;
    private int rowCount;
    private boolean sealed;

    public ArrowIpcStreamingBuffer(BufferAllocator allocator, Schema schema)
    {
        this.root = VectorSchemaRoot.create(schema, allocator);
        root.allocateNew();
    }

    @Override
    public void addRow(RowTransformer transformer)
    {
        checkState(!sealed, "buffer is sealed");
        transformer.appendToArrowVectors(root.getFieldVectors(), rowCount);
        rowCount++;
    }

    @Override
    public int getRowCount()
    {
        return rowCount;
    }

    @Override
    public byte[] seal()
    {
        checkState(!sealed, "buffer is already sealed");
        sealed = true;
        return writeIpcStream(root, rowCount);
    }

    @Override
    public void close()
    {
        root.close();
    }

    static byte[] writeIpcStream(VectorSchemaRoot root, int rowCount)
    {
        root.setRowCount(rowCount);
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        try (ArrowStreamWriter writer = new ArrowStreamWriter(root, null, Channels.newChannel(output))) {
            writer.start();
            writer.writeBatch();
            writer.end();
        }
        catch (IOException e) {
            throw new FederationException(GENERIC_INTERNAL_ERROR, "Failed to serialize page", e);
        }
        return output.toByteArray();
    }
}
