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

import com.google.common.collect.ImmutableList;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Schema;

import static com.google.common.base.Preconditions.checkState;

/**
 * Buffer for selects without columns, such as {@code count(*)} scans. Only the row count travels.
 */
public class EmptyColumnsBuffer
        implements ColumnarBuffer
{
    private final VectorSchemaRoot root;
    private int rowCount;
    private boolean sealed;

    public EmptyColumnsBuffer(BufferAllocator allocator)
    {
        this.root = VectorSchemaRoot.create(new Schema(ImmutableList.of()), allocator);
    }

    @Override
    public void addRow(RowTransformer transformer)
    {
        checkState(!sealed, "buffer is sealed");
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
        return ArrowIpcStreamingBuffer.writeIpcStream(root, rowCount);
    }

    @Override
    public void close()
    {
        root.close();
    }
}
