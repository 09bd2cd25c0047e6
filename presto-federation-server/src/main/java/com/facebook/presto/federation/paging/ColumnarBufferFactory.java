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
import com.facebook.presto.federation.protocol.Column;
import com.facebook.presto.federation.protocol.ReadSplitsFormat;
import com.google.common.collect.ImmutableList;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.types.pojo.Schema;

import java.util.List;

import static com.facebook.presto.federation.FederationErrorCode.INVALID_REQUEST;
import static com.facebook.presto.federation.protocol.ReadSplitsFormat.ARROW_IPC_STREAMING;
import static java.util.Objects.requireNonNull;

/**
 * Creates page buffers for one split read, keyed by the response format and the requested columns.
 */
public class ColumnarBufferFactory
{
    private final BufferAllocator allocator;
    private final List<Column> columns;
    private final Schema schema;

    public ColumnarBufferFactory(BufferAllocator allocator, ReadSplitsFormat format, List<Column> columns)
    {
        this.allocator = requireNonNull(allocator, "allocator is null");
        requireNonNull(format, "format is null");
        if (format != ARROW_IPC_STREAMING) {
            throw new FederationException(INVALID_REQUEST, "Unsupported read splits format: " + format);
        }
        this.columns = ImmutableList.copyOf(requireNonNull(columns, "columns is null"));
        this.schema = ArrowSchemas.toArrowSchema(columns);
    }

    public ColumnarBuffer createBuffer()
    {
        if (columns.isEmpty()) {
            return new EmptyColumnsBuffer(allocator);
        }
        return new ArrowIpcStreamingBuffer(allocator, schema);
    }

    public Schema getSchema()
    {
        return schema;
    }
}
