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

import com.google.common.collect.ImmutableList;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowStreamReader;
import org.apache.arrow.vector.types.pojo.Schema;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Decodes the Arrow IPC streaming pages found in read responses.
 */
public final class ArrowIpcPages
{
    private ArrowIpcPages()
    {
    }

    public static Schema readSchema(BufferAllocator allocator, byte[] page)
    {
        try (ArrowStreamReader reader = new ArrowStreamReader(new ByteArrayInputStream(page), allocator)) {
            return reader.getVectorSchemaRoot().getSchema();
        }
        catch (IOException e) {
            throw new UncheckedIOException("Error reading page schema", e);
        }
    }

    /**
     * Materializes every row of the page, using {@link FieldVector#getObject(int)} for the values.
     */
    public static List<List<Object>> readRows(BufferAllocator allocator, byte[] page)
    {
        ImmutableList.Builder<List<Object>> rows = ImmutableList.builder();
        try (ArrowStreamReader reader = new ArrowStreamReader(new ByteArrayInputStream(page), allocator)) {
            VectorSchemaRoot root = reader.getVectorSchemaRoot();
            while (reader.loadNextBatch()) {
                for (int position = 0; position < root.getRowCount(); position++) {
                    List<Object> row = new ArrayList<>(root.getFieldVectors().size());
                    for (FieldVector vector : root.getFieldVectors()) {
                        row.add(vector.getObject(position));
                    }
                    rows.add(Collections.unmodifiableList(row));
                }
            }
        }
        catch (IOException e) {
            throw new UncheckedIOException("Error reading page rows", e);
        }
        return rows.build();
    }

    public static int countRows(BufferAllocator allocator, byte[] page)
    {
        int rows = 0;
        try (ArrowStreamReader reader = new ArrowStreamReader(new ByteArrayInputStream(page), allocator)) {
            while (reader.loadNextBatch()) {
                rows += reader.getVectorSchemaRoot().getRowCount();
            }
        }
        catch (IOException e) {
            throw new UncheckedIOException("Error counting page rows", e);
        }
        return rows;
    }
}
