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

import com.facebook.presto.federation.conversion.ValueConverter;
import com.facebook.presto.federation.conversion.ValueOutOfTypeBoundsException;
import org.apache.arrow.vector.FieldVector;

import static java.util.Objects.requireNonNull;

/**
 * Converts the acceptor value to its wire representation and writes it into the column vector.
 * Values outside the wire type domain are written as NULL; the rest of the row is unaffected.
 */
public class ConvertingAppender
        implements Appender
{
    private final ValueConverter<Object, Object> converter;
    private final ArrowColumnWriter writer;

    public ConvertingAppender(ValueConverter<Object, Object> converter, ArrowColumnWriter writer)
    {
        this.converter = requireNonNull(converter, "converter is null");
        this.writer = requireNonNull(writer, "writer is null");
    }

    @Override
    public void append(Acceptor acceptor, FieldVector vector, int position)
    {
        if (acceptor.isNull()) {
            writer.writeNull(vector, position);
            return;
        }

        Object value;
        try {
            value = converter.convert(acceptor.get());
        }
        catch (ValueOutOfTypeBoundsException e) {
            writer.writeNull(vector, position);
            return;
        }
        writer.write(vector, position, value);
    }
}
