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
import com.facebook.presto.federation.protocol.DecimalWireType;
import com.facebook.presto.federation.protocol.PrimitiveTypeId;
import com.facebook.presto.federation.protocol.PrimitiveWireType;
import com.facebook.presto.federation.protocol.WireType;
import org.apache.arrow.vector.BaseFixedWidthVector;
import org.apache.arrow.vector.BaseVariableWidthVector;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.DecimalVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.SmallIntVector;
import org.apache.arrow.vector.TinyIntVector;
import org.apache.arrow.vector.UInt1Vector;
import org.apache.arrow.vector.UInt2Vector;
import org.apache.arrow.vector.UInt4Vector;
import org.apache.arrow.vector.UInt8Vector;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VarCharVector;

import java.math.BigDecimal;

import static com.facebook.presto.federation.FederationErrorCode.DATA_TYPE_NOT_SUPPORTED;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Writes already converted wire values into the Arrow vector of a column.
 * Writers are stateless; the vector is passed on every call so one writer serves every page of a split.
 */
public abstract class ArrowColumnWriter
{
    public abstract void write(FieldVector vector, int position, Object value);

    public abstract void writeNull(FieldVector vector, int position);

    public static ArrowColumnWriter forWireType(WireType wireType)
    {
        WireType type = wireType.unwrap();
        if (type instanceof DecimalWireType) {
            return new DecimalWriter();
        }
        if (!(type instanceof PrimitiveWireType)) {
            throw new FederationException(DATA_TYPE_NOT_SUPPORTED, "Unsupported column type: " + wireType);
        }
        PrimitiveTypeId typeId = ((PrimitiveWireType) type).getTypeId();
        switch (typeId) {
            case BOOL:
            case UINT8:
                return new UInt1Writer();
            case INT8:
                return new TinyIntWriter();
            case INT16:
                return new SmallIntWriter();
            case UINT16:
            case DATE:
                return new UInt2Writer();
            case INT32:
                return new IntWriter();
            case UINT32:
            case DATETIME:
                return new UInt4Writer();
            case INT64:
                return new BigIntWriter();
            case UINT64:
            case TIMESTAMP:
                return new UInt8Writer();
            case FLOAT:
                return new RealWriter();
            case DOUBLE:
                return new DoubleWriter();
            case STRING:
                return new VarBinaryWriter();
            case UTF8:
            case JSON:
                return new VarCharWriter();
            default:
                throw new FederationException(DATA_TYPE_NOT_SUPPORTED, "Unsupported column type: " + wireType);
        }
    }

    private abstract static class FixedWidthWriter
            extends ArrowColumnWriter
    {
        @Override
        public void writeNull(FieldVector vector, int position)
        {
            ((BaseFixedWidthVector) vector).setNull(position);
        }
    }

    private abstract static class VariableWidthWriter
            extends ArrowColumnWriter
    {
        @Override
        public void writeNull(FieldVector vector, int position)
        {
            ((BaseVariableWidthVector) vector).setNull(position);
        }
    }

    private static class UInt1Writer
            extends FixedWidthWriter
    {
        @Override
        public void write(FieldVector vector, int position, Object value)
        {
            ((UInt1Vector) vector).setSafe(position, (int) (long) (Long) value);
        }
    }

    private static class TinyIntWriter
            extends FixedWidthWriter
    {
        @Override
        public void write(FieldVector vector, int position, Object value)
        {
            ((TinyIntVector) vector).setSafe(position, (int) (long) (Long) value);
        }
    }

    private static class UInt2Writer
            extends FixedWidthWriter
    {
        @Override
        public void write(FieldVector vector, int position, Object value)
        {
            ((UInt2Vector) vector).setSafe(position, (int) (long) (Long) value);
        }
    }

    private static class SmallIntWriter
            extends FixedWidthWriter
    {
        @Override
        public void write(FieldVector vector, int position, Object value)
        {
            ((SmallIntVector) vector).setSafe(position, (int) (long) (Long) value);
        }
    }

    private static class UInt4Writer
            extends FixedWidthWriter
    {
        @Override
        public void write(FieldVector vector, int position, Object value)
        {
            // unsigned 32 bit values are range checked by the converter, keep the low bits
            ((UInt4Vector) vector).setSafe(position, (int) (long) (Long) value);
        }
    }

    private static class IntWriter
            extends FixedWidthWriter
    {
        @Override
        public void write(FieldVector vector, int position, Object value)
        {
            ((IntVector) vector).setSafe(position, (int) (long) (Long) value);
        }
    }

    private static class UInt8Writer
            extends FixedWidthWriter
    {
        @Override
        public void write(FieldVector vector, int position, Object value)
        {
            ((UInt8Vector) vector).setSafe(position, (Long) value);
        }
    }

    private static class BigIntWriter
            extends FixedWidthWriter
    {
        @Override
        public void write(FieldVector vector, int position, Object value)
        {
            ((BigIntVector) vector).setSafe(position, (Long) value);
        }
    }

    private static class RealWriter
            extends FixedWidthWriter
    {
        @Override
        public void write(FieldVector vector, int position, Object value)
        {
            ((Float4Vector) vector).setSafe(position, (Float) value);
        }
    }

    private static class DoubleWriter
            extends FixedWidthWriter
    {
        @Override
        public void write(FieldVector vector, int position, Object value)
        {
            ((Float8Vector) vector).setSafe(position, (Double) value);
        }
    }

    private static class DecimalWriter
            extends FixedWidthWriter
    {
        @Override
        public void write(FieldVector vector, int position, Object value)
        {
            ((DecimalVector) vector).setSafe(position, (BigDecimal) value);
        }
    }

    private static class VarBinaryWriter
            extends VariableWidthWriter
    {
        @Override
        public void write(FieldVector vector, int position, Object value)
        {
            ((VarBinaryVector) vector).setSafe(position, (byte[]) value);
        }
    }

    private static class VarCharWriter
            extends VariableWidthWriter
    {
        @Override
        public void write(FieldVector vector, int position, Object value)
        {
            ((VarCharVector) vector).setSafe(position, ((String) value).getBytes(UTF_8));
        }
    }
}
