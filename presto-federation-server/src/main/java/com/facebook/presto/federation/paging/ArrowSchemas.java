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

import com.facebook.presto.federation.protocol.Column;
import com.facebook.presto.federation.protocol.DecimalWireType;
import com.facebook.presto.federation.protocol.OptionalWireType;
import com.facebook.presto.federation.protocol.PrimitiveWireType;
import com.facebook.presto.federation.protocol.StructWireType;
import com.facebook.presto.federation.protocol.TaggedWireType;
import com.facebook.presto.federation.protocol.WireType;
import com.facebook.presto.federation.protocol.WireTypeVisitor;
import com.google.common.collect.ImmutableList;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.apache.arrow.vector.types.pojo.Schema;

import java.util.List;

import static com.google.common.collect.ImmutableList.toImmutableList;

/**
 * Maps wire types to Arrow fields.
 * Every field is nullable because out-of-bounds values are emitted as NULL even for non-optional columns.
 */
public final class ArrowSchemas
{
    private ArrowSchemas()
    {
    }

    public static Schema toArrowSchema(List<Column> columns)
    {
        return new Schema(columns.stream()
                .map(column -> toArrowField(column.getName(), column.getType()))
                .collect(toImmutableList()));
    }

    public static Field toArrowField(String name, WireType type)
    {
        WireType unwrapped = type.unwrap();
        List<Field> children = ImmutableList.of();
        if (unwrapped instanceof StructWireType) {
            children = ((StructWireType) unwrapped).getMembers().stream()
                    .map(member -> toArrowField(member.getName(), member.getType()))
                    .collect(toImmutableList());
        }
        return new Field(name, FieldType.nullable(unwrapped.accept(ArrowTypeVisitor.INSTANCE)), children);
    }

    private static class ArrowTypeVisitor
            implements WireTypeVisitor<ArrowType>
    {
        private static final ArrowTypeVisitor INSTANCE = new ArrowTypeVisitor();

        @Override
        public ArrowType visitPrimitive(PrimitiveWireType type)
        {
            switch (type.getTypeId()) {
                case BOOL:
                case UINT8:
                    return new ArrowType.Int(8, false);
                case INT8:
                    return new ArrowType.Int(8, true);
                case INT16:
                    return new ArrowType.Int(16, true);
                case UINT16:
                case DATE:
                    return new ArrowType.Int(16, false);
                case INT32:
                    return new ArrowType.Int(32, true);
                case UINT32:
                case DATETIME:
                    return new ArrowType.Int(32, false);
                case INT64:
                    return new ArrowType.Int(64, true);
                case UINT64:
                case TIMESTAMP:
                    return new ArrowType.Int(64, false);
                case FLOAT:
                    return new ArrowType.FloatingPoint(FloatingPointPrecision.SINGLE);
                case DOUBLE:
                    return new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE);
                case STRING:
                    return ArrowType.Binary.INSTANCE;
                case UTF8:
                case JSON:
                    return ArrowType.Utf8.INSTANCE;
                default:
                    throw new IllegalArgumentException("Unsupported primitive type: " + type);
            }
        }

        @Override
        public ArrowType visitOptional(OptionalWireType type)
        {
            return type.getItem().accept(this);
        }

        @Override
        public ArrowType visitTagged(TaggedWireType type)
        {
            return type.getType().accept(this);
        }

        @Override
        public ArrowType visitStruct(StructWireType type)
        {
            return ArrowType.Struct.INSTANCE;
        }

        @Override
        public ArrowType visitDecimal(DecimalWireType type)
        {
            return new ArrowType.Decimal(type.getPrecision(), type.getScale(), 128);
        }
    }
}
