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
package com.facebook.presto.federation.datasource.jdbc;

import com.facebook.presto.federation.conversion.NativeKind;
import com.facebook.presto.federation.protocol.DateTimeFormat;
import com.facebook.presto.federation.protocol.DecimalWireType;
import com.facebook.presto.federation.protocol.PrimitiveTypeId;
import com.facebook.presto.federation.protocol.WireType;

import java.sql.Types;
import java.util.Optional;

import static com.facebook.presto.federation.protocol.DateTimeFormat.STRING_FORMAT;
import static java.util.Objects.requireNonNull;

/**
 * Maps JDBC column types to wire types for DescribeTable and to the native kinds the result set is read as.
 * Relational columns are always nullable, so every wire type is optional.
 */
public class JdbcTypeMapper
{
    private final SqlDialect dialect;

    public JdbcTypeMapper(SqlDialect dialect)
    {
        this.dialect = requireNonNull(dialect, "dialect is null");
    }

    public Optional<WireType> toWireType(int jdbcType, String typeName, int precision, int scale, DateTimeFormat dateTimeFormat)
    {
        Optional<PrimitiveTypeId> vendorType = dialect.getVendorType(typeName);
        if (vendorType.isPresent()) {
            return Optional.of(WireType.optional(vendorType.get()));
        }

        switch (jdbcType) {
            case Types.BIT:
            case Types.BOOLEAN:
                return optional(PrimitiveTypeId.BOOL);
            case Types.TINYINT:
                return optional(PrimitiveTypeId.INT8);
            case Types.SMALLINT:
                return optional(PrimitiveTypeId.INT16);
            case Types.INTEGER:
                return optional(PrimitiveTypeId.INT32);
            case Types.BIGINT:
                return optional(PrimitiveTypeId.INT64);
            case Types.REAL:
                return optional(PrimitiveTypeId.FLOAT);
            case Types.FLOAT:
            case Types.DOUBLE:
                return optional(PrimitiveTypeId.DOUBLE);
            case Types.DECIMAL:
            case Types.NUMERIC:
                if (precision <= 0 || precision > DecimalWireType.MAX_PRECISION || scale < 0 || scale > precision) {
                    return Optional.empty();
                }
                return Optional.of(WireType.optional(WireType.decimal(precision, scale)));
            case Types.CHAR:
            case Types.VARCHAR:
            case Types.LONGVARCHAR:
            case Types.NCHAR:
            case Types.NVARCHAR:
            case Types.LONGNVARCHAR:
            case Types.CLOB:
                return optional(PrimitiveTypeId.UTF8);
            case Types.BINARY:
            case Types.VARBINARY:
            case Types.LONGVARBINARY:
            case Types.BLOB:
                return optional(PrimitiveTypeId.STRING);
            case Types.DATE:
                return optional(dateTimeFormat == STRING_FORMAT ? PrimitiveTypeId.UTF8 : PrimitiveTypeId.DATE);
            case Types.TIMESTAMP:
                return optional(dateTimeFormat == STRING_FORMAT ? PrimitiveTypeId.UTF8 : PrimitiveTypeId.TIMESTAMP);
            default:
                return Optional.empty();
        }
    }

    public Optional<NativeKind> toNativeKind(int jdbcType, String typeName)
    {
        Optional<PrimitiveTypeId> vendorType = dialect.getVendorType(typeName);
        if (vendorType.isPresent()) {
            switch (vendorType.get()) {
                case STRING:
                    return Optional.of(NativeKind.BYTES);
                case UINT8:
                case UINT16:
                case UINT32:
                    return Optional.of(NativeKind.LONG);
                case UINT64:
                    return Optional.of(NativeKind.BIG_INTEGER);
                default:
                    return Optional.of(NativeKind.STRING);
            }
        }

        switch (jdbcType) {
            case Types.BIT:
            case Types.BOOLEAN:
                return Optional.of(NativeKind.BOOLEAN);
            case Types.TINYINT:
                return Optional.of(NativeKind.BYTE);
            case Types.SMALLINT:
                return Optional.of(NativeKind.SHORT);
            case Types.INTEGER:
                return Optional.of(NativeKind.INT);
            case Types.BIGINT:
                return Optional.of(NativeKind.LONG);
            case Types.REAL:
                return Optional.of(NativeKind.FLOAT);
            case Types.FLOAT:
            case Types.DOUBLE:
                return Optional.of(NativeKind.DOUBLE);
            case Types.DECIMAL:
            case Types.NUMERIC:
                return Optional.of(NativeKind.DECIMAL);
            case Types.CHAR:
            case Types.VARCHAR:
            case Types.LONGVARCHAR:
            case Types.NCHAR:
            case Types.NVARCHAR:
            case Types.LONGNVARCHAR:
            case Types.CLOB:
                return Optional.of(NativeKind.STRING);
            case Types.BINARY:
            case Types.VARBINARY:
            case Types.LONGVARBINARY:
            case Types.BLOB:
                return Optional.of(NativeKind.BYTES);
            case Types.DATE:
                return Optional.of(NativeKind.DATE);
            case Types.TIMESTAMP:
                return Optional.of(NativeKind.TIMESTAMP);
            default:
                return Optional.empty();
        }
    }

    private static Optional<WireType> optional(PrimitiveTypeId typeId)
    {
        return Optional.of(WireType.optional(typeId));
    }
}
