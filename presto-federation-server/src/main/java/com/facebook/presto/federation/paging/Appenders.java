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
import com.facebook.presto.federation.conversion.NativeKind;
import com.facebook.presto.federation.conversion.ValueConverter;
import com.facebook.presto.federation.conversion.ValueConverters;
import com.facebook.presto.federation.protocol.DecimalWireType;
import com.facebook.presto.federation.protocol.PrimitiveWireType;
import com.facebook.presto.federation.protocol.WireType;
import com.google.common.collect.ImmutableSet;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Set;

import static com.facebook.presto.federation.FederationErrorCode.DATA_TYPE_NOT_SUPPORTED;
import static java.lang.String.format;

public final class Appenders
{
    private static final Set<NativeKind> INTEGRAL_KINDS = ImmutableSet.of(NativeKind.BYTE, NativeKind.SHORT, NativeKind.INT, NativeKind.LONG);

    private Appenders()
    {
    }

    /**
     * Binds the appender for a column whose values are scanned as {@code nativeKind} and sent as {@code wireType}.
     *
     * @throws FederationException with {@code DATA_TYPE_NOT_SUPPORTED} when no conversion exists for the pair
     */
    public static Appender forColumn(NativeKind nativeKind, WireType wireType)
    {
        return new ConvertingAppender(converter(nativeKind, wireType), ArrowColumnWriter.forWireType(wireType));
    }

    private static ValueConverter<Object, Object> converter(NativeKind nativeKind, WireType wireType)
    {
        WireType type = wireType.unwrap();
        if (type instanceof PrimitiveWireType) {
            return ValueConverters.getConverter(nativeKind, ((PrimitiveWireType) type).getTypeId())
                    .orElseThrow(() -> unsupported(nativeKind, wireType));
        }
        if (type instanceof DecimalWireType) {
            DecimalWireType decimalType = (DecimalWireType) type;
            ValueConverter<Object, Object> decimal = ValueConverters.decimal(decimalType.getPrecision(), decimalType.getScale());
            if (nativeKind == NativeKind.DECIMAL) {
                return decimal;
            }
            if (nativeKind == NativeKind.BIG_INTEGER) {
                return value -> decimal.convert(new BigDecimal((BigInteger) value));
            }
            if (INTEGRAL_KINDS.contains(nativeKind)) {
                return value -> decimal.convert(BigDecimal.valueOf(((Number) value).longValue()));
            }
        }
        throw unsupported(nativeKind, wireType);
    }

    private static FederationException unsupported(NativeKind nativeKind, WireType wireType)
    {
        return new FederationException(DATA_TYPE_NOT_SUPPORTED, format("Cannot convert %s values to %s", nativeKind, wireType));
    }
}
