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
package com.facebook.presto.federation.conversion;

import com.facebook.presto.federation.protocol.PrimitiveTypeId;
import com.google.common.collect.ImmutableMap;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import static com.facebook.presto.federation.protocol.PrimitiveTypeId.BOOL;
import static com.facebook.presto.federation.protocol.PrimitiveTypeId.DATE;
import static com.facebook.presto.federation.protocol.PrimitiveTypeId.DATETIME;
import static com.facebook.presto.federation.protocol.PrimitiveTypeId.DOUBLE;
import static com.facebook.presto.federation.protocol.PrimitiveTypeId.FLOAT;
import static com.facebook.presto.federation.protocol.PrimitiveTypeId.INT16;
import static com.facebook.presto.federation.protocol.PrimitiveTypeId.INT32;
import static com.facebook.presto.federation.protocol.PrimitiveTypeId.INT64;
import static com.facebook.presto.federation.protocol.PrimitiveTypeId.INT8;
import static com.facebook.presto.federation.protocol.PrimitiveTypeId.JSON;
import static com.facebook.presto.federation.protocol.PrimitiveTypeId.STRING;
import static com.facebook.presto.federation.protocol.PrimitiveTypeId.TIMESTAMP;
import static com.facebook.presto.federation.protocol.PrimitiveTypeId.UINT16;
import static com.facebook.presto.federation.protocol.PrimitiveTypeId.UINT32;
import static com.facebook.presto.federation.protocol.PrimitiveTypeId.UINT64;
import static com.facebook.presto.federation.protocol.PrimitiveTypeId.UINT8;
import static com.facebook.presto.federation.protocol.PrimitiveTypeId.UTF8;
import static java.lang.String.format;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.time.ZoneOffset.UTC;
import static java.time.temporal.ChronoField.NANO_OF_SECOND;

/**
 * Conversion table keyed by (native kind, wire primitive).
 * <p>
 * Integral and temporal wire values are produced as {@link Long}, {@code FLOAT} as {@link Float},
 * {@code DOUBLE} as {@link Double}, {@code STRING} as {@code byte[]} and {@code UTF8}/{@code JSON} as {@link String}.
 */
public final class ValueConverters
{
    public static final LocalDateTime MIN_TIME = LocalDateTime.of(1970, 1, 1, 0, 0);
    public static final LocalDateTime MAX_TIME = LocalDateTime.of(2106, 1, 1, 0, 0);

    private static final BigInteger MAX_UINT64 = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);
    private static final BigInteger MIN_INT64 = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger MAX_INT64 = BigInteger.valueOf(Long.MAX_VALUE);

    private static final LocalDate MIN_DATE = MIN_TIME.toLocalDate();
    private static final LocalDate MAX_DATE = MAX_TIME.toLocalDate();

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd'T'HH:mm:ss")
            .appendFraction(NANO_OF_SECOND, 0, 9, true)
            .appendLiteral('Z')
            .toFormatter();

    private static final Map<NativeKind, Map<PrimitiveTypeId, ValueConverter<Object, Object>>> CONVERTERS = createConverters();

    private ValueConverters()
    {
    }

    public static Optional<ValueConverter<Object, Object>> getConverter(NativeKind nativeKind, PrimitiveTypeId wireType)
    {
        return Optional.ofNullable(CONVERTERS.get(nativeKind).get(wireType));
    }

    public static ValueConverter<Object, Object> decimal(int precision, int scale)
    {
        return value -> {
            BigDecimal decimal = ((BigDecimal) value).setScale(scale, RoundingMode.HALF_UP);
            if (decimal.precision() > precision) {
                throw new ValueOutOfTypeBoundsException(format("Value %s does not fit Decimal(%s, %s)", value, precision, scale));
            }
            return decimal;
        };
    }

    public static long toDate(LocalDate value)
            throws ValueOutOfTypeBoundsException
    {
        if (value.isBefore(MIN_DATE) || !value.isBefore(MAX_DATE)) {
            throw new ValueOutOfTypeBoundsException(format("Date %s is out of [%s, %s)", value, MIN_DATE, MAX_DATE));
        }
        return value.toEpochDay();
    }

    public static long toDatetime(LocalDateTime value)
            throws ValueOutOfTypeBoundsException
    {
        checkTimeBounds(value);
        return value.toEpochSecond(UTC);
    }

    public static long toTimestamp(LocalDateTime value)
            throws ValueOutOfTypeBoundsException
    {
        checkTimeBounds(value);
        return value.toEpochSecond(UTC) * 1_000_000 + value.getNano() / 1_000;
    }

    public static String dateToString(LocalDate value)
    {
        return DATE_FORMAT.format(value);
    }

    public static String timestampToString(LocalDateTime value)
    {
        return TIMESTAMP_FORMAT.format(value);
    }

    private static void checkTimeBounds(LocalDateTime value)
            throws ValueOutOfTypeBoundsException
    {
        if (value.isBefore(MIN_TIME) || !value.isBefore(MAX_TIME)) {
            throw new ValueOutOfTypeBoundsException(format("Time %s is out of [%s, %s)", value, MIN_TIME, MAX_TIME));
        }
    }

    private static ValueConverter<Object, Object> bigInteger(PrimitiveTypeId target, BigInteger min, BigInteger max)
    {
        return value -> {
            BigInteger bigInteger = (BigInteger) value;
            if (bigInteger.compareTo(min) < 0 || bigInteger.compareTo(max) > 0) {
                throw new ValueOutOfTypeBoundsException(format("Value %s is out of %s bounds", value, target));
            }
            // UINT64 keeps the two's complement bits, read back unsigned
            return bigInteger.longValue();
        };
    }

    private static ValueConverter<Object, Object> integral(PrimitiveTypeId target, long min, long max)
    {
        return value -> {
            long longValue = ((Number) value).longValue();
            if (longValue < min || longValue > max) {
                throw new ValueOutOfTypeBoundsException(format("Value %s is out of %s bounds", value, target));
            }
            return longValue;
        };
    }

    private static Map<NativeKind, Map<PrimitiveTypeId, ValueConverter<Object, Object>>> createConverters()
    {
        Map<PrimitiveTypeId, ValueConverter<Object, Object>> integral = ImmutableMap.<PrimitiveTypeId, ValueConverter<Object, Object>>builder()
                .put(INT8, integral(INT8, Byte.MIN_VALUE, Byte.MAX_VALUE))
                .put(INT16, integral(INT16, Short.MIN_VALUE, Short.MAX_VALUE))
                .put(INT32, integral(INT32, Integer.MIN_VALUE, Integer.MAX_VALUE))
                .put(INT64, value -> ((Number) value).longValue())
                .put(UINT8, integral(UINT8, 0, 0xFFL))
                .put(UINT16, integral(UINT16, 0, 0xFFFFL))
                .put(UINT32, integral(UINT32, 0, 0xFFFF_FFFFL))
                .put(UINT64, integral(UINT64, 0, Long.MAX_VALUE))
                .put(DOUBLE, value -> ((Number) value).doubleValue())
                .put(UTF8, String::valueOf)
                .build();

        Map<NativeKind, Map<PrimitiveTypeId, ValueConverter<Object, Object>>> converters = new EnumMap<>(NativeKind.class);
        converters.put(NativeKind.BOOLEAN, ImmutableMap.of(
                BOOL, value -> ((Boolean) value) ? 1L : 0L,
                UTF8, String::valueOf));
        converters.put(NativeKind.BYTE, integral);
        converters.put(NativeKind.SHORT, integral);
        converters.put(NativeKind.INT, integral);
        converters.put(NativeKind.LONG, integral);
        converters.put(NativeKind.BIG_INTEGER, ImmutableMap.of(
                UINT64, bigInteger(UINT64, BigInteger.ZERO, MAX_UINT64),
                INT64, bigInteger(INT64, MIN_INT64, MAX_INT64),
                DOUBLE, value -> ((BigInteger) value).doubleValue(),
                UTF8, String::valueOf));
        converters.put(NativeKind.FLOAT, ImmutableMap.of(
                FLOAT, value -> value,
                DOUBLE, value -> ((Float) value).doubleValue()));
        converters.put(NativeKind.DOUBLE, ImmutableMap.of(
                DOUBLE, value -> value,
                FLOAT, value -> {
                    double doubleValue = (Double) value;
                    if (Double.isFinite(doubleValue) && Math.abs(doubleValue) > Float.MAX_VALUE) {
                        throw new ValueOutOfTypeBoundsException(format("Value %s is out of FLOAT bounds", value));
                    }
                    return (float) doubleValue;
                }));
        converters.put(NativeKind.DECIMAL, ImmutableMap.of(
                DOUBLE, value -> ((BigDecimal) value).doubleValue(),
                UTF8, value -> ((BigDecimal) value).toPlainString()));
        converters.put(NativeKind.STRING, ImmutableMap.of(
                UTF8, value -> value,
                JSON, value -> value,
                STRING, value -> ((String) value).getBytes(UTF_8)));
        converters.put(NativeKind.BYTES, ImmutableMap.of(
                STRING, value -> value,
                UTF8, value -> new String((byte[]) value, UTF_8)));
        converters.put(NativeKind.DATE, ImmutableMap.of(
                DATE, value -> toDate((LocalDate) value),
                UTF8, value -> dateToString((LocalDate) value)));
        converters.put(NativeKind.TIMESTAMP, ImmutableMap.of(
                DATETIME, value -> toDatetime((LocalDateTime) value),
                TIMESTAMP, value -> toTimestamp((LocalDateTime) value),
                UTF8, value -> timestampToString((LocalDateTime) value)));
        return ImmutableMap.copyOf(converters);
    }
}
