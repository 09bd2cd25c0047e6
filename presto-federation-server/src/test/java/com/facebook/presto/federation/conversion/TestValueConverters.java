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
import org.testng.annotations.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;

import static com.facebook.presto.federation.conversion.ValueConverters.getConverter;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertThrows;

public class TestValueConverters
{
    @Test
    public void testIdentity()
            throws Exception
    {
        assertEquals(convert(NativeKind.LONG, PrimitiveTypeId.INT64, 42L), 42L);
        assertEquals(convert(NativeKind.DOUBLE, PrimitiveTypeId.DOUBLE, 1.5), 1.5);
        assertEquals(convert(NativeKind.STRING, PrimitiveTypeId.UTF8, "abc"), "abc");
        assertEquals(convert(NativeKind.BOOLEAN, PrimitiveTypeId.BOOL, true), 1L);
    }

    @Test
    public void testIntegralNarrowing()
            throws Exception
    {
        assertEquals(convert(NativeKind.LONG, PrimitiveTypeId.INT8, 127L), 127L);
        assertEquals(convert(NativeKind.INT, PrimitiveTypeId.INT16, -32768), -32768L);
        assertThrows(ValueOutOfTypeBoundsException.class, () -> convert(NativeKind.LONG, PrimitiveTypeId.INT8, 128L));
        assertThrows(ValueOutOfTypeBoundsException.class, () -> convert(NativeKind.INT, PrimitiveTypeId.UINT8, -1));
        assertThrows(ValueOutOfTypeBoundsException.class, () -> convert(NativeKind.LONG, PrimitiveTypeId.UINT32, 0x1_0000_0000L));
    }

    @Test
    public void testUnsignedBigint()
            throws Exception
    {
        BigInteger max = new BigInteger("18446744073709551615");
        assertEquals(convert(NativeKind.BIG_INTEGER, PrimitiveTypeId.UINT64, max), -1L);
        assertEquals(convert(NativeKind.BIG_INTEGER, PrimitiveTypeId.UINT64, BigInteger.valueOf(Long.MAX_VALUE).add(BigInteger.ONE)), Long.MIN_VALUE);
        assertEquals(convert(NativeKind.BIG_INTEGER, PrimitiveTypeId.UTF8, max), "18446744073709551615");
        assertThrows(ValueOutOfTypeBoundsException.class, () -> convert(NativeKind.BIG_INTEGER, PrimitiveTypeId.UINT64, max.add(BigInteger.ONE)));
        assertThrows(ValueOutOfTypeBoundsException.class, () -> convert(NativeKind.BIG_INTEGER, PrimitiveTypeId.UINT64, BigInteger.valueOf(-1)));
        assertThrows(ValueOutOfTypeBoundsException.class, () -> convert(NativeKind.BIG_INTEGER, PrimitiveTypeId.INT64, max));
    }

    @Test
    public void testDoubleToFloat()
            throws Exception
    {
        assertEquals(convert(NativeKind.DOUBLE, PrimitiveTypeId.FLOAT, 2.5), 2.5f);
        assertEquals(convert(NativeKind.DOUBLE, PrimitiveTypeId.FLOAT, Double.NaN), Float.NaN);
        assertThrows(ValueOutOfTypeBoundsException.class, () -> convert(NativeKind.DOUBLE, PrimitiveTypeId.FLOAT, 1e300));
    }

    @Test
    public void testDate()
            throws Exception
    {
        assertEquals(convert(NativeKind.DATE, PrimitiveTypeId.DATE, LocalDate.of(1970, 1, 1)), 0L);
        assertEquals(convert(NativeKind.DATE, PrimitiveTypeId.DATE, LocalDate.of(2020, 5, 17)), LocalDate.of(2020, 5, 17).toEpochDay());
        assertEquals(convert(NativeKind.DATE, PrimitiveTypeId.UTF8, LocalDate.of(2020, 5, 17)), "2020-05-17");
        assertThrows(ValueOutOfTypeBoundsException.class, () -> convert(NativeKind.DATE, PrimitiveTypeId.DATE, LocalDate.of(1969, 12, 31)));
        assertThrows(ValueOutOfTypeBoundsException.class, () -> convert(NativeKind.DATE, PrimitiveTypeId.DATE, LocalDate.of(2106, 1, 1)));
    }

    @Test
    public void testTimestamp()
            throws Exception
    {
        LocalDateTime value = LocalDateTime.of(1970, 1, 1, 0, 0, 1, 2_000);
        assertEquals(convert(NativeKind.TIMESTAMP, PrimitiveTypeId.TIMESTAMP, value), 1_000_002L);
        assertEquals(convert(NativeKind.TIMESTAMP, PrimitiveTypeId.DATETIME, value), 1L);
        assertEquals(convert(NativeKind.TIMESTAMP, PrimitiveTypeId.UTF8, value), "1970-01-01T00:00:01.000002Z");
        assertEquals(convert(NativeKind.TIMESTAMP, PrimitiveTypeId.UTF8, LocalDateTime.of(2001, 2, 3, 4, 5, 6)), "2001-02-03T04:05:06Z");
        assertThrows(ValueOutOfTypeBoundsException.class, () -> convert(NativeKind.TIMESTAMP, PrimitiveTypeId.TIMESTAMP, LocalDateTime.of(1969, 12, 31, 23, 59, 59)));
        assertThrows(ValueOutOfTypeBoundsException.class, () -> convert(NativeKind.TIMESTAMP, PrimitiveTypeId.DATETIME, ValueConverters.MAX_TIME));
    }

    @Test
    public void testDecimal()
            throws Exception
    {
        assertEquals(ValueConverters.decimal(5, 2).convert(new BigDecimal("123.456")), new BigDecimal("123.46"));
        assertThrows(ValueOutOfTypeBoundsException.class, () -> ValueConverters.decimal(4, 2).convert(new BigDecimal("123.4")));
        assertEquals(convert(NativeKind.DECIMAL, PrimitiveTypeId.UTF8, new BigDecimal("1E+3")), "1000");
    }

    @Test
    public void testBytes()
            throws Exception
    {
        assertEquals((byte[]) convert(NativeKind.STRING, PrimitiveTypeId.STRING, "ab"), "ab".getBytes(UTF_8));
        assertEquals(convert(NativeKind.BYTES, PrimitiveTypeId.UTF8, "ab".getBytes(UTF_8)), "ab");
    }

    @Test
    public void testUnsupportedPair()
    {
        assertFalse(getConverter(NativeKind.BYTES, PrimitiveTypeId.INT32).isPresent());
        assertFalse(getConverter(NativeKind.DATE, PrimitiveTypeId.INT64).isPresent());
    }

    private static Object convert(NativeKind nativeKind, PrimitiveTypeId wireType, Object value)
            throws ValueOutOfTypeBoundsException
    {
        return getConverter(nativeKind, wireType).get().convert(value);
    }
}
