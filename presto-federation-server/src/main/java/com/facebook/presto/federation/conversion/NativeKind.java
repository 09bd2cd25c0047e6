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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Java representation a data source uses for a scanned value before it is converted to a wire value.
 */
public enum NativeKind
{
    BOOLEAN(Boolean.class, 1),
    BYTE(Byte.class, 1),
    SHORT(Short.class, 2),
    INT(Integer.class, 4),
    LONG(Long.class, 8),
    // unsigned 64 bit values above Long.MAX_VALUE
    BIG_INTEGER(BigInteger.class, 8),
    FLOAT(Float.class, 4),
    DOUBLE(Double.class, 8),
    DECIMAL(BigDecimal.class, -1),
    STRING(String.class, -1),
    BYTES(byte[].class, -1),
    DATE(LocalDate.class, 8),
    TIMESTAMP(LocalDateTime.class, 16);

    private final Class<?> javaType;
    private final int fixedSize;

    NativeKind(Class<?> javaType, int fixedSize)
    {
        this.javaType = javaType;
        this.fixedSize = fixedSize;
    }

    public Class<?> getJavaType()
    {
        return javaType;
    }

    public boolean isFixedWidth()
    {
        return fixedSize > 0;
    }

    /**
     * Estimated in-memory size of a value of this kind, or -1 when the size depends on the value.
     */
    public int getFixedSize()
    {
        return fixedSize;
    }
}
