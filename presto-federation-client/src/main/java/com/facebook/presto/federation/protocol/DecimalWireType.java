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
package com.facebook.presto.federation.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

public final class DecimalWireType
        extends WireType
{
    public static final int MAX_PRECISION = 38;

    private final int precision;
    private final int scale;

    @JsonCreator
    public DecimalWireType(
            @JsonProperty("precision") int precision,
            @JsonProperty("scale") int scale)
    {
        checkArgument(precision > 0 && precision <= MAX_PRECISION, "invalid decimal precision: %s", precision);
        checkArgument(scale >= 0 && scale <= precision, "invalid decimal scale: %s", scale);
        this.precision = precision;
        this.scale = scale;
    }

    @JsonProperty
    public int getPrecision()
    {
        return precision;
    }

    @JsonProperty
    public int getScale()
    {
        return scale;
    }

    @Override
    public <R> R accept(WireTypeVisitor<R> visitor)
    {
        return visitor.visitDecimal(this);
    }

    @Override
    public boolean equals(Object o)
    {
        if (!(o instanceof DecimalWireType)) {
            return false;
        }
        DecimalWireType that = (DecimalWireType) o;
        return precision == that.precision && scale == that.scale;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(precision, scale);
    }

    @Override
    public String toString()
    {
        return "Decimal(" + precision + ", " + scale + ")";
    }
}
