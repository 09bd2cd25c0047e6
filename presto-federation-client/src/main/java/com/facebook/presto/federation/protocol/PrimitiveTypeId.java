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

public enum PrimitiveTypeId
{
    BOOL(true),
    INT8(true),
    UINT8(true),
    INT16(true),
    UINT16(true),
    INT32(true),
    UINT32(true),
    INT64(true),
    UINT64(true),
    FLOAT(true),
    DOUBLE(true),
    STRING(false),
    UTF8(false),
    JSON(false),
    DATE(true),
    DATETIME(true),
    TIMESTAMP(true);

    private final boolean fixedWidth;

    PrimitiveTypeId(boolean fixedWidth)
    {
        this.fixedWidth = fixedWidth;
    }

    public boolean isFixedWidth()
    {
        return fixedWidth;
    }
}
