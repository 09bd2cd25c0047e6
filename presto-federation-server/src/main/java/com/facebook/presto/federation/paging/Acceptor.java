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

import com.facebook.presto.federation.conversion.NativeKind;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Reusable holder for one column value of the row being scanned.
 * <p>
 * Acceptors are allocated once per split read and refilled in place for every row.
 * Only the producer task touches them.
 */
public final class Acceptor
{
    private final NativeKind kind;
    private Object value;

    public Acceptor(NativeKind kind)
    {
        this.kind = requireNonNull(kind, "kind is null");
    }

    public NativeKind getKind()
    {
        return kind;
    }

    public void set(Object value)
    {
        checkArgument(value == null || kind.getJavaType().isInstance(value), "%s acceptor cannot hold %s", kind, value == null ? null : value.getClass());
        this.value = value;
    }

    public void setNull()
    {
        this.value = null;
    }

    public Object get()
    {
        return value;
    }

    public boolean isNull()
    {
        return value == null;
    }

    @Override
    public String toString()
    {
        return kind + ":" + value;
    }
}
