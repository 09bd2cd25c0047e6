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
package com.facebook.presto.federation.datasource;

import com.facebook.presto.federation.paging.SinkFactory;
import com.facebook.presto.federation.protocol.DescribeTableRequest;
import com.facebook.presto.federation.protocol.ListSplitsRequest;
import com.facebook.presto.federation.protocol.ReadSplitsRequest;
import com.facebook.presto.federation.protocol.Select;
import com.facebook.presto.federation.protocol.Split;
import com.facebook.presto.federation.protocol.TableSchema;

/**
 * Capabilities of one backend kind. Failures are reported as {@link com.facebook.presto.federation.FederationException}.
 */
public interface DataSource
{
    /**
     * @throws com.facebook.presto.federation.FederationException with {@code TABLE_DOES_NOT_EXIST} when the table is absent
     */
    TableSchema describeTable(DescribeTableRequest request);

    /**
     * Enumerates the splits of one select, pushing each one to {@code consumer} as soon as it is known.
     */
    void listSplits(ListSplitsRequest request, Select select, SplitConsumer consumer);

    /**
     * Reads the split into the sink obtained from {@code sinkFactory}.
     * Returns once every row has been handed to the sink; the caller finishes the sink.
     */
    void readSplit(String queryId, ReadSplitsRequest request, Split split, SinkFactory sinkFactory);

    /**
     * Whether ListSplits honors {@code maxSplitCount}.
     */
    default boolean supportsSplitCount()
    {
        return false;
    }
}
