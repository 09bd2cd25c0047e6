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
import com.google.common.collect.ImmutableList;
import org.apache.arrow.vector.FieldVector;

import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

public class DefaultRowTransformer
        implements RowTransformer
{
    private final List<Acceptor> acceptors;
    private final List<Appender> appenders;
    private final int[] wantedColumnIds;

    /**
     * @param wantedColumnIds for each requested column, the index of its acceptor; empty when acceptors follow request order
     */
    public DefaultRowTransformer(List<Acceptor> acceptors, List<Appender> appenders, Optional<List<Integer>> wantedColumnIds)
    {
        this.acceptors = ImmutableList.copyOf(requireNonNull(acceptors, "acceptors is null"));
        this.appenders = ImmutableList.copyOf(requireNonNull(appenders, "appenders is null"));
        requireNonNull(wantedColumnIds, "wantedColumnIds is null");
        this.wantedColumnIds = wantedColumnIds
                .map(ids -> ids.stream().mapToInt(Integer::intValue).toArray())
                .orElseGet(() -> positional(appenders.size()));

        checkArgument(this.wantedColumnIds.length == appenders.size(), "expected %s wanted column ids, got %s", appenders.size(), this.wantedColumnIds.length);
        for (int id : this.wantedColumnIds) {
            checkArgument(id >= 0 && id < acceptors.size(), "wanted column id %s out of range [0, %s)", id, acceptors.size());
        }
    }

    /**
     * Binds one appender per requested column, converting from the kind of the acceptor that column reads.
     */
    public static DefaultRowTransformer create(List<Acceptor> acceptors, List<Column> columns, Optional<List<Integer>> wantedColumnIds)
    {
        ImmutableList.Builder<Appender> appenders = ImmutableList.builder();
        for (int i = 0; i < columns.size(); i++) {
            int acceptorId = wantedColumnIds.isPresent() ? wantedColumnIds.get().get(i) : i;
            checkArgument(acceptorId < acceptors.size(), "no acceptor for column %s", columns.get(i).getName());
            appenders.add(Appenders.forColumn(acceptors.get(acceptorId).getKind(), columns.get(i).getType()));
        }
        return new DefaultRowTransformer(acceptors, appenders.build(), wantedColumnIds);
    }

    @Override
    public List<Acceptor> getAcceptors()
    {
        return acceptors;
    }

    @Override
    public void appendToArrowVectors(List<FieldVector> vectors, int position)
    {
        for (int i = 0; i < appenders.size(); i++) {
            appenders.get(i).append(acceptors.get(wantedColumnIds[i]), vectors.get(i), position);
        }
    }

    private static int[] positional(int size)
    {
        int[] ids = new int[size];
        for (int i = 0; i < size; i++) {
            ids[i] = i;
        }
        return ids;
    }
}
