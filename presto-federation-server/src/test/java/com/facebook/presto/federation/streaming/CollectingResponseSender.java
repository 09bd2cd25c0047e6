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
package com.facebook.presto.federation.streaming;

import com.facebook.presto.federation.protocol.ApiError;
import com.facebook.presto.federation.protocol.ReadSplitsResponse;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.google.common.collect.ImmutableList.toImmutableList;

public class CollectingResponseSender
        implements ReadSplitsResponseSender
{
    private final List<ReadSplitsResponse> responses = new CopyOnWriteArrayList<>();
    private final int cancelAfterPages;

    public CollectingResponseSender()
    {
        this(Integer.MAX_VALUE);
    }

    public CollectingResponseSender(int cancelAfterPages)
    {
        this.cancelAfterPages = cancelAfterPages;
    }

    @Override
    public void send(ReadSplitsResponse response)
    {
        responses.add(response);
    }

    @Override
    public boolean isCancelled()
    {
        return getPages().size() >= cancelAfterPages;
    }

    public List<ReadSplitsResponse> getResponses()
    {
        return ImmutableList.copyOf(responses);
    }

    public List<ReadSplitsResponse> getPages()
    {
        return responses.stream()
                .filter(response -> response.getError().isSuccess())
                .collect(toImmutableList());
    }

    public List<ApiError> getErrors()
    {
        return responses.stream()
                .map(ReadSplitsResponse::getError)
                .filter(error -> !error.isSuccess())
                .collect(toImmutableList());
    }
}
