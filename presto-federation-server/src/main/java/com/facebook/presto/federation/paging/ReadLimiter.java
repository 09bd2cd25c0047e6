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

/**
 * Admission control on the number of rows a request may read.
 */
public interface ReadLimiter
{
    /**
     * Counts one more row.
     *
     * @throws com.facebook.presto.federation.FederationException with {@code READ_LIMIT_EXCEEDED} once the limit is reached
     */
    void addRow();
}
