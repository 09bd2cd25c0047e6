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

import org.apache.arrow.vector.FieldVector;

import java.util.List;

/**
 * Bridges the acceptors a data source fills for every scanned row with the column vectors of the page.
 */
public interface RowTransformer
{
    /**
     * Acceptors in the native row order of the data source. The data source refills them in place for each row.
     */
    List<Acceptor> getAcceptors();

    /**
     * Appends the current acceptor values of the wanted columns at {@code position} of the page vectors,
     * one vector per requested column in request order.
     */
    void appendToArrowVectors(List<FieldVector> vectors, int position);
}
