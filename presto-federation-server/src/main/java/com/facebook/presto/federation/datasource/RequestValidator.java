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

import com.facebook.presto.federation.FederationException;
import com.facebook.presto.federation.protocol.DataSourceInstance;
import com.facebook.presto.federation.protocol.DataSourceKind;
import com.facebook.presto.federation.protocol.DescribeTableRequest;
import com.facebook.presto.federation.protocol.ListSplitsRequest;
import com.facebook.presto.federation.protocol.ReadSplitsFormat;
import com.facebook.presto.federation.protocol.ReadSplitsRequest;
import com.facebook.presto.federation.protocol.Select;
import com.facebook.presto.federation.protocol.Split;

import static com.facebook.presto.federation.FederationErrorCode.INVALID_REQUEST;
import static com.google.common.base.Strings.isNullOrEmpty;
import static java.lang.String.format;

public final class RequestValidator
{
    private RequestValidator()
    {
    }

    public static void validateDescribeTableRequest(DescribeTableRequest request)
    {
        validateDataSourceInstance(request.getDataSourceInstance());
        if (isNullOrEmpty(request.getTable())) {
            throw invalid("empty table");
        }
    }

    public static void validateListSplitsRequest(ListSplitsRequest request)
    {
        if (request.getSelects().isEmpty()) {
            throw invalid("empty selects");
        }
        if (request.getSplitNumberLimit() != 0) {
            throw invalid("splitNumberLimit is not supported");
        }
        if (request.getSplitSize() != 0) {
            throw invalid("splitSize is not supported");
        }
        if (request.getMaxSplitCount() < 0) {
            throw invalid("negative maxSplitCount");
        }
        for (int i = 0; i < request.getSelects().size(); i++) {
            validateSelect(request.getSelects().get(i), null, format("select %s", i));
        }
    }

    public static void validateReadSplitsRequest(ReadSplitsRequest request)
    {
        if (request.getSplits().isEmpty()) {
            throw invalid("empty splits");
        }
        if (request.getFormat() == ReadSplitsFormat.COLUMN_SET) {
            throw invalid("format " + request.getFormat() + " is not supported");
        }
        for (int i = 0; i < request.getSplits().size(); i++) {
            Split split = request.getSplits().get(i);
            validateSelect(split.getSelect(), request.getDataSourceInstance(), format("split %s", i));
        }
    }

    /**
     * The instance embedded in a split's select wins over the request level one.
     */
    public static DataSourceInstance getDataSourceInstance(ReadSplitsRequest request, Split split)
    {
        DataSourceInstance instance = split.getSelect().getDataSourceInstance();
        return instance != null ? instance : request.getDataSourceInstance();
    }

    private static void validateSelect(Select select, DataSourceInstance fallbackInstance, String context)
    {
        if (select == null) {
            throw invalid(context + ": missing select");
        }
        try {
            validateDataSourceInstance(select.getDataSourceInstance() != null ? select.getDataSourceInstance() : fallbackInstance);
        }
        catch (FederationException e) {
            throw invalid(context + ": " + e.getMessage());
        }
        if (isNullOrEmpty(select.getFrom())) {
            throw invalid(context + ": empty from");
        }
    }

    private static void validateDataSourceInstance(DataSourceInstance instance)
    {
        if (instance == null) {
            throw invalid("missing data source instance");
        }
        if (instance.getKind() == DataSourceKind.UNSPECIFIED) {
            throw invalid("unspecified data source kind");
        }
    }

    private static FederationException invalid(String message)
    {
        return new FederationException(INVALID_REQUEST, "Invalid request: " + message);
    }
}
