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
package com.facebook.presto.federation;

import com.facebook.presto.federation.protocol.StatusCode;

import static com.facebook.presto.federation.ErrorType.EXTERNAL;
import static com.facebook.presto.federation.ErrorType.INTERNAL_ERROR;
import static com.facebook.presto.federation.ErrorType.USER_ERROR;
import static com.facebook.presto.federation.protocol.StatusCode.BAD_REQUEST;
import static com.facebook.presto.federation.protocol.StatusCode.NOT_FOUND;
import static com.facebook.presto.federation.protocol.StatusCode.UNSUPPORTED;

public enum FederationErrorCode
{
    INVALID_REQUEST(0, USER_ERROR, BAD_REQUEST),
    TABLE_DOES_NOT_EXIST(1, USER_ERROR, NOT_FOUND),
    // retrying reproduces the same outcome, so this is reported as a bad request
    READ_LIMIT_EXCEEDED(2, USER_ERROR, BAD_REQUEST),
    DATA_SOURCE_NOT_SUPPORTED(3, USER_ERROR, UNSUPPORTED),
    DATA_TYPE_NOT_SUPPORTED(4, EXTERNAL, UNSUPPORTED),
    UNSUPPORTED_PREDICATE(5, USER_ERROR, UNSUPPORTED),
    METHOD_NOT_SUPPORTED(6, USER_ERROR, UNSUPPORTED),
    VALUE_OUT_OF_TYPE_BOUNDS(7, EXTERNAL, UNSUPPORTED),
    PAGE_SIZE_EXCEEDED(8, INTERNAL_ERROR, StatusCode.INTERNAL_ERROR),
    BACKEND_ERROR(9, EXTERNAL, StatusCode.INTERNAL_ERROR),
    GENERIC_INTERNAL_ERROR(10, INTERNAL_ERROR, StatusCode.INTERNAL_ERROR);

    private final int code;
    private final ErrorType type;
    private final StatusCode statusCode;

    FederationErrorCode(int code, ErrorType type, StatusCode statusCode)
    {
        this.code = code + 0x0600_0000;
        this.type = type;
        this.statusCode = statusCode;
    }

    public int getCode()
    {
        return code;
    }

    public ErrorType getType()
    {
        return type;
    }

    public StatusCode getStatusCode()
    {
        return statusCode;
    }
}
