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

import com.facebook.presto.federation.conversion.ValueOutOfTypeBoundsException;
import com.facebook.presto.federation.protocol.ApiError;
import com.facebook.presto.federation.protocol.StatusCode;

import static com.google.common.base.Throwables.getCausalChain;

/**
 * Translates failures into the in-band error envelope.
 */
public final class ApiErrors
{
    private ApiErrors()
    {
    }

    public static ApiError toApiError(Throwable throwable)
    {
        for (Throwable cause : getCausalChain(throwable)) {
            if (cause instanceof FederationException) {
                FederationException exception = (FederationException) cause;
                return new ApiError(exception.getErrorCode().getStatusCode(), exception.getMessage());
            }
            if (cause instanceof ValueOutOfTypeBoundsException) {
                return new ApiError(FederationErrorCode.VALUE_OUT_OF_TYPE_BOUNDS.getStatusCode(), cause.getMessage());
            }
        }
        String message = throwable.getMessage();
        return new ApiError(StatusCode.INTERNAL_ERROR, message == null ? throwable.getClass().getSimpleName() : message);
    }
}
