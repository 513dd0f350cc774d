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
package io.rowflow;

import com.facebook.presto.common.ErrorCode;
import com.facebook.presto.spi.ErrorCodeSupplier;
import com.facebook.presto.common.ErrorType;

import static com.facebook.presto.common.ErrorType.INSUFFICIENT_RESOURCES;
import static com.facebook.presto.common.ErrorType.INTERNAL_ERROR;
import static com.facebook.presto.common.ErrorType.USER_ERROR;

public enum RowflowErrorCode
        implements ErrorCodeSupplier
{
    SCHEMA_MISMATCH(0, USER_ERROR),
    UNKNOWN_FUNCTION(1, USER_ERROR),
    INVALID_STATE(2, INTERNAL_ERROR),
    FUNCTION_INSTANTIATION_FAILURE(3, INSUFFICIENT_RESOURCES),
    EXCEEDED_GROUP_LIMIT(4, INSUFFICIENT_RESOURCES),
    FUNCTION_EXECUTION_FAILURE(5, INTERNAL_ERROR);

    private final ErrorCode errorCode;

    RowflowErrorCode(int code, ErrorType type)
    {
        errorCode = new ErrorCode(code + 0x0700_0000, name(), type);
    }

    @Override
    public ErrorCode toErrorCode()
    {
        return errorCode;
    }
}
