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
package io.rowflow.testing;

import com.facebook.presto.spi.ErrorCodeSupplier;
import com.facebook.presto.spi.PrestoException;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

public final class RowflowAssertions
{
    private RowflowAssertions() {}

    public static void assertPrestoExceptionThrownBy(ThrowingCallable callable, ErrorCodeSupplier errorCode, String expectedMessagePart)
    {
        assertThatThrownBy(callable)
                .isInstanceOf(PrestoException.class)
                .hasMessageContaining(expectedMessagePart)
                .satisfies(failure -> assertErrorCode((PrestoException) failure, errorCode));
    }

    public static void assertErrorCode(PrestoException exception, ErrorCodeSupplier errorCode)
    {
        if (!exception.getErrorCode().equals(errorCode.toErrorCode())) {
            throw new AssertionError("Expected error code " + errorCode.toErrorCode() + " but was " + exception.getErrorCode(), exception);
        }
    }
}
