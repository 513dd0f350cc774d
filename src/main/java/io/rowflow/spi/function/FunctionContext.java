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
package io.rowflow.spi.function;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

public final class FunctionContext
{
    private final String planNodeId;
    private final String functionName;

    public FunctionContext(String planNodeId, String functionName)
    {
        this.planNodeId = requireNonNull(planNodeId, "planNodeId is null");
        this.functionName = requireNonNull(functionName, "functionName is null");
    }

    public String getPlanNodeId()
    {
        return planNodeId;
    }

    public String getFunctionName()
    {
        return functionName;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("planNodeId", planNodeId)
                .add("functionName", functionName)
                .toString();
    }
}
