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
package io.rowflow.sql.planner.plan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

public final class AggregateExpression
{
    private final String functionName;
    private final List<ColumnReference> arguments;

    @JsonCreator
    public AggregateExpression(
            @JsonProperty("functionName") String functionName,
            @JsonProperty("arguments") List<ColumnReference> arguments)
    {
        requireNonNull(functionName, "functionName is null");
        checkArgument(!functionName.isEmpty(), "functionName is empty");
        this.functionName = functionName;
        this.arguments = ImmutableList.copyOf(requireNonNull(arguments, "arguments is null"));
    }

    public static AggregateExpression call(String functionName, ColumnReference... arguments)
    {
        return new AggregateExpression(functionName, ImmutableList.copyOf(arguments));
    }

    @JsonProperty
    public String getFunctionName()
    {
        return functionName;
    }

    @JsonProperty
    public List<ColumnReference> getArguments()
    {
        return arguments;
    }

    @Override
    public boolean equals(Object obj)
    {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        AggregateExpression other = (AggregateExpression) obj;
        return functionName.equals(other.functionName) && arguments.equals(other.arguments);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(functionName, arguments);
    }

    @Override
    public String toString()
    {
        return arguments.stream()
                .map(ColumnReference::toString)
                .collect(joining(", ", functionName + "(", ")"));
    }
}
