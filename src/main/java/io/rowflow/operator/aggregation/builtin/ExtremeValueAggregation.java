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
package io.rowflow.operator.aggregation.builtin;

import com.facebook.presto.common.type.Type;
import io.airlift.slice.Slice;
import io.airlift.slice.Slices;
import io.rowflow.spi.function.AggregateFunction;
import io.rowflow.spi.function.FunctionContext;

import static io.rowflow.operator.aggregation.builtin.BuiltinAggregations.checkSameKind;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Shared state of {@code min} and {@code max} for one input type. Values are compared
 * in their natural order, so varchar compares by bytes.
 */
public class ExtremeValueAggregation
        implements AggregateFunction
{
    public enum Extreme
    {
        MIN, MAX
    }

    private final Extreme extreme;
    private final Type type;
    private Comparable<Object> value;

    public ExtremeValueAggregation(Extreme extreme, Type type)
    {
        this.extreme = requireNonNull(extreme, "extreme is null");
        this.type = requireNonNull(type, "type is null");
    }

    public static ExtremeValueAggregation min(Type type)
    {
        return new ExtremeValueAggregation(Extreme.MIN, type);
    }

    public static ExtremeValueAggregation max(Type type)
    {
        return new ExtremeValueAggregation(Extreme.MAX, type);
    }

    @Override
    public void update(FunctionContext context, Object... arguments)
    {
        Object argument = arguments[0];
        if (argument == null || !replaces(argument)) {
            return;
        }
        if (argument instanceof Slice) {
            // input slices point into the batch being consumed
            argument = Slices.copyOf((Slice) argument);
        }
        value = asComparable(argument);
    }

    @Override
    public void merge(FunctionContext context, AggregateFunction other)
    {
        ExtremeValueAggregation partial = checkSameKind(ExtremeValueAggregation.class, other);
        if (partial.extreme != extreme) {
            throw new IllegalArgumentException("Cannot merge " + partial.extreme + " state into " + extreme);
        }
        if (!partial.type.equals(type)) {
            throw new IllegalArgumentException(format("Cannot merge %s state into %s", partial.type.getDisplayName(), type.getDisplayName()));
        }
        if (partial.value != null && replaces(partial.value)) {
            value = partial.value;
        }
    }

    @Override
    public Object evaluate(FunctionContext context)
    {
        return value;
    }

    private boolean replaces(Object candidate)
    {
        if (value == null) {
            return true;
        }
        int comparison = asComparable(candidate).compareTo(value);
        return extreme == Extreme.MIN ? comparison < 0 : comparison > 0;
    }

    @SuppressWarnings("unchecked")
    private static Comparable<Object> asComparable(Object value)
    {
        return (Comparable<Object>) value;
    }
}
