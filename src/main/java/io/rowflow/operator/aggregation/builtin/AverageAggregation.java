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
import io.rowflow.spi.function.AggregateFunction;
import io.rowflow.spi.function.FunctionContext;

import static io.rowflow.operator.aggregation.builtin.BuiltinAggregations.checkSameKind;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Average of bigint or double input, always returned as double. States of
 * different input types do not merge.
 */
public class AverageAggregation
        implements AggregateFunction
{
    private final Type inputType;
    private double sum;
    private long count;

    public AverageAggregation(Type inputType)
    {
        this.inputType = requireNonNull(inputType, "inputType is null");
    }

    @Override
    public void update(FunctionContext context, Object... arguments)
    {
        Object value = arguments[0];
        if (value != null) {
            sum += ((Number) value).doubleValue();
            count++;
        }
    }

    @Override
    public void merge(FunctionContext context, AggregateFunction other)
    {
        AverageAggregation partial = checkSameKind(AverageAggregation.class, other);
        if (!partial.inputType.equals(inputType)) {
            throw new IllegalArgumentException(format("Cannot merge avg(%s) state into avg(%s)", partial.inputType.getDisplayName(), inputType.getDisplayName()));
        }
        sum += partial.sum;
        count += partial.count;
    }

    @Override
    public Object evaluate(FunctionContext context)
    {
        if (count == 0) {
            return null;
        }
        return sum / count;
    }
}
