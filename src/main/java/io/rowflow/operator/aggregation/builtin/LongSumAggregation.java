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

import io.rowflow.spi.function.AggregateFunction;
import io.rowflow.spi.function.FunctionContext;

import static io.rowflow.operator.aggregation.builtin.BuiltinAggregations.checkSameKind;

public class LongSumAggregation
        implements AggregateFunction
{
    private long sum;
    private boolean seen;

    @Override
    public void update(FunctionContext context, Object... arguments)
    {
        Object value = arguments[0];
        if (value != null) {
            sum = Math.addExact(sum, (Long) value);
            seen = true;
        }
    }

    @Override
    public void merge(FunctionContext context, AggregateFunction other)
    {
        LongSumAggregation partial = checkSameKind(LongSumAggregation.class, other);
        if (partial.seen) {
            sum = Math.addExact(sum, partial.sum);
            seen = true;
        }
    }

    @Override
    public Object evaluate(FunctionContext context)
    {
        return seen ? sum : null;
    }
}
