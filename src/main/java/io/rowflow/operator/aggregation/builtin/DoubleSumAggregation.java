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

public class DoubleSumAggregation
        implements AggregateFunction
{
    private double sum;
    private boolean seen;

    @Override
    public void update(FunctionContext context, Object... arguments)
    {
        Object value = arguments[0];
        if (value != null) {
            sum += (Double) value;
            seen = true;
        }
    }

    @Override
    public void merge(FunctionContext context, AggregateFunction other)
    {
        DoubleSumAggregation partial = checkSameKind(DoubleSumAggregation.class, other);
        if (partial.seen) {
            sum += partial.sum;
            seen = true;
        }
    }

    @Override
    public Object evaluate(FunctionContext context)
    {
        return seen ? sum : null;
    }
}
