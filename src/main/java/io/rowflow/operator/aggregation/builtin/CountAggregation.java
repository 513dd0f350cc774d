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

public class CountAggregation
        implements AggregateFunction
{
    private long count;

    @Override
    public void update(FunctionContext context, Object... arguments)
    {
        if (arguments[0] != null) {
            count++;
        }
    }

    @Override
    public void merge(FunctionContext context, AggregateFunction other)
    {
        count += checkSameKind(CountAggregation.class, other).count;
    }

    @Override
    public Object evaluate(FunctionContext context)
    {
        return count;
    }
}
