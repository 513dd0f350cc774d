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
package io.rowflow.operator.aggregation;

import com.google.common.collect.ImmutableList;
import io.rowflow.spi.function.AggregateFunction;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Running state of one group: one aggregate function instance per aggregate
 * expression, in declared order.
 */
public final class AccumulatorEntry
{
    private final GroupKey key;
    private final List<AggregateFunction> functions;

    public AccumulatorEntry(GroupKey key, List<AggregateFunction> functions)
    {
        this.key = requireNonNull(key, "key is null");
        this.functions = ImmutableList.copyOf(requireNonNull(functions, "functions is null"));
    }

    public GroupKey getKey()
    {
        return key;
    }

    public AggregateFunction getFunction(int index)
    {
        return functions.get(index);
    }

    public int getFunctionCount()
    {
        return functions.size();
    }
}
