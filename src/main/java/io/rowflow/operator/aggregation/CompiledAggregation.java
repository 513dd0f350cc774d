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
import io.rowflow.spi.RowDescriptor;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * An aggregation plan resolved against its input: channels, types and function
 * implementations are fixed and never looked up again.
 */
public final class CompiledAggregation
{
    private final boolean windowed;
    private final GroupKeyExtractor keyExtractor;
    private final List<AggregateValueBinding> bindings;
    private final List<String> outputNames;

    public CompiledAggregation(boolean windowed, GroupKeyExtractor keyExtractor, List<AggregateValueBinding> bindings, List<String> outputNames)
    {
        this.windowed = windowed;
        this.keyExtractor = requireNonNull(keyExtractor, "keyExtractor is null");
        this.bindings = ImmutableList.copyOf(requireNonNull(bindings, "bindings is null"));
        this.outputNames = ImmutableList.copyOf(requireNonNull(outputNames, "outputNames is null"));
    }

    public boolean isWindowed()
    {
        return windowed;
    }

    public GroupKeyExtractor getKeyExtractor()
    {
        return keyExtractor;
    }

    public List<AggregateValueBinding> getBindings()
    {
        return bindings;
    }

    public List<String> getOutputNames()
    {
        return outputNames;
    }

    public AccumulatorTable createTable(int expectedGroups, int maxGroups)
    {
        return new AccumulatorTable(keyExtractor, bindings, expectedGroups, maxGroups);
    }

    public AggregationOutputBuilder createOutputBuilder()
    {
        return new AggregationOutputBuilder(keyExtractor, bindings);
    }

    public RowDescriptor getOutputDescriptor()
    {
        return createOutputBuilder().getOutputDescriptor();
    }
}
