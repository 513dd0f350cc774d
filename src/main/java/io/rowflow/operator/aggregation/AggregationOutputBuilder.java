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

import com.facebook.presto.common.Page;
import com.facebook.presto.common.block.Block;
import com.facebook.presto.common.block.BlockBuilder;
import com.facebook.presto.common.type.Type;
import com.google.common.collect.ImmutableList;
import io.rowflow.spi.RowBatch;
import io.rowflow.spi.RowDescriptor;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Finalizes every entry of a table into a single batch: group-by columns first,
 * then one column per aggregate expression.
 */
public class AggregationOutputBuilder
{
    private final GroupKeyExtractor keyExtractor;
    private final List<AggregateValueBinding> bindings;
    private final RowDescriptor outputDescriptor;

    public AggregationOutputBuilder(GroupKeyExtractor keyExtractor, List<AggregateValueBinding> bindings)
    {
        this.keyExtractor = requireNonNull(keyExtractor, "keyExtractor is null");
        this.bindings = ImmutableList.copyOf(requireNonNull(bindings, "bindings is null"));
        this.outputDescriptor = new RowDescriptor(toTypes(keyExtractor, this.bindings));
    }

    private static List<Type> toTypes(GroupKeyExtractor keyExtractor, List<AggregateValueBinding> bindings)
    {
        ImmutableList.Builder<Type> builder = ImmutableList.builder();
        builder.addAll(keyExtractor.getTypes());
        bindings.stream()
                .map(AggregateValueBinding::getOutputType)
                .forEach(builder::add);
        return builder.build();
    }

    public RowDescriptor getOutputDescriptor()
    {
        return outputDescriptor;
    }

    public RowBatch build(AccumulatorTable table, boolean endOfWindow, boolean endOfStream)
    {
        requireNonNull(table, "table is null");
        List<Type> types = outputDescriptor.getTypes();
        int groupCount = table.getGroupCount();

        BlockBuilder[] blockBuilders = new BlockBuilder[types.size()];
        for (int channel = 0; channel < types.size(); channel++) {
            blockBuilders[channel] = types.get(channel).createBlockBuilder(null, groupCount);
        }

        int valueOffset = keyExtractor.getArity();
        for (AccumulatorEntry entry : table.getEntries()) {
            keyExtractor.appendTo(entry.getKey(), blockBuilders, 0);
            for (int i = 0; i < bindings.size(); i++) {
                bindings.get(i).evaluate(entry.getFunction(i), blockBuilders[valueOffset + i]);
            }
        }

        Block[] blocks = new Block[blockBuilders.length];
        for (int channel = 0; channel < blockBuilders.length; channel++) {
            blocks[channel] = blockBuilders[channel].build();
        }
        return new RowBatch(outputDescriptor, new Page(groupCount, blocks), endOfWindow, endOfStream);
    }
}
