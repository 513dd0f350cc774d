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

import com.facebook.presto.common.type.Type;
import com.facebook.presto.spi.PrestoException;
import com.google.common.collect.ImmutableList;
import io.rowflow.metadata.AggregateFunctionImplementation;
import io.rowflow.metadata.FunctionRegistry;
import io.rowflow.spi.RowDescriptor;
import io.rowflow.spi.function.FunctionContext;
import io.rowflow.sql.planner.plan.AggregateExpression;
import io.rowflow.sql.planner.plan.AggregationNode;
import io.rowflow.sql.planner.plan.ColumnReference;

import java.util.List;

import static io.rowflow.RowflowErrorCode.SCHEMA_MISMATCH;
import static io.rowflow.type.NativeValues.isSupported;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * One-time check of an aggregation plan against the schema of its input. Every
 * column reference must point at the input node and at an existing column, and
 * every aggregate must resolve to a registered implementation for the types of
 * its arguments.
 */
public final class AggregationPlanValidator
{
    private AggregationPlanValidator() {}

    public static CompiledAggregation validate(AggregationNode node, int sourceNodeId, RowDescriptor input, FunctionRegistry registry)
    {
        requireNonNull(node, "node is null");
        requireNonNull(input, "input is null");
        requireNonNull(registry, "registry is null");

        if (node.getGroupNames().size() != node.getGroups().size()) {
            throw new PrestoException(SCHEMA_MISMATCH, format("%s declares %s groups but %s group names", node.getId(), node.getGroups().size(), node.getGroupNames().size()));
        }
        if (node.getValueNames().size() != node.getValues().size()) {
            throw new PrestoException(SCHEMA_MISMATCH, format("%s declares %s values but %s value names", node.getId(), node.getValues().size(), node.getValueNames().size()));
        }

        ImmutableList.Builder<Integer> groupChannels = ImmutableList.builder();
        ImmutableList.Builder<Type> groupTypes = ImmutableList.builder();
        for (ColumnReference group : node.getGroups()) {
            int channel = resolveChannel(node, group, sourceNodeId, input);
            Type type = input.getType(channel);
            if (!isSupported(type)) {
                throw new PrestoException(SCHEMA_MISMATCH, format("%s cannot group by column %s of type %s", node.getId(), group, type.getDisplayName()));
            }
            groupChannels.add(channel);
            groupTypes.add(type);
        }
        GroupKeyExtractor keyExtractor = new GroupKeyExtractor(groupChannels.build(), groupTypes.build());

        ImmutableList.Builder<AggregateValueBinding> bindings = ImmutableList.builder();
        for (int i = 0; i < node.getValues().size(); i++) {
            AggregateExpression expression = node.getValues().get(i);
            ImmutableList.Builder<Integer> argumentChannels = ImmutableList.builder();
            ImmutableList.Builder<Type> argumentTypes = ImmutableList.builder();
            for (ColumnReference argument : expression.getArguments()) {
                int channel = resolveChannel(node, argument, sourceNodeId, input);
                argumentChannels.add(channel);
                argumentTypes.add(input.getType(channel));
            }
            AggregateFunctionImplementation implementation = registry.resolve(expression.getFunctionName(), argumentTypes.build());
            String name = node.getValueNames().get(i);
            FunctionContext context = new FunctionContext(node.getId().toString(), implementation.getName());
            bindings.add(new AggregateValueBinding(name, implementation, argumentChannels.build(), context));
        }

        return new CompiledAggregation(node.isWindowed(), keyExtractor, bindings.build(), node.getOutputNames());
    }

    private static int resolveChannel(AggregationNode node, ColumnReference column, int sourceNodeId, RowDescriptor input)
    {
        if (column.getSourceNodeId() != sourceNodeId) {
            throw new PrestoException(SCHEMA_MISMATCH, format("%s references column %s but its input is node %s", node.getId(), column, sourceNodeId));
        }
        if (column.getColumnIndex() >= input.size()) {
            throw new PrestoException(SCHEMA_MISMATCH, format("%s references column %s but its input %s has %s columns", node.getId(), column, input.toDisplayString(), input.size()));
        }
        return column.getColumnIndex();
    }
}
