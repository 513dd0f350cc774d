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
package io.rowflow.operator;

import com.facebook.airlift.log.Logger;
import com.facebook.presto.common.Page;
import com.facebook.presto.common.block.Block;
import com.facebook.presto.common.type.Type;
import com.facebook.presto.spi.PrestoException;
import com.google.common.collect.ImmutableList;
import io.rowflow.metadata.FunctionRegistry;
import io.rowflow.operator.aggregation.AccumulatorTable;
import io.rowflow.operator.aggregation.AggregationOutputBuilder;
import io.rowflow.operator.aggregation.AggregationPlanValidator;
import io.rowflow.operator.aggregation.CompiledAggregation;
import io.rowflow.operator.aggregation.WindowBoundaryController;
import io.rowflow.operator.aggregation.WindowBoundaryController.FlushAction;
import io.rowflow.operator.aggregation.WindowBoundaryController.State;
import io.rowflow.spi.RowBatch;
import io.rowflow.spi.RowBatchSink;
import io.rowflow.spi.RowDescriptor;
import io.rowflow.sql.planner.plan.AggregationNode;
import io.rowflow.sql.planner.plan.PlanNodeId;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static io.rowflow.RowflowErrorCode.INVALID_STATE;
import static io.rowflow.RowflowErrorCode.SCHEMA_MISMATCH;
import static io.rowflow.type.NativeValues.readNativeValue;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Groups incoming rows by key columns and folds value columns into per-group
 * aggregate function instances. In blocking mode a single result is emitted at end
 * of stream; in windowed mode every end-of-window batch flushes the accumulated
 * groups and starts over.
 */
public class GroupedAggregationOperator
        implements Operator
{
    private static final Logger log = Logger.get(GroupedAggregationOperator.class);

    public static class GroupedAggregationOperatorFactory
            implements OperatorFactory
    {
        private final int operatorId;
        private final PlanNodeId planNodeId;
        private final int sourceNodeId;
        private final AggregationNode aggregationNode;
        private final RowDescriptor inputDescriptor;
        private final FunctionRegistry functionRegistry;
        private final AggregationConfig config;
        private boolean closed;

        public GroupedAggregationOperatorFactory(
                int operatorId,
                PlanNodeId planNodeId,
                int sourceNodeId,
                AggregationNode aggregationNode,
                RowDescriptor inputDescriptor,
                FunctionRegistry functionRegistry,
                AggregationConfig config)
        {
            checkArgument(sourceNodeId >= 0, "sourceNodeId is negative");
            this.operatorId = operatorId;
            this.planNodeId = requireNonNull(planNodeId, "planNodeId is null");
            this.sourceNodeId = sourceNodeId;
            this.aggregationNode = requireNonNull(aggregationNode, "aggregationNode is null");
            this.inputDescriptor = requireNonNull(inputDescriptor, "inputDescriptor is null");
            this.functionRegistry = requireNonNull(functionRegistry, "functionRegistry is null");
            this.config = requireNonNull(config, "config is null");
        }

        @Override
        public Operator createOperator(RowBatchSink downstream)
        {
            checkState(!closed, "Factory is already closed");
            OperatorContext operatorContext = new OperatorContext(operatorId, planNodeId, GroupedAggregationOperator.class.getSimpleName());
            return new GroupedAggregationOperator(
                    operatorContext,
                    sourceNodeId,
                    aggregationNode,
                    inputDescriptor,
                    functionRegistry,
                    config.getExpectedGroups(),
                    config.getMaxGroups(),
                    downstream);
        }

        @Override
        public void noMoreOperators()
        {
            closed = true;
        }

        @Override
        public OperatorFactory duplicate()
        {
            return new GroupedAggregationOperatorFactory(operatorId, planNodeId, sourceNodeId, aggregationNode, inputDescriptor, functionRegistry, config);
        }
    }

    private final OperatorContext operatorContext;
    private final int sourceNodeId;
    private final AggregationNode aggregationNode;
    private final RowDescriptor inputDescriptor;
    private final FunctionRegistry functionRegistry;
    private final int expectedGroups;
    private final int maxGroups;
    private final RowBatchSink downstream;

    private CompiledAggregation aggregation;
    private AccumulatorTable table;
    private WindowBoundaryController controller;
    private AggregationOutputBuilder outputBuilder;
    private boolean closed;

    public GroupedAggregationOperator(
            OperatorContext operatorContext,
            int sourceNodeId,
            AggregationNode aggregationNode,
            RowDescriptor inputDescriptor,
            FunctionRegistry functionRegistry,
            int expectedGroups,
            int maxGroups,
            RowBatchSink downstream)
    {
        checkArgument(expectedGroups > 0, "expectedGroups must be positive");
        checkArgument(maxGroups > 0, "maxGroups must be positive");
        this.operatorContext = requireNonNull(operatorContext, "operatorContext is null");
        this.sourceNodeId = sourceNodeId;
        this.aggregationNode = requireNonNull(aggregationNode, "aggregationNode is null");
        this.inputDescriptor = requireNonNull(inputDescriptor, "inputDescriptor is null");
        this.functionRegistry = requireNonNull(functionRegistry, "functionRegistry is null");
        this.expectedGroups = expectedGroups;
        this.maxGroups = maxGroups;
        this.downstream = requireNonNull(downstream, "downstream is null");
    }

    @Override
    public OperatorContext getOperatorContext()
    {
        return operatorContext;
    }

    @Override
    public void open()
    {
        if (closed) {
            throw new PrestoException(INVALID_STATE, "Operator is closed");
        }
        if (aggregation != null) {
            throw new PrestoException(INVALID_STATE, "Operator is already open");
        }

        CompiledAggregation compiled = AggregationPlanValidator.validate(aggregationNode, sourceNodeId, inputDescriptor, functionRegistry);
        table = compiled.createTable(expectedGroups, maxGroups);
        controller = new WindowBoundaryController(compiled.isWindowed());
        outputBuilder = compiled.createOutputBuilder();
        aggregation = compiled;

        log.debug("Opened aggregation %s (%s) over [%s] producing %s",
                operatorContext.getPlanNodeId(),
                compiled.isWindowed() ? "windowed" : "blocking",
                inputDescriptor.toDisplayString(),
                compiled.getOutputNames());
    }

    @Override
    public RowDescriptor getOutputDescriptor()
    {
        checkState(aggregation != null, "Operator is not open");
        return aggregation.getOutputDescriptor();
    }

    public List<String> getOutputNames()
    {
        checkState(aggregation != null, "Operator is not open");
        return ImmutableList.copyOf(aggregation.getOutputNames());
    }

    @Override
    public void consume(RowBatch batch)
    {
        requireNonNull(batch, "batch is null");
        if (closed) {
            throw new PrestoException(INVALID_STATE, "Batch received after operator was closed");
        }
        if (aggregation == null) {
            throw new PrestoException(INVALID_STATE, "Batch received before operator was opened");
        }
        controller.checkAccepting();
        checkSchema(batch);

        operatorContext.recordInput(batch);
        if (batch.getPositionCount() > 0) {
            table.addPage(batch.getPage());
        }

        FlushAction action = controller.onBatch(batch.isEndOfWindow(), batch.isEndOfStream());
        if (action.isFlush()) {
            flush(batch);
        }
    }

    private void checkSchema(RowBatch batch)
    {
        // a row-less batch may carry only boundary tags
        if (batch.getPositionCount() == 0 && batch.getChannelCount() == 0) {
            return;
        }
        if (!inputDescriptor.matches(batch.getPage())) {
            throw new PrestoException(SCHEMA_MISMATCH, format(
                    "Batch has %s columns but the input of %s declares %s: %s",
                    batch.getChannelCount(),
                    operatorContext.getPlanNodeId(),
                    inputDescriptor.size(),
                    inputDescriptor.toDisplayString()));
        }
        if (!inputDescriptor.equals(batch.getDescriptor())) {
            throw new PrestoException(SCHEMA_MISMATCH, format(
                    "Batch of type %s does not match the input of %s: %s",
                    batch.getDescriptor().toDisplayString(),
                    operatorContext.getPlanNodeId(),
                    inputDescriptor.toDisplayString()));
        }
        Page page = batch.getPage();
        for (int channel = 0; channel < page.getChannelCount(); channel++) {
            checkColumnLayout(channel, inputDescriptor.getType(channel), page.getBlock(channel));
        }
    }

    // blocks are homogeneous, so the first non-null value shows whether the column reads as its type
    private void checkColumnLayout(int channel, Type type, Block block)
    {
        for (int position = 0; position < block.getPositionCount(); position++) {
            if (block.isNull(position)) {
                continue;
            }
            try {
                readNativeValue(type, block, position);
            }
            catch (UnsupportedOperationException | IllegalArgumentException | ClassCastException e) {
                throw new PrestoException(SCHEMA_MISMATCH, format(
                        "Column %s of batch for %s cannot be read as %s",
                        channel,
                        operatorContext.getPlanNodeId(),
                        type.getDisplayName()), e);
            }
            return;
        }
    }

    private void flush(RowBatch trigger)
    {
        RowBatch output = outputBuilder.build(table, trigger.isEndOfWindow(), trigger.isEndOfStream());
        operatorContext.recordFlush();
        operatorContext.recordOutput(output);
        log.debug("Flushing %s groups from %s (eow=%s, eos=%s)",
                output.getPositionCount(),
                operatorContext.getPlanNodeId(),
                trigger.isEndOfWindow(),
                trigger.isEndOfStream());
        table.reset();
        downstream.consume(output);
    }

    @Override
    public boolean isFinished()
    {
        return controller != null && controller.getState() == State.DONE;
    }

    @Override
    public void close()
    {
        if (closed) {
            throw new PrestoException(INVALID_STATE, "Operator is already closed");
        }
        closed = true;
        if (table == null) {
            return;
        }
        if (!isFinished() && !table.isEmpty()) {
            log.debug("Discarding %s groups of %s closed before end of stream", table.getGroupCount(), operatorContext.getPlanNodeId());
        }
        table.close();
    }
}
