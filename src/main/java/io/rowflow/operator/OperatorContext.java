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

import io.rowflow.spi.RowBatch;
import io.rowflow.sql.planner.plan.PlanNodeId;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * Identity and counters of a single operator instance. Only the thread driving
 * the operator updates it.
 */
public class OperatorContext
{
    private final int operatorId;
    private final PlanNodeId planNodeId;
    private final String operatorType;

    private long inputBatches;
    private long inputPositions;
    private long outputBatches;
    private long outputPositions;
    private long flushes;

    public OperatorContext(int operatorId, PlanNodeId planNodeId, String operatorType)
    {
        this.operatorId = operatorId;
        this.planNodeId = requireNonNull(planNodeId, "planNodeId is null");
        this.operatorType = requireNonNull(operatorType, "operatorType is null");
    }

    public int getOperatorId()
    {
        return operatorId;
    }

    public PlanNodeId getPlanNodeId()
    {
        return planNodeId;
    }

    public String getOperatorType()
    {
        return operatorType;
    }

    public void recordInput(RowBatch batch)
    {
        inputBatches++;
        inputPositions += batch.getPositionCount();
    }

    public void recordOutput(RowBatch batch)
    {
        outputBatches++;
        outputPositions += batch.getPositionCount();
    }

    public void recordFlush()
    {
        flushes++;
    }

    public long getInputBatches()
    {
        return inputBatches;
    }

    public long getInputPositions()
    {
        return inputPositions;
    }

    public long getOutputBatches()
    {
        return outputBatches;
    }

    public long getOutputPositions()
    {
        return outputPositions;
    }

    public long getFlushes()
    {
        return flushes;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("operatorId", operatorId)
                .add("planNodeId", planNodeId)
                .add("operatorType", operatorType)
                .add("inputPositions", inputPositions)
                .add("outputPositions", outputPositions)
                .add("flushes", flushes)
                .toString();
    }
}
