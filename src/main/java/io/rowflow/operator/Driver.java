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
import com.google.common.collect.ImmutableList;
import io.rowflow.spi.RowBatch;
import io.rowflow.spi.RowBatchSink;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.base.Throwables.throwIfUnchecked;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Runs a linear chain of operators on the calling thread. Every batch of the source
 * is pushed into the first operator; each operator pushes its output straight into
 * the next one and the last operator into the output sink.
 * <p>
 * The first failure stops the driver. All operators are closed regardless, and
 * failures while closing are attached to the original failure as suppressed.
 */
public class Driver
{
    private static final Logger log = Logger.get(Driver.class);

    private final List<Operator> operators;
    private boolean started;

    public Driver(List<OperatorFactory> operatorFactories, RowBatchSink output)
    {
        requireNonNull(operatorFactories, "operatorFactories is null");
        requireNonNull(output, "output is null");
        checkArgument(!operatorFactories.isEmpty(), "There must be at least one operator");

        List<Operator> reversed = new ArrayList<>(operatorFactories.size());
        RowBatchSink downstream = output;
        for (int i = operatorFactories.size() - 1; i >= 0; i--) {
            Operator operator = operatorFactories.get(i).createOperator(downstream);
            reversed.add(operator);
            downstream = operator;
        }
        this.operators = ImmutableList.copyOf(reversed).reverse();
    }

    public List<Operator> getOperators()
    {
        return operators;
    }

    public boolean isFinished()
    {
        return operators.get(operators.size() - 1).isFinished();
    }

    public void run(Iterable<RowBatch> source)
    {
        run(requireNonNull(source, "source is null").iterator());
    }

    public void run(Iterator<RowBatch> source)
    {
        requireNonNull(source, "source is null");
        checkState(!started, "Driver has already been run");
        started = true;

        Throwable failure = null;
        try {
            for (Operator operator : operators) {
                operator.open();
            }
            Operator first = operators.get(0);
            while (source.hasNext()) {
                first.consume(source.next());
            }
        }
        catch (Throwable t) {
            log.error(t, "Error driving %s", operators.get(0).getOperatorContext().getPlanNodeId());
            failure = t;
        }

        failure = closeOperators(failure);
        if (failure != null) {
            throwIfUnchecked(failure);
            // checked exceptions cannot escape open or consume
            throw new AssertionError(failure);
        }
    }

    private Throwable closeOperators(Throwable inFlightException)
    {
        for (Operator operator : operators) {
            try {
                operator.close();
            }
            catch (Throwable t) {
                inFlightException = addSuppressedException(
                        inFlightException,
                        t,
                        "Error closing operator %s for plan node %s",
                        operator.getOperatorContext().getOperatorId(),
                        operator.getOperatorContext().getPlanNodeId());
            }
        }
        return inFlightException;
    }

    private static Throwable addSuppressedException(Throwable inFlightException, Throwable newException, String message, Object... args)
    {
        if (!(newException instanceof Error)) {
            log.error(newException, format(message, args));
        }
        if (inFlightException == null) {
            return newException;
        }
        // Self-suppression not permitted
        if (inFlightException != newException) {
            inFlightException.addSuppressed(newException);
        }
        return inFlightException;
    }
}
