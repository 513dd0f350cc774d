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
import io.rowflow.spi.RowBatchSink;
import io.rowflow.spi.RowDescriptor;

/**
 * A push-driven operator. The driver calls {@link #open()} once, then
 * {@link #consume(RowBatch)} for every input batch, and finally {@link #close()},
 * all from one thread. Output is pushed synchronously to the downstream sink the
 * operator was created with.
 */
public interface Operator
        extends RowBatchSink, AutoCloseable
{
    OperatorContext getOperatorContext();

    /**
     * Validates the operator against its input and allocates its state.
     */
    void open();

    /**
     * Available once the operator is open.
     */
    RowDescriptor getOutputDescriptor();

    @Override
    void consume(RowBatch batch);

    /**
     * True once the operator has seen the end of its input stream.
     */
    boolean isFinished();

    /**
     * Releases all state without producing output. Allowed at any point.
     */
    @Override
    void close();
}
