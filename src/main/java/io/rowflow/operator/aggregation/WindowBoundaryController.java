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

import com.facebook.presto.spi.PrestoException;

import static io.rowflow.RowflowErrorCode.INVALID_STATE;

/**
 * Decides, from the tags of each consumed batch, when accumulated groups are
 * flushed and whether accumulation continues afterwards.
 * <p>
 * A blocking aggregation flushes once, on the end-of-stream batch. A windowed
 * aggregation flushes on every batch closing a window and starts the next window
 * from an empty table, until the end-of-stream batch.
 */
public class WindowBoundaryController
{
    public enum State
    {
        ACCUMULATING,
        DONE
    }

    public enum FlushAction
    {
        NONE(false),
        FLUSH_AND_RESET(true),
        FLUSH_AND_FINISH(true);

        private final boolean flush;

        FlushAction(boolean flush)
        {
            this.flush = flush;
        }

        public boolean isFlush()
        {
            return flush;
        }
    }

    private final boolean windowed;
    private State state = State.ACCUMULATING;

    public WindowBoundaryController(boolean windowed)
    {
        this.windowed = windowed;
    }

    public boolean isWindowed()
    {
        return windowed;
    }

    public State getState()
    {
        return state;
    }

    public void checkAccepting()
    {
        if (state == State.DONE) {
            throw new PrestoException(INVALID_STATE, "Batch received after end of stream");
        }
    }

    public FlushAction onBatch(boolean endOfWindow, boolean endOfStream)
    {
        checkAccepting();
        if (endOfStream) {
            state = State.DONE;
            return FlushAction.FLUSH_AND_FINISH;
        }
        if (windowed && endOfWindow) {
            return FlushAction.FLUSH_AND_RESET;
        }
        return FlushAction.NONE;
    }
}
