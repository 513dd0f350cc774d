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

import io.rowflow.operator.aggregation.WindowBoundaryController.FlushAction;
import io.rowflow.operator.aggregation.WindowBoundaryController.State;
import org.testng.annotations.Test;

import static io.rowflow.RowflowErrorCode.INVALID_STATE;
import static io.rowflow.testing.RowflowAssertions.assertPrestoExceptionThrownBy;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

public class TestWindowBoundaryController
{
    @Test
    public void testBlocking()
    {
        WindowBoundaryController controller = new WindowBoundaryController(false);
        assertFalse(controller.isWindowed());
        assertEquals(controller.onBatch(false, false), FlushAction.NONE);
        assertEquals(controller.onBatch(true, false), FlushAction.NONE);
        assertEquals(controller.getState(), State.ACCUMULATING);
        assertEquals(controller.onBatch(false, true), FlushAction.FLUSH_AND_FINISH);
        assertEquals(controller.getState(), State.DONE);
    }

    @Test
    public void testWindowed()
    {
        WindowBoundaryController controller = new WindowBoundaryController(true);
        assertTrue(controller.isWindowed());
        assertEquals(controller.onBatch(false, false), FlushAction.NONE);
        assertEquals(controller.onBatch(true, false), FlushAction.FLUSH_AND_RESET);
        assertEquals(controller.onBatch(true, false), FlushAction.FLUSH_AND_RESET);
        assertEquals(controller.getState(), State.ACCUMULATING);
        assertEquals(controller.onBatch(true, true), FlushAction.FLUSH_AND_FINISH);
        assertEquals(controller.getState(), State.DONE);
    }

    @Test
    public void testEndOfStreamWithoutEndOfWindow()
    {
        WindowBoundaryController controller = new WindowBoundaryController(true);
        assertEquals(controller.onBatch(false, true), FlushAction.FLUSH_AND_FINISH);
    }

    @Test
    public void testBatchAfterEndOfStream()
    {
        WindowBoundaryController controller = new WindowBoundaryController(false);
        controller.checkAccepting();
        controller.onBatch(false, true);

        assertPrestoExceptionThrownBy(controller::checkAccepting, INVALID_STATE, "Batch received after end of stream");
        assertPrestoExceptionThrownBy(() -> controller.onBatch(false, false), INVALID_STATE, "Batch received after end of stream");
    }

    @Test
    public void testFlushActions()
    {
        assertFalse(FlushAction.NONE.isFlush());
        assertTrue(FlushAction.FLUSH_AND_RESET.isFlush());
        assertTrue(FlushAction.FLUSH_AND_FINISH.isFlush());
    }
}
