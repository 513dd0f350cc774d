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
import com.facebook.presto.common.block.BlockBuilder;
import com.google.common.collect.ImmutableList;
import io.airlift.slice.Slice;
import io.rowflow.metadata.AggregateFunctionImplementation;
import io.rowflow.spi.function.AggregateFunction;
import io.rowflow.spi.function.FunctionContext;
import io.rowflow.spi.function.FunctionDocumentation;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;

import static com.facebook.presto.common.type.BigintType.BIGINT;
import static com.facebook.presto.common.type.VarcharType.VARCHAR;
import static io.rowflow.RowBatchesBuilder.rowBatchesBuilder;
import static io.rowflow.RowflowErrorCode.FUNCTION_EXECUTION_FAILURE;
import static io.rowflow.RowflowErrorCode.FUNCTION_INSTANTIATION_FAILURE;
import static io.rowflow.testing.RowflowAssertions.assertPrestoExceptionThrownBy;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertSame;

public class TestAggregateValueBinding
{
    private static final FunctionContext CONTEXT = new FunctionContext("agg", "capture");

    @Test
    public void testUpdatePassesNativeValues()
    {
        AggregateValueBinding binding = binding(CaptureAggregation::new, 1, 0);
        CaptureAggregation function = (CaptureAggregation) binding.createInstance();
        Page page = rowBatchesBuilder(VARCHAR, BIGINT)
                .row("abc", 7L)
                .row(null, null)
                .batch()
                .build().get(0).getPage();

        binding.update(function, page, 0);
        binding.update(function, page, 1);

        assertEquals(function.calls.size(), 2);
        assertEquals(function.calls.get(0).get(0), 7L);
        assertEquals(((Slice) function.calls.get(0).get(1)).toStringUtf8(), "abc");
        assertNull(function.calls.get(1).get(0));
        assertNull(function.calls.get(1).get(1));
        assertSame(function.context, CONTEXT);
    }

    @Test
    public void testWrongArgumentCount()
    {
        assertThatThrownBy(() -> binding(CaptureAggregation::new, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("capture(bigint, varchar):bigint expects 2 arguments, got 1");
    }

    @Test
    public void testInstantiationFailure()
    {
        AggregateValueBinding binding = binding(() -> {
            throw new IllegalStateException("no memory");
        }, 1, 0);

        assertPrestoExceptionThrownBy(binding::createInstance, FUNCTION_INSTANTIATION_FAILURE, "Failed to create an instance of capture(bigint, varchar):bigint for value");
    }

    @Test
    public void testEvaluateWithWrongResultType()
    {
        AggregateValueBinding binding = binding(() -> new CaptureAggregation("not a number"), 1, 0);
        BlockBuilder output = BIGINT.createBlockBuilder(null, 1);

        assertPrestoExceptionThrownBy(() -> binding.evaluate(binding.createInstance(), output), FUNCTION_EXECUTION_FAILURE, "returned String which is not a bigint");
    }

    @Test
    public void testEvaluate()
    {
        AggregateValueBinding binding = binding(() -> new CaptureAggregation(42), 1, 0);
        BlockBuilder output = BIGINT.createBlockBuilder(null, 1);

        binding.evaluate(binding.createInstance(), output);

        assertEquals(BIGINT.getLong(output.build(), 0), 42L);
        assertEquals(binding.getOutputType(), BIGINT);
        assertEquals(binding.getName(), "value");
    }

    @Test
    public void testMergeFailure()
    {
        AggregateValueBinding binding = binding(CaptureAggregation::new, 1, 0);

        assertPrestoExceptionThrownBy(
                () -> binding.merge(binding.createInstance(), binding.createInstance()),
                FUNCTION_EXECUTION_FAILURE,
                "capture(bigint, varchar):bigint failed to merge value");
    }

    private static AggregateValueBinding binding(Supplier<? extends AggregateFunction> factory, Integer... channels)
    {
        AggregateFunctionImplementation implementation = new AggregateFunctionImplementation(
                "capture",
                ImmutableList.of(BIGINT, VARCHAR),
                BIGINT,
                FunctionDocumentation.UNDOCUMENTED,
                factory);
        return new AggregateValueBinding("value", implementation, Arrays.asList(channels), CONTEXT);
    }

    private static class CaptureAggregation
            implements AggregateFunction
    {
        private final Object result;
        private final List<List<Object>> calls = new ArrayList<>();
        private FunctionContext context;

        CaptureAggregation()
        {
            this(0L);
        }

        CaptureAggregation(Object result)
        {
            this.result = result;
        }

        @Override
        public void update(FunctionContext context, Object... arguments)
        {
            this.context = context;
            calls.add(Arrays.asList(arguments.clone()));
        }

        @Override
        public void merge(FunctionContext context, AggregateFunction other)
        {
            throw new UnsupportedOperationException("merge");
        }

        @Override
        public Object evaluate(FunctionContext context)
        {
            return result;
        }
    }
}
