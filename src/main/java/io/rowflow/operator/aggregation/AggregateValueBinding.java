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
import com.facebook.presto.common.type.Type;
import com.facebook.presto.spi.PrestoException;
import com.google.common.primitives.Ints;
import io.rowflow.metadata.AggregateFunctionImplementation;
import io.rowflow.spi.function.AggregateFunction;
import io.rowflow.spi.function.FunctionContext;

import java.util.List;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static io.rowflow.RowflowErrorCode.FUNCTION_EXECUTION_FAILURE;
import static io.rowflow.RowflowErrorCode.FUNCTION_INSTANTIATION_FAILURE;
import static io.rowflow.type.NativeValues.readNativeValue;
import static io.rowflow.type.NativeValues.writeNativeValue;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Binds one aggregate expression of the plan to its resolved implementation and
 * argument channels. All calls into the aggregate function go through here so
 * failures inside user code surface with a proper error code.
 */
public class AggregateValueBinding
{
    private final String name;
    private final AggregateFunctionImplementation implementation;
    private final int[] argumentChannels;
    private final FunctionContext context;
    private final Object[] arguments;

    public AggregateValueBinding(String name, AggregateFunctionImplementation implementation, List<Integer> argumentChannels, FunctionContext context)
    {
        this.name = requireNonNull(name, "name is null");
        this.implementation = requireNonNull(implementation, "implementation is null");
        this.argumentChannels = Ints.toArray(requireNonNull(argumentChannels, "argumentChannels is null"));
        this.context = requireNonNull(context, "context is null");
        checkArgument(
                this.argumentChannels.length == implementation.getArgumentTypes().size(),
                "%s expects %s arguments, got %s",
                implementation.getSignature(),
                implementation.getArgumentTypes().size(),
                this.argumentChannels.length);
        this.arguments = new Object[this.argumentChannels.length];
    }

    public String getName()
    {
        return name;
    }

    public AggregateFunctionImplementation getImplementation()
    {
        return implementation;
    }

    public Type getOutputType()
    {
        return implementation.getReturnType();
    }

    public AggregateFunction createInstance()
    {
        try {
            return implementation.createInstance();
        }
        catch (RuntimeException e) {
            throw new PrestoException(FUNCTION_INSTANTIATION_FAILURE, format("Failed to create an instance of %s for %s", implementation.getSignature(), name), e);
        }
    }

    public void update(AggregateFunction function, Page page, int position)
    {
        List<Type> argumentTypes = implementation.getArgumentTypes();
        for (int i = 0; i < argumentChannels.length; i++) {
            arguments[i] = readNativeValue(argumentTypes.get(i), page.getBlock(argumentChannels[i]), position);
        }
        try {
            function.update(context, arguments);
        }
        catch (PrestoException e) {
            throw e;
        }
        catch (RuntimeException e) {
            throw new PrestoException(FUNCTION_EXECUTION_FAILURE, format("%s failed to update %s", implementation.getSignature(), name), e);
        }
        finally {
            // do not keep the batch reachable through the argument slots
            for (int i = 0; i < arguments.length; i++) {
                arguments[i] = null;
            }
        }
    }

    public void merge(AggregateFunction target, AggregateFunction source)
    {
        try {
            target.merge(context, source);
        }
        catch (PrestoException e) {
            throw e;
        }
        catch (RuntimeException e) {
            throw new PrestoException(FUNCTION_EXECUTION_FAILURE, format("%s failed to merge %s", implementation.getSignature(), name), e);
        }
    }

    public void evaluate(AggregateFunction function, BlockBuilder output)
    {
        Object value;
        try {
            value = function.evaluate(context);
        }
        catch (PrestoException e) {
            throw e;
        }
        catch (RuntimeException e) {
            throw new PrestoException(FUNCTION_EXECUTION_FAILURE, format("%s failed to evaluate %s", implementation.getSignature(), name), e);
        }
        try {
            writeNativeValue(implementation.getReturnType(), output, value);
        }
        catch (ClassCastException e) {
            throw new PrestoException(FUNCTION_EXECUTION_FAILURE, format("%s returned %s which is not a %s", implementation.getSignature(), value.getClass().getSimpleName(), implementation.getReturnType().getDisplayName()), e);
        }
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("name", name)
                .add("function", implementation.getSignature())
                .add("argumentChannels", argumentChannels)
                .toString();
    }
}
