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
package io.rowflow.metadata;

import com.facebook.presto.common.type.Type;
import com.google.common.collect.ImmutableList;
import io.rowflow.spi.function.AggregateFunction;
import io.rowflow.spi.function.FunctionDocumentation;

import java.util.List;
import java.util.function.Supplier;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static io.rowflow.type.NativeValues.isSupported;
import static java.util.Locale.ENGLISH;
import static java.util.Objects.requireNonNull;

/**
 * A concrete overload of an aggregate: name, static argument types, return type and
 * the factory producing fresh per-group instances.
 */
public final class AggregateFunctionImplementation
{
    private final String name;
    private final List<Type> argumentTypes;
    private final Type returnType;
    private final FunctionDocumentation documentation;
    private final Supplier<? extends AggregateFunction> factory;

    public AggregateFunctionImplementation(
            String name,
            List<? extends Type> argumentTypes,
            Type returnType,
            FunctionDocumentation documentation,
            Supplier<? extends AggregateFunction> factory)
    {
        requireNonNull(name, "name is null");
        checkArgument(!name.isEmpty(), "name is empty");
        this.name = name.toLowerCase(ENGLISH);
        this.argumentTypes = ImmutableList.copyOf(requireNonNull(argumentTypes, "argumentTypes is null"));
        this.returnType = requireNonNull(returnType, "returnType is null");
        this.documentation = requireNonNull(documentation, "documentation is null");
        this.factory = requireNonNull(factory, "factory is null");

        for (Type argumentType : this.argumentTypes) {
            checkArgument(isSupported(argumentType), "Unsupported argument type %s for function %s", argumentType.getDisplayName(), name);
        }
        checkArgument(isSupported(returnType), "Unsupported return type %s for function %s", returnType.getDisplayName(), name);
    }

    public String getName()
    {
        return name;
    }

    public List<Type> getArgumentTypes()
    {
        return argumentTypes;
    }

    public Type getReturnType()
    {
        return returnType;
    }

    public FunctionDocumentation getDocumentation()
    {
        return documentation;
    }

    public AggregateFunction createInstance()
    {
        return requireNonNull(factory.get(), () -> "factory of " + getSignature() + " returned null");
    }

    public FunctionMetadata getMetadata()
    {
        return new FunctionMetadata(
                name,
                argumentTypes.stream()
                        .map(Type::getDisplayName)
                        .collect(toImmutableList()),
                returnType.getDisplayName(),
                documentation);
    }

    public String getSignature()
    {
        return formatSignature(name, argumentTypes) + ":" + returnType.getDisplayName();
    }

    static String formatSignature(String name, List<? extends Type> argumentTypes)
    {
        return name + argumentTypes.stream()
                .map(Type::getDisplayName)
                .collect(toImmutableList())
                .toString()
                .replace('[', '(')
                .replace(']', ')');
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("signature", getSignature())
                .toString();
    }
}
