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

import com.facebook.airlift.log.Logger;
import com.facebook.presto.common.type.Type;
import com.facebook.presto.spi.PrestoException;
import com.google.common.collect.ImmutableList;
import io.rowflow.operator.aggregation.builtin.BuiltinAggregations;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static io.rowflow.RowflowErrorCode.UNKNOWN_FUNCTION;
import static io.rowflow.metadata.AggregateFunctionImplementation.formatSignature;
import static java.lang.String.format;
import static java.util.Locale.ENGLISH;
import static java.util.Objects.requireNonNull;

/**
 * Aggregate functions keyed by lower-cased name and exact argument types.
 * Registration happens during setup; lookups happen once per operator open.
 */
public class FunctionRegistry
{
    private static final Logger log = Logger.get(FunctionRegistry.class);

    private final String name;
    private final Map<FunctionKey, AggregateFunctionImplementation> functions = new LinkedHashMap<>();

    public FunctionRegistry(String name)
    {
        this.name = requireNonNull(name, "name is null");
    }

    public static FunctionRegistry createWithBuiltins()
    {
        FunctionRegistry registry = new FunctionRegistry("builtin");
        BuiltinAggregations.getImplementations().forEach(registry::register);
        return registry;
    }

    public String getName()
    {
        return name;
    }

    public FunctionRegistry register(AggregateFunctionImplementation implementation)
    {
        requireNonNull(implementation, "implementation is null");
        FunctionKey key = new FunctionKey(implementation.getName(), implementation.getArgumentTypes());
        checkArgument(!functions.containsKey(key), "Function %s is already registered in %s", implementation.getSignature(), name);
        functions.put(key, implementation);
        log.debug("Registered aggregate %s in %s", implementation.getSignature(), name);
        return this;
    }

    public boolean isRegistered(String functionName, List<? extends Type> argumentTypes)
    {
        return functions.containsKey(new FunctionKey(functionName, argumentTypes));
    }

    public AggregateFunctionImplementation resolve(String functionName, List<? extends Type> argumentTypes)
    {
        requireNonNull(functionName, "functionName is null");
        requireNonNull(argumentTypes, "argumentTypes is null");

        AggregateFunctionImplementation implementation = functions.get(new FunctionKey(functionName, argumentTypes));
        if (implementation != null) {
            return implementation;
        }

        String lowerCaseName = functionName.toLowerCase(ENGLISH);
        List<String> candidates = functions.values().stream()
                .filter(function -> function.getName().equals(lowerCaseName))
                .map(AggregateFunctionImplementation::getSignature)
                .collect(toImmutableList());
        String requested = formatSignature(lowerCaseName, argumentTypes);
        if (candidates.isEmpty()) {
            throw new PrestoException(UNKNOWN_FUNCTION, format("Function %s not registered", requested));
        }
        throw new PrestoException(UNKNOWN_FUNCTION, format("Unexpected parameters for function %s. Expected one of: %s", requested, String.join(", ", candidates)));
    }

    public List<FunctionMetadata> listFunctions()
    {
        return functions.values().stream()
                .sorted(Comparator.comparing(AggregateFunctionImplementation::getName)
                        .thenComparing(AggregateFunctionImplementation::getSignature))
                .map(AggregateFunctionImplementation::getMetadata)
                .collect(toImmutableList());
    }

    private static final class FunctionKey
    {
        private final String name;
        private final List<Type> argumentTypes;

        private FunctionKey(String name, List<? extends Type> argumentTypes)
        {
            this.name = requireNonNull(name, "name is null").toLowerCase(ENGLISH);
            this.argumentTypes = ImmutableList.copyOf(requireNonNull(argumentTypes, "argumentTypes is null"));
        }

        @Override
        public boolean equals(Object obj)
        {
            if (this == obj) {
                return true;
            }
            if (obj == null || getClass() != obj.getClass()) {
                return false;
            }
            FunctionKey other = (FunctionKey) obj;
            return name.equals(other.name) && argumentTypes.equals(other.argumentTypes);
        }

        @Override
        public int hashCode()
        {
            return Objects.hash(name, argumentTypes);
        }
    }
}
