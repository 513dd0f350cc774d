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
package io.rowflow.operator.aggregation.builtin;

import com.facebook.presto.common.type.Type;
import com.google.common.collect.ImmutableList;
import io.rowflow.metadata.AggregateFunctionImplementation;
import io.rowflow.spi.function.AggregateFunction;
import io.rowflow.spi.function.FunctionDocumentation;

import java.util.List;

import static com.facebook.presto.common.type.BigintType.BIGINT;
import static com.facebook.presto.common.type.BooleanType.BOOLEAN;
import static com.facebook.presto.common.type.DoubleType.DOUBLE;
import static com.facebook.presto.common.type.VarcharType.VARCHAR;
import static java.lang.String.format;

public final class BuiltinAggregations
{
    private static final List<Type> COUNTABLE_TYPES = ImmutableList.of(BIGINT, DOUBLE, BOOLEAN, VARCHAR);
    private static final List<Type> ORDERABLE_TYPES = ImmutableList.of(BIGINT, DOUBLE, VARCHAR);

    private static final FunctionDocumentation COUNT_DOCUMENTATION = FunctionDocumentation.builder("Counts the non-null values of its argument.")
            .argument("value", "The value to count")
            .returns("The number of non-null values, zero for an empty group.")
            .example("count(user_id)")
            .build();
    private static final FunctionDocumentation SUM_DOCUMENTATION = FunctionDocumentation.builder("Computes the sum of a list of numbers.")
            .details("Null values are ignored. Bigint sums fail on overflow.")
            .argument("value", "The argument to sum")
            .returns("The sum of all values, null when every value is null.")
            .example("sum(bytes_sent)")
            .build();
    private static final FunctionDocumentation AVERAGE_DOCUMENTATION = FunctionDocumentation.builder("Computes the arithmetic mean of a list of numbers.")
            .argument("value", "The argument to average")
            .returns("The mean as a double, null when every value is null.")
            .example("avg(latency_ms)")
            .build();
    private static final FunctionDocumentation MIN_DOCUMENTATION = FunctionDocumentation.builder("Returns the smallest value.")
            .argument("value", "The argument to compare")
            .returns("The minimum value, null when every value is null.")
            .example("min(latency_ms)")
            .build();
    private static final FunctionDocumentation MAX_DOCUMENTATION = FunctionDocumentation.builder("Returns the largest value.")
            .argument("value", "The argument to compare")
            .returns("The maximum value, null when every value is null.")
            .example("max(latency_ms)")
            .build();

    private BuiltinAggregations() {}

    public static List<AggregateFunctionImplementation> getImplementations()
    {
        ImmutableList.Builder<AggregateFunctionImplementation> builder = ImmutableList.builder();
        for (Type type : COUNTABLE_TYPES) {
            builder.add(new AggregateFunctionImplementation("count", ImmutableList.of(type), BIGINT, COUNT_DOCUMENTATION, CountAggregation::new));
        }
        builder.add(new AggregateFunctionImplementation("sum", ImmutableList.of(BIGINT), BIGINT, SUM_DOCUMENTATION, LongSumAggregation::new));
        builder.add(new AggregateFunctionImplementation("sum", ImmutableList.of(DOUBLE), DOUBLE, SUM_DOCUMENTATION, DoubleSumAggregation::new));
        builder.add(new AggregateFunctionImplementation("avg", ImmutableList.of(BIGINT), DOUBLE, AVERAGE_DOCUMENTATION, () -> new AverageAggregation(BIGINT)));
        builder.add(new AggregateFunctionImplementation("avg", ImmutableList.of(DOUBLE), DOUBLE, AVERAGE_DOCUMENTATION, () -> new AverageAggregation(DOUBLE)));
        for (Type type : ORDERABLE_TYPES) {
            builder.add(new AggregateFunctionImplementation("min", ImmutableList.of(type), type, MIN_DOCUMENTATION, () -> ExtremeValueAggregation.min(type)));
            builder.add(new AggregateFunctionImplementation("max", ImmutableList.of(type), type, MAX_DOCUMENTATION, () -> ExtremeValueAggregation.max(type)));
        }
        return builder.build();
    }

    static <T extends AggregateFunction> T checkSameKind(Class<T> expected, AggregateFunction other)
    {
        if (!expected.isInstance(other)) {
            throw new IllegalArgumentException(format("Cannot merge %s into %s", other == null ? null : other.getClass().getSimpleName(), expected.getSimpleName()));
        }
        return expected.cast(other);
    }
}
