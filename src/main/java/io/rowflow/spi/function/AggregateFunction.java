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
package io.rowflow.spi.function;

/**
 * A user defined aggregate. Each instance owns the running state of one group for
 * one aggregate expression and is only ever called by the thread driving its
 * operator. Implementations must not touch state shared outside the instance.
 */
public interface AggregateFunction
{
    /**
     * Folds one row into the state. Arguments arrive in declared order as native
     * values ({@code Long}, {@code Double}, {@code Boolean}, {@code Slice}) or
     * {@code null}. Slices and the argument array itself are only valid for the
     * duration of the call.
     */
    void update(FunctionContext context, Object... arguments);

    /**
     * Folds the state of another instance created by the same implementation
     * into this one. {@code other} is not used afterwards.
     */
    void merge(FunctionContext context, AggregateFunction other);

    /**
     * Returns the final value as a native value of the declared return type.
     */
    Object evaluate(FunctionContext context);
}
