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

import io.airlift.slice.Slice;
import io.airlift.slice.Slices;

import java.util.Arrays;

import static com.google.common.base.Preconditions.checkElementIndex;
import static java.util.Objects.requireNonNull;

/**
 * Composite key of one group: the native values of the group-by columns of a row,
 * in declared order. Components are compared with {@code equals}, which is exact
 * for {@code Long}, {@code Double} and {@code Boolean} and byte-wise for
 * {@link Slice}. A SQL null component equals another null.
 * <p>
 * An aggregation without group-by columns puts every row into {@link #EMPTY}.
 */
public final class GroupKey
{
    public static final GroupKey EMPTY = new GroupKey(new Object[0]);

    private final Object[] values;
    private final int hashCode;

    private GroupKey(Object[] values)
    {
        this.values = values;
        this.hashCode = Arrays.hashCode(values);
    }

    public static GroupKey of(Object... values)
    {
        requireNonNull(values, "values is null");
        if (values.length == 0) {
            return EMPTY;
        }
        return new GroupKey(values.clone());
    }

    static GroupKey wrap(Object[] values)
    {
        if (values.length == 0) {
            return EMPTY;
        }
        return new GroupKey(values);
    }

    public int size()
    {
        return values.length;
    }

    public Object get(int index)
    {
        checkElementIndex(index, values.length, "index");
        return values[index];
    }

    /**
     * Returns a key that does not share memory with the batch it was read from.
     */
    public GroupKey detach()
    {
        Object[] copy = null;
        for (int i = 0; i < values.length; i++) {
            if (values[i] instanceof Slice) {
                if (copy == null) {
                    copy = values.clone();
                }
                copy[i] = Slices.copyOf((Slice) values[i]);
            }
        }
        return copy == null ? this : new GroupKey(copy);
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
        GroupKey other = (GroupKey) obj;
        return hashCode == other.hashCode && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode()
    {
        return hashCode;
    }

    @Override
    public String toString()
    {
        StringBuilder builder = new StringBuilder("(");
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                builder.append(", ");
            }
            Object value = values[i];
            builder.append(value instanceof Slice ? ((Slice) value).toStringUtf8() : value);
        }
        return builder.append(')').toString();
    }
}
