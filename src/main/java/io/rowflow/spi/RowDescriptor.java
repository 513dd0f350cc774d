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
package io.rowflow.spi;

import com.facebook.presto.common.Page;
import com.facebook.presto.common.type.Type;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Objects.requireNonNull;

/**
 * Ordered column types of a row batch.
 */
public final class RowDescriptor
{
    private final List<Type> types;

    public RowDescriptor(List<? extends Type> types)
    {
        this.types = ImmutableList.copyOf(requireNonNull(types, "types is null"));
    }

    public static RowDescriptor rowDescriptor(Type... types)
    {
        return new RowDescriptor(ImmutableList.copyOf(types));
    }

    public List<Type> getTypes()
    {
        return types;
    }

    public Type getType(int column)
    {
        checkElementIndex(column, types.size(), "column");
        return types.get(column);
    }

    public int size()
    {
        return types.size();
    }

    public boolean matches(Page page)
    {
        return page.getChannelCount() == types.size();
    }

    public String toDisplayString()
    {
        return types.stream()
                .map(Type::getDisplayName)
                .collect(toImmutableList())
                .toString();
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
        RowDescriptor other = (RowDescriptor) obj;
        return types.equals(other.types);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(types);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("types", toDisplayString())
                .toString();
    }
}
