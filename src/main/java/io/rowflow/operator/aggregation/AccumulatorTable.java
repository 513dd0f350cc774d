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
import com.facebook.presto.spi.PrestoException;
import com.google.common.collect.ImmutableList;
import io.rowflow.spi.function.AggregateFunction;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.Maps.newHashMapWithExpectedSize;
import static io.rowflow.RowflowErrorCode.EXCEEDED_GROUP_LIMIT;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Maps every group key seen since the last reset to its running aggregate state.
 * The table is owned by a single operator and is not thread safe.
 * <p>
 * Iteration order of {@link #getEntries()} is the hash order of the keys and
 * carries no meaning.
 */
public class AccumulatorTable
{
    private final GroupKeyExtractor keyExtractor;
    private final List<AggregateValueBinding> bindings;
    private final int expectedGroups;
    private final int maxGroups;

    private Map<GroupKey, AccumulatorEntry> entries;
    private boolean closed;

    public AccumulatorTable(GroupKeyExtractor keyExtractor, List<AggregateValueBinding> bindings, int expectedGroups, int maxGroups)
    {
        this.keyExtractor = requireNonNull(keyExtractor, "keyExtractor is null");
        this.bindings = ImmutableList.copyOf(requireNonNull(bindings, "bindings is null"));
        checkArgument(expectedGroups > 0, "expectedGroups must be positive");
        checkArgument(maxGroups > 0, "maxGroups must be positive");
        this.expectedGroups = keyExtractor.getArity() == 0 ? 1 : expectedGroups;
        this.maxGroups = maxGroups;
        this.entries = newHashMapWithExpectedSize(this.expectedGroups);
    }

    /**
     * Folds every row of the page into its group. A failure leaves the groups
     * updated by earlier rows of the same page as they are.
     */
    public void addPage(Page page)
    {
        checkState(!closed, "table is closed");
        requireNonNull(page, "page is null");

        int positionCount = page.getPositionCount();
        for (int position = 0; position < positionCount; position++) {
            GroupKey key = keyExtractor.extract(page, position);
            AccumulatorEntry entry = entries.get(key);
            if (entry == null) {
                entry = createEntry(key.detach());
            }
            for (int i = 0; i < bindings.size(); i++) {
                bindings.get(i).update(entry.getFunction(i), page, position);
            }
        }
    }

    /**
     * Folds the groups of another table built for the same aggregation into this one.
     */
    public void mergeFrom(AccumulatorTable other)
    {
        checkState(!closed, "table is closed");
        requireNonNull(other, "other is null");
        checkArgument(other != this, "cannot merge a table into itself");
        checkArgument(other.bindings.size() == bindings.size(), "tables have different aggregate expressions");
        checkArgument(other.keyExtractor.getTypes().equals(keyExtractor.getTypes()), "tables have different group-by types");

        for (AccumulatorEntry source : other.entries.values()) {
            AccumulatorEntry target = entries.get(source.getKey());
            if (target == null) {
                target = createEntry(source.getKey());
            }
            for (int i = 0; i < bindings.size(); i++) {
                bindings.get(i).merge(target.getFunction(i), source.getFunction(i));
            }
        }
    }

    public int getGroupCount()
    {
        return entries.size();
    }

    public boolean isEmpty()
    {
        return entries.isEmpty();
    }

    public Collection<AccumulatorEntry> getEntries()
    {
        return Collections.unmodifiableCollection(entries.values());
    }

    public GroupKeyExtractor getKeyExtractor()
    {
        return keyExtractor;
    }

    public List<AggregateValueBinding> getBindings()
    {
        return bindings;
    }

    /**
     * Drops every entry. Entries handed out before the reset must not be used again.
     */
    public void reset()
    {
        checkState(!closed, "table is closed");
        entries = newHashMapWithExpectedSize(expectedGroups);
    }

    public boolean isClosed()
    {
        return closed;
    }

    public void close()
    {
        closed = true;
        entries = Collections.emptyMap();
    }

    private AccumulatorEntry createEntry(GroupKey key)
    {
        if (entries.size() >= maxGroups) {
            throw new PrestoException(EXCEEDED_GROUP_LIMIT, format("Aggregation exceeded the limit of %s groups", maxGroups));
        }
        ImmutableList.Builder<AggregateFunction> functions = ImmutableList.builderWithExpectedSize(bindings.size());
        for (AggregateValueBinding binding : bindings) {
            functions.add(binding.createInstance());
        }
        AccumulatorEntry entry = new AccumulatorEntry(key, functions.build());
        entries.put(key, entry);
        return entry;
    }
}
