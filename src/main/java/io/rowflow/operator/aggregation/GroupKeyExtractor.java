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
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static io.rowflow.type.NativeValues.isSupported;
import static io.rowflow.type.NativeValues.readNativeValue;
import static io.rowflow.type.NativeValues.writeNativeValue;
import static java.util.Objects.requireNonNull;

/**
 * Reads the group key of a row from pre-resolved channels.
 */
public class GroupKeyExtractor
{
    private final int[] channels;
    private final List<Type> types;

    public GroupKeyExtractor(List<Integer> channels, List<? extends Type> types)
    {
        this.channels = Ints.toArray(requireNonNull(channels, "channels is null"));
        this.types = ImmutableList.copyOf(requireNonNull(types, "types is null"));
        checkArgument(this.channels.length == this.types.size(), "channels and types do not match");
        for (Type type : this.types) {
            checkArgument(isSupported(type), "Unsupported group-by type %s", type.getDisplayName());
        }
    }

    public List<Type> getTypes()
    {
        return types;
    }

    public int getArity()
    {
        return channels.length;
    }

    /**
     * The returned key may share slices with the page; call {@link GroupKey#detach()}
     * before keeping it past the current batch.
     */
    public GroupKey extract(Page page, int position)
    {
        if (channels.length == 0) {
            return GroupKey.EMPTY;
        }
        Object[] values = new Object[channels.length];
        for (int i = 0; i < channels.length; i++) {
            values[i] = normalizeZero(readNativeValue(types.get(i), page.getBlock(channels[i]), position));
        }
        return GroupKey.wrap(values);
    }

    // Double.equals tells -0.0 from 0.0 but keeps NaN equal to NaN
    private static Object normalizeZero(Object value)
    {
        if (value instanceof Double && (Double) value == 0.0) {
            return 0.0;
        }
        return value;
    }

    public void appendTo(GroupKey key, BlockBuilder[] blockBuilders, int offset)
    {
        checkArgument(key.size() == channels.length, "key %s does not have %s components", key, channels.length);
        for (int i = 0; i < channels.length; i++) {
            writeNativeValue(types.get(i), blockBuilders[offset + i], key.get(i));
        }
    }
}
