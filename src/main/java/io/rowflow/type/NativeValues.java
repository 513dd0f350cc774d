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
package io.rowflow.type;

import com.facebook.presto.common.block.Block;
import com.facebook.presto.common.block.BlockBuilder;
import com.facebook.presto.common.type.Type;
import io.airlift.slice.Slice;
import io.airlift.slice.Slices;

import static java.lang.String.format;

/**
 * Moves single values between blocks and their Java stack representation:
 * {@code long} as {@link Long}, {@code double} as {@link Double}, {@code boolean}
 * as {@link Boolean} and variable width values as {@link Slice}. SQL null is
 * {@code null}.
 */
public final class NativeValues
{
    private NativeValues() {}

    public static boolean isSupported(Type type)
    {
        Class<?> javaType = type.getJavaType();
        return javaType == long.class ||
                javaType == double.class ||
                javaType == boolean.class ||
                javaType == Slice.class;
    }

    public static Object readNativeValue(Type type, Block block, int position)
    {
        if (block.isNull(position)) {
            return null;
        }
        Class<?> javaType = type.getJavaType();
        if (javaType == long.class) {
            return type.getLong(block, position);
        }
        if (javaType == double.class) {
            return type.getDouble(block, position);
        }
        if (javaType == boolean.class) {
            return type.getBoolean(block, position);
        }
        if (javaType == Slice.class) {
            return type.getSlice(block, position);
        }
        throw new IllegalArgumentException(format("Unsupported type %s", type.getDisplayName()));
    }

    public static void writeNativeValue(Type type, BlockBuilder blockBuilder, Object value)
    {
        if (value == null) {
            blockBuilder.appendNull();
            return;
        }
        Class<?> javaType = type.getJavaType();
        if (javaType == long.class) {
            type.writeLong(blockBuilder, ((Number) value).longValue());
        }
        else if (javaType == double.class) {
            type.writeDouble(blockBuilder, ((Number) value).doubleValue());
        }
        else if (javaType == boolean.class) {
            type.writeBoolean(blockBuilder, (Boolean) value);
        }
        else if (javaType == Slice.class) {
            Slice slice = value instanceof String ? Slices.utf8Slice((String) value) : (Slice) value;
            type.writeSlice(blockBuilder, slice, 0, slice.length());
        }
        else {
            throw new IllegalArgumentException(format("Unsupported type %s", type.getDisplayName()));
        }
    }
}
