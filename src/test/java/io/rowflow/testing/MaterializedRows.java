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
package io.rowflow.testing;

import com.facebook.presto.common.Page;
import com.google.common.collect.ImmutableList;
import io.airlift.slice.Slice;
import io.rowflow.spi.RowBatch;
import io.rowflow.spi.RowDescriptor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static io.rowflow.type.NativeValues.readNativeValue;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Row-wise view of batches for assertions. VARCHAR values are materialized as
 * strings and nulls are kept.
 */
public final class MaterializedRows
{
    private MaterializedRows() {}

    public static List<Object> row(Object... values)
    {
        return Arrays.asList(values);
    }

    public static List<List<Object>> toRows(RowDescriptor descriptor, RowBatch batch)
    {
        Page page = batch.getPage();
        ImmutableList.Builder<List<Object>> rows = ImmutableList.builder();
        for (int position = 0; position < page.getPositionCount(); position++) {
            List<Object> row = new ArrayList<>(descriptor.size());
            for (int channel = 0; channel < descriptor.size(); channel++) {
                Object value = readNativeValue(descriptor.getType(channel), page.getBlock(channel), position);
                if (value instanceof Slice) {
                    value = ((Slice) value).toStringUtf8();
                }
                row.add(value);
            }
            rows.add(row);
        }
        return rows.build();
    }

    @SafeVarargs
    public static void assertRowsEqualIgnoreOrder(RowDescriptor descriptor, RowBatch batch, List<Object>... expected)
    {
        assertRowsEqualIgnoreOrder(toRows(descriptor, batch), ImmutableList.copyOf(expected));
    }

    public static void assertRowsEqualIgnoreOrder(List<List<Object>> actual, List<List<Object>> expected)
    {
        assertThat(actual).containsExactlyInAnyOrderElementsOf(expected);
    }
}
