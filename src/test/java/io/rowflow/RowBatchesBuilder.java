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
package io.rowflow;

import com.facebook.presto.common.Page;
import com.facebook.presto.common.block.Block;
import com.facebook.presto.common.block.BlockBuilder;
import com.facebook.presto.common.type.Type;
import com.google.common.collect.ImmutableList;
import io.rowflow.spi.RowBatch;
import io.rowflow.spi.RowDescriptor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static io.rowflow.type.NativeValues.writeNativeValue;
import static java.util.Objects.requireNonNull;

/**
 * Builds a sequence of row batches. Rows are collected until one of the batch
 * methods seals them, together with the boundary tags, into the next batch.
 */
public class RowBatchesBuilder
{
    public static RowBatchesBuilder rowBatchesBuilder(Type... types)
    {
        return new RowBatchesBuilder(ImmutableList.copyOf(types));
    }

    private final List<Type> types;
    private final ImmutableList.Builder<RowBatch> batches = ImmutableList.builder();
    private final List<List<Object>> pendingRows = new ArrayList<>();

    private RowBatchesBuilder(List<Type> types)
    {
        this.types = requireNonNull(types, "types is null");
    }

    public RowDescriptor getDescriptor()
    {
        return new RowDescriptor(types);
    }

    public RowBatchesBuilder row(Object... values)
    {
        checkArgument(values.length == types.size(), "Expected %s values, but got %s", types.size(), values.length);
        pendingRows.add(Arrays.asList(values));
        return this;
    }

    public RowBatchesBuilder batch()
    {
        return batch(false, false);
    }

    public RowBatchesBuilder endOfWindow()
    {
        return batch(true, false);
    }

    public RowBatchesBuilder endOfStream()
    {
        return batch(false, true);
    }

    public RowBatchesBuilder endOfWindowAndStream()
    {
        return batch(true, true);
    }

    public RowBatchesBuilder batch(boolean endOfWindow, boolean endOfStream)
    {
        batches.add(new RowBatch(getDescriptor(), buildPage(), endOfWindow, endOfStream));
        pendingRows.clear();
        return this;
    }

    public List<RowBatch> build()
    {
        checkState(pendingRows.isEmpty(), "Rows were added after the last batch");
        return batches.build();
    }

    private Page buildPage()
    {
        Block[] blocks = new Block[types.size()];
        for (int channel = 0; channel < types.size(); channel++) {
            Type type = types.get(channel);
            BlockBuilder blockBuilder = type.createBlockBuilder(null, pendingRows.size());
            for (List<Object> row : pendingRows) {
                writeNativeValue(type, blockBuilder, row.get(channel));
            }
            blocks[channel] = blockBuilder.build();
        }
        return new Page(pendingRows.size(), blocks);
    }
}
