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
import com.google.common.collect.ImmutableList;
import org.testng.annotations.Test;

import java.util.List;

import static com.facebook.presto.common.type.BigintType.BIGINT;
import static com.facebook.presto.common.type.VarcharType.VARCHAR;
import static io.rowflow.RowBatchesBuilder.rowBatchesBuilder;
import static io.rowflow.spi.RowDescriptor.rowDescriptor;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

public class TestRowDescriptor
{
    @Test
    public void testDescriptor()
    {
        RowDescriptor descriptor = rowDescriptor(VARCHAR, BIGINT);

        assertEquals(descriptor.size(), 2);
        assertEquals(descriptor.getTypes(), ImmutableList.of(VARCHAR, BIGINT));
        assertEquals(descriptor.getType(1), BIGINT);
        assertEquals(descriptor.toDisplayString(), "[varchar, bigint]");
        assertEquals(descriptor, new RowDescriptor(ImmutableList.of(VARCHAR, BIGINT)));
        assertThatThrownBy(() -> descriptor.getType(2))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    public void testMatches()
    {
        Page page = rowBatchesBuilder(VARCHAR, BIGINT).row("a", 1L).batch().build().get(0).getPage();

        assertTrue(rowDescriptor(VARCHAR, BIGINT).matches(page));
        assertFalse(rowDescriptor(VARCHAR).matches(page));
    }

    @Test
    public void testRowBatch()
    {
        RowBatch batch = rowBatchesBuilder(BIGINT).row(1L).row(2L).endOfWindow().build().get(0);

        assertEquals(batch.getPositionCount(), 2);
        assertEquals(batch.getChannelCount(), 1);
        assertTrue(batch.isEndOfWindow());
        assertFalse(batch.isEndOfStream());
        assertTrue(batch.closesWindow());
        assertEquals(batch.getDescriptor(), rowDescriptor(BIGINT));
        assertEquals(batch.toString(), "RowBatch{positions=2, types=[bigint], eow=true, eos=false}");
    }

    @Test
    public void testRowBatchChannelsMustMatchDescriptor()
    {
        Page page = rowBatchesBuilder(BIGINT).row(1L).batch().build().get(0).getPage();

        assertThatThrownBy(() -> new RowBatch(rowDescriptor(BIGINT, BIGINT), page, false, false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("page has 1 channels but descriptor is [bigint, bigint]");
    }

    @Test
    public void testEndOfStreamClosesWindow()
    {
        List<RowBatch> batches = rowBatchesBuilder(BIGINT)
                .batch()
                .endOfStream()
                .build();

        assertFalse(batches.get(0).closesWindow());
        assertFalse(batches.get(1).isEndOfWindow());
        assertTrue(batches.get(1).closesWindow());
    }
}
