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
package io.rowflow.sql.planner.plan;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Resources;
import org.testng.annotations.Test;

import java.io.IOException;

import static io.rowflow.sql.planner.plan.AggregateExpression.call;
import static io.rowflow.sql.planner.plan.ColumnReference.column;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;

public class TestAggregationNode
{
    @Test
    public void testFromJson()
            throws IOException
    {
        String json = Resources.toString(Resources.getResource(getClass(), "windowed-aggregation.json"), UTF_8);

        AggregationNode node = AggregationNode.fromJson(json);

        assertEquals(node.getId(), new PlanNodeId("http_stats"));
        assertTrue(node.isWindowed());
        assertEquals(node.getGroups(), ImmutableList.of(column(2, 0), column(2, 3)));
        assertEquals(node.getValues(), ImmutableList.of(call("count", column(2, 1)), call("avg", column(2, 2))));
        assertEquals(node.getOutputNames(), ImmutableList.of("service", "status", "requests", "mean_latency"));
        assertEquals(node, AggregationNode.builder("http_stats")
                .windowed(true)
                .group("service", column(2, 0))
                .group("status", column(2, 3))
                .value("requests", call("count", column(2, 1)))
                .value("mean_latency", call("avg", column(2, 2)))
                .build());
    }

    @Test
    public void testMissingListsAreEmpty()
    {
        AggregationNode node = AggregationNode.fromJson("{\"id\": \"global\"}");

        assertFalse(node.isWindowed());
        assertTrue(node.getGroups().isEmpty());
        assertTrue(node.getGroupNames().isEmpty());
        assertTrue(node.getValues().isEmpty());
        assertTrue(node.getValueNames().isEmpty());
    }

    @Test
    public void testJsonRoundTrip()
    {
        AggregationNode node = AggregationNode.builder("agg")
                .group("key", column(0, 1))
                .value("minsum", call("minsum", column(0, 0), column(0, 1)))
                .build();

        assertEquals(AggregationNode.fromJson(node.toJson()), node);
    }

    @Test
    public void testToString()
    {
        assertEquals(column(3, 7).toString(), "#3:7");
        assertEquals(call("minsum", column(0, 0), column(0, 1)).toString(), "minsum(#0:0, #0:1)");
        assertEquals(new PlanNodeId("agg").toString(), "agg");
    }

    @Test
    public void testInvalidColumnReference()
    {
        assertThatThrownBy(() -> column(-1, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> column(0, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
