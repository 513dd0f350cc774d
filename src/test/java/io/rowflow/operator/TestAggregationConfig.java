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
package io.rowflow.operator;

import com.google.common.collect.ImmutableMap;
import org.testng.annotations.Test;

import java.util.Map;

import static com.facebook.airlift.configuration.testing.ConfigAssertions.assertFullMapping;
import static com.facebook.airlift.configuration.testing.ConfigAssertions.assertRecordedDefaults;
import static com.facebook.airlift.configuration.testing.ConfigAssertions.recordDefaults;

public class TestAggregationConfig
{
    @Test
    public void testDefaults()
    {
        assertRecordedDefaults(recordDefaults(AggregationConfig.class)
                .setExpectedGroups(1024)
                .setMaxGroups(Integer.MAX_VALUE));
    }

    @Test
    public void testExplicitPropertyMappings()
    {
        Map<String, String> properties = new ImmutableMap.Builder<String, String>()
                .put("aggregation.expected-groups", "16")
                .put("aggregation.max-groups", "100000")
                .build();

        AggregationConfig expected = new AggregationConfig()
                .setExpectedGroups(16)
                .setMaxGroups(100_000);

        assertFullMapping(properties, expected);
    }
}
