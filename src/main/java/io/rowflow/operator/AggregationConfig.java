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

import com.facebook.airlift.configuration.Config;
import com.facebook.airlift.configuration.ConfigDescription;

import javax.validation.constraints.Min;

public class AggregationConfig
{
    private int expectedGroups = 1024;
    private int maxGroups = Integer.MAX_VALUE;

    @Min(1)
    public int getExpectedGroups()
    {
        return expectedGroups;
    }

    @Config("aggregation.expected-groups")
    @ConfigDescription("Initial capacity of the group table")
    public AggregationConfig setExpectedGroups(int expectedGroups)
    {
        this.expectedGroups = expectedGroups;
        return this;
    }

    @Min(1)
    public int getMaxGroups()
    {
        return maxGroups;
    }

    @Config("aggregation.max-groups")
    @ConfigDescription("Maximum number of groups buffered by one aggregation before the query fails")
    public AggregationConfig setMaxGroups(int maxGroups)
    {
        this.maxGroups = maxGroups;
        return this;
    }
}
