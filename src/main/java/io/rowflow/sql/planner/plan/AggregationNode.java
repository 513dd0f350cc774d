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

import com.facebook.airlift.json.JsonCodec;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

import static com.facebook.airlift.json.JsonCodec.jsonCodec;
import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

/**
 * Physical descriptor of a group-by aggregation. In blocking mode results are
 * produced once at end of stream; in windowed mode once per window.
 * <p>
 * Group and value names only label the output columns.
 */
public class AggregationNode
{
    private static final JsonCodec<AggregationNode> CODEC = jsonCodec(AggregationNode.class);

    private final PlanNodeId id;
    private final boolean windowed;
    private final List<ColumnReference> groups;
    private final List<String> groupNames;
    private final List<AggregateExpression> values;
    private final List<String> valueNames;

    @JsonCreator
    public AggregationNode(
            @JsonProperty("id") PlanNodeId id,
            @JsonProperty("windowed") boolean windowed,
            @JsonProperty("groups") List<ColumnReference> groups,
            @JsonProperty("groupNames") List<String> groupNames,
            @JsonProperty("values") List<AggregateExpression> values,
            @JsonProperty("valueNames") List<String> valueNames)
    {
        this.id = requireNonNull(id, "id is null");
        this.windowed = windowed;
        this.groups = copyOrEmpty(groups);
        this.groupNames = copyOrEmpty(groupNames);
        this.values = copyOrEmpty(values);
        this.valueNames = copyOrEmpty(valueNames);
    }

    public static AggregationNode fromJson(String json)
    {
        return CODEC.fromJson(json);
    }

    public String toJson()
    {
        return CODEC.toJson(this);
    }

    @JsonProperty
    public PlanNodeId getId()
    {
        return id;
    }

    @JsonProperty
    public boolean isWindowed()
    {
        return windowed;
    }

    @JsonProperty
    public List<ColumnReference> getGroups()
    {
        return groups;
    }

    @JsonProperty
    public List<String> getGroupNames()
    {
        return groupNames;
    }

    @JsonProperty
    public List<AggregateExpression> getValues()
    {
        return values;
    }

    @JsonProperty
    public List<String> getValueNames()
    {
        return valueNames;
    }

    public List<String> getOutputNames()
    {
        return ImmutableList.<String>builder()
                .addAll(groupNames)
                .addAll(valueNames)
                .build();
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
        AggregationNode other = (AggregationNode) obj;
        return windowed == other.windowed &&
                id.equals(other.id) &&
                groups.equals(other.groups) &&
                groupNames.equals(other.groupNames) &&
                values.equals(other.values) &&
                valueNames.equals(other.valueNames);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(id, windowed, groups, groupNames, values, valueNames);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("id", id)
                .add("windowed", windowed)
                .add("groups", groups)
                .add("values", values)
                .toString();
    }

    public static Builder builder(String id)
    {
        return new Builder(new PlanNodeId(id));
    }

    private static <T> List<T> copyOrEmpty(List<T> list)
    {
        return list == null ? ImmutableList.of() : ImmutableList.copyOf(list);
    }

    public static class Builder
    {
        private final PlanNodeId id;
        private boolean windowed;
        private final ImmutableList.Builder<ColumnReference> groups = ImmutableList.builder();
        private final ImmutableList.Builder<String> groupNames = ImmutableList.builder();
        private final ImmutableList.Builder<AggregateExpression> values = ImmutableList.builder();
        private final ImmutableList.Builder<String> valueNames = ImmutableList.builder();

        private Builder(PlanNodeId id)
        {
            this.id = requireNonNull(id, "id is null");
        }

        public Builder windowed(boolean windowed)
        {
            this.windowed = windowed;
            return this;
        }

        public Builder group(String name, ColumnReference column)
        {
            groups.add(column);
            groupNames.add(name);
            return this;
        }

        public Builder value(String name, AggregateExpression expression)
        {
            values.add(expression);
            valueNames.add(name);
            return this;
        }

        public AggregationNode build()
        {
            return new AggregationNode(id, windowed, groups.build(), groupNames.build(), values.build(), valueNames.build());
        }
    }
}
