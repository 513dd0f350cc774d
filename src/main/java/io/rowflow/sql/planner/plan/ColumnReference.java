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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A column of the output of another plan node.
 */
public final class ColumnReference
{
    private final int sourceNodeId;
    private final int columnIndex;

    @JsonCreator
    public ColumnReference(
            @JsonProperty("sourceNodeId") int sourceNodeId,
            @JsonProperty("columnIndex") int columnIndex)
    {
        checkArgument(sourceNodeId >= 0, "sourceNodeId is negative");
        checkArgument(columnIndex >= 0, "columnIndex is negative");
        this.sourceNodeId = sourceNodeId;
        this.columnIndex = columnIndex;
    }

    public static ColumnReference column(int sourceNodeId, int columnIndex)
    {
        return new ColumnReference(sourceNodeId, columnIndex);
    }

    @JsonProperty
    public int getSourceNodeId()
    {
        return sourceNodeId;
    }

    @JsonProperty
    public int getColumnIndex()
    {
        return columnIndex;
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
        ColumnReference other = (ColumnReference) obj;
        return sourceNodeId == other.sourceNodeId && columnIndex == other.columnIndex;
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(sourceNodeId, columnIndex);
    }

    @Override
    public String toString()
    {
        return "#" + sourceNodeId + ":" + columnIndex;
    }
}
