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
package io.rowflow.metadata;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import io.rowflow.spi.function.FunctionDocumentation;

import java.util.List;
import java.util.Objects;

import static com.google.common.base.MoreObjects.toStringHelper;
import static java.util.Objects.requireNonNull;

public class FunctionMetadata
{
    private final String name;
    private final List<String> argumentTypes;
    private final String returnType;
    private final FunctionDocumentation documentation;

    @JsonCreator
    public FunctionMetadata(
            @JsonProperty("name") String name,
            @JsonProperty("argumentTypes") List<String> argumentTypes,
            @JsonProperty("returnType") String returnType,
            @JsonProperty("documentation") FunctionDocumentation documentation)
    {
        this.name = requireNonNull(name, "name is null");
        this.argumentTypes = ImmutableList.copyOf(requireNonNull(argumentTypes, "argumentTypes is null"));
        this.returnType = requireNonNull(returnType, "returnType is null");
        this.documentation = requireNonNull(documentation, "documentation is null");
    }

    @JsonProperty
    public String getName()
    {
        return name;
    }

    @JsonProperty
    public List<String> getArgumentTypes()
    {
        return argumentTypes;
    }

    @JsonProperty
    public String getReturnType()
    {
        return returnType;
    }

    @JsonProperty
    public FunctionDocumentation getDocumentation()
    {
        return documentation;
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
        FunctionMetadata other = (FunctionMetadata) obj;
        return name.equals(other.name) &&
                argumentTypes.equals(other.argumentTypes) &&
                returnType.equals(other.returnType) &&
                documentation.equals(other.documentation);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(name, argumentTypes, returnType, documentation);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("name", name)
                .add("argumentTypes", argumentTypes)
                .add("returnType", returnType)
                .toString();
    }
}
