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
package io.rowflow.spi.function;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Objects.requireNonNull;

public final class FunctionDocumentation
{
    public static final FunctionDocumentation UNDOCUMENTED = builder("").build();

    private final String brief;
    private final Optional<String> details;
    private final List<Argument> arguments;
    private final Optional<String> returns;
    private final List<String> examples;

    @JsonCreator
    public FunctionDocumentation(
            @JsonProperty("brief") String brief,
            @JsonProperty("details") Optional<String> details,
            @JsonProperty("arguments") List<Argument> arguments,
            @JsonProperty("returns") Optional<String> returns,
            @JsonProperty("examples") List<String> examples)
    {
        this.brief = requireNonNull(brief, "brief is null");
        this.details = requireNonNull(details, "details is null");
        this.arguments = ImmutableList.copyOf(requireNonNull(arguments, "arguments is null"));
        this.returns = requireNonNull(returns, "returns is null");
        this.examples = ImmutableList.copyOf(requireNonNull(examples, "examples is null"));
    }

    public static Builder builder(String brief)
    {
        return new Builder(brief);
    }

    @JsonProperty
    public String getBrief()
    {
        return brief;
    }

    @JsonProperty
    public Optional<String> getDetails()
    {
        return details;
    }

    @JsonProperty
    public List<Argument> getArguments()
    {
        return arguments;
    }

    @JsonProperty
    public Optional<String> getReturns()
    {
        return returns;
    }

    @JsonProperty
    public List<String> getExamples()
    {
        return examples;
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
        FunctionDocumentation other = (FunctionDocumentation) obj;
        return brief.equals(other.brief) &&
                details.equals(other.details) &&
                arguments.equals(other.arguments) &&
                returns.equals(other.returns) &&
                examples.equals(other.examples);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(brief, details, arguments, returns, examples);
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("brief", brief)
                .add("arguments", arguments)
                .toString();
    }

    public static final class Argument
    {
        private final String name;
        private final String description;

        @JsonCreator
        public Argument(
                @JsonProperty("name") String name,
                @JsonProperty("description") String description)
        {
            this.name = requireNonNull(name, "name is null");
            this.description = requireNonNull(description, "description is null");
        }

        @JsonProperty
        public String getName()
        {
            return name;
        }

        @JsonProperty
        public String getDescription()
        {
            return description;
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
            Argument other = (Argument) obj;
            return name.equals(other.name) && description.equals(other.description);
        }

        @Override
        public int hashCode()
        {
            return Objects.hash(name, description);
        }

        @Override
        public String toString()
        {
            return name + ": " + description;
        }
    }

    public static final class Builder
    {
        private final String brief;
        private String details;
        private final ImmutableList.Builder<Argument> arguments = ImmutableList.builder();
        private String returns;
        private final ImmutableList.Builder<String> examples = ImmutableList.builder();

        private Builder(String brief)
        {
            this.brief = requireNonNull(brief, "brief is null");
        }

        public Builder details(String details)
        {
            this.details = requireNonNull(details, "details is null");
            return this;
        }

        public Builder argument(String name, String description)
        {
            arguments.add(new Argument(name, description));
            return this;
        }

        public Builder returns(String returns)
        {
            this.returns = requireNonNull(returns, "returns is null");
            return this;
        }

        /**
         * Adds an example. Multi-line examples may use a leading {@code |} margin
         * on every line, which is stripped along with the indentation before it.
         */
        public Builder example(String example)
        {
            requireNonNull(example, "example is null");
            checkArgument(!example.trim().isEmpty(), "example is empty");
            examples.add(stripMargin(example));
            return this;
        }

        public FunctionDocumentation build()
        {
            return new FunctionDocumentation(brief, Optional.ofNullable(details), arguments.build(), Optional.ofNullable(returns), examples.build());
        }

        private static String stripMargin(String example)
        {
            if (!example.contains("|")) {
                return example;
            }
            List<String> lines = Splitter.on('\n').splitToList(example).stream()
                    .map(String::trim)
                    .filter(line -> !line.isEmpty())
                    .map(line -> line.startsWith("|") ? line.substring(1).trim() : line)
                    .collect(toImmutableList());
            return String.join("\n", lines) + "\n";
        }
    }
}
