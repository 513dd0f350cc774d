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

import static com.google.common.base.MoreObjects.toStringHelper;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * A page of rows exchanged between operators, described by its column types and
 * tagged with end-of-window and end-of-stream markers. The tags are kept exactly as produced; an end-of-stream
 * batch always closes the current window regardless of its end-of-window tag.
 */
public final class RowBatch
{
    private final RowDescriptor descriptor;
    private final Page page;
    private final boolean endOfWindow;
    private final boolean endOfStream;

    public RowBatch(RowDescriptor descriptor, Page page, boolean endOfWindow, boolean endOfStream)
    {
        this.descriptor = requireNonNull(descriptor, "descriptor is null");
        this.page = requireNonNull(page, "page is null");
        checkArgument(descriptor.matches(page), "page has %s channels but descriptor is %s", page.getChannelCount(), descriptor.toDisplayString());
        this.endOfWindow = endOfWindow;
        this.endOfStream = endOfStream;
    }

    public RowDescriptor getDescriptor()
    {
        return descriptor;
    }

    public Page getPage()
    {
        return page;
    }

    public int getPositionCount()
    {
        return page.getPositionCount();
    }

    public int getChannelCount()
    {
        return page.getChannelCount();
    }

    public boolean isEndOfWindow()
    {
        return endOfWindow;
    }

    public boolean isEndOfStream()
    {
        return endOfStream;
    }

    /**
     * End of stream also ends the current window.
     */
    public boolean closesWindow()
    {
        return endOfWindow || endOfStream;
    }

    @Override
    public String toString()
    {
        return toStringHelper(this)
                .add("positions", page.getPositionCount())
                .add("types", descriptor.toDisplayString())
                .add("eow", endOfWindow)
                .add("eos", endOfStream)
                .toString();
    }
}
