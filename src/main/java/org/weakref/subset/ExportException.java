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
package org.weakref.subset;

import java.nio.file.Path;

import static java.lang.String.format;

/**
 * The rendered automaton could not be written to its destination.
 */
public class ExportException
        extends Exception
{
    private final Path destination;

    public ExportException(Path destination, Throwable cause)
    {
        super(format("Failed to write %s", destination), cause);
        this.destination = destination;
    }

    public Path getDestination()
    {
        return destination;
    }
}
