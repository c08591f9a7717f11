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

import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Ordering;

import java.util.Collection;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * A set of NFA states, used as the identity of a DFA state.
 *
 * <p>The labels are kept sorted, so two instances are equal (and hash alike)
 * exactly when they hold the same labels, regardless of insertion order.
 */
public record StateSet(ImmutableSortedSet<String> states)
{
    public StateSet
    {
        requireNonNull(states, "states is null");
        checkArgument(!states.isEmpty(), "state set is empty");
        states = ImmutableSortedSet.copyOf(Ordering.natural(), states);
    }

    public static StateSet of(String... states)
    {
        return new StateSet(ImmutableSortedSet.copyOf(states));
    }

    public static StateSet copyOf(Collection<String> states)
    {
        return new StateSet(ImmutableSortedSet.copyOf(states));
    }

    public boolean contains(String state)
    {
        return states.contains(state);
    }

    public boolean intersects(Set<String> other)
    {
        for (String state : states) {
            if (other.contains(state)) {
                return true;
            }
        }
        return false;
    }

    public int size()
    {
        return states.size();
    }

    /**
     * Renders the labels as {@code {A B C}}.
     */
    public String label()
    {
        return "{" + String.join(" ", states) + "}";
    }

    @Override
    public String toString()
    {
        return label();
    }
}
