/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Tidewater Simulation Framework.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program.  If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.tidewater.simulation.event;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Append-only record of the events of one run, in emission order. Timestamps never decrease.
 *
 * @author hal.hildebrand
 */
public class EventLog {
    private final List<SupplyEvent> events = new ArrayList<>();

    /**
     * @throws IllegalStateException if the event is earlier than the last one appended
     */
    public void append(SupplyEvent event) {
        if (!events.isEmpty()) {
            var last = events.get(events.size() - 1);
            if (event.time() < last.time()) {
                throw new IllegalStateException(
                String.format("Event at %.4f emitted after event at %.4f: %s", event.time(), last.time(), event));
            }
        }
        events.add(event);
    }

    public List<SupplyEvent> events() {
        return Collections.unmodifiableList(events);
    }

    public <T extends SupplyEvent> Stream<T> ofType(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast);
    }

    public int size() {
        return events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    /**
     * @return number of events per kind, every kind present (possibly zero)
     */
    public Map<EventKind, Long> countsByKind() {
        var counts = new EnumMap<EventKind, Long>(EventKind.class);
        for (var kind : EventKind.values()) {
            counts.put(kind, 0L);
        }
        events.forEach(e -> counts.merge(e.kind(), 1L, Long::sum));
        return counts;
    }

    @Override
    public String toString() {
        return "EventLog{" + events.size() + " events}";
    }
}
