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
package com.hellblazer.tidewater.simulation.entity;

import com.hellblazer.tidewater.simulation.SimulationException.MalformedConfigurationException;
import com.hellblazer.tidewater.simulation.SimulationException.RouteNotFoundException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Immutable location to location distances. A missing entry is a routing error, not a zero distance.
 *
 * @author hal.hildebrand
 */
public final class DistanceMatrix {
    private final Map<String, Map<String, Double>> distances;

    private DistanceMatrix(Map<String, Map<String, Double>> distances) {
        this.distances = distances;
    }

    /**
     * Copy the supplied matrix, keeping its iteration order.
     *
     * @throws MalformedConfigurationException if any distance is negative or not a number
     */
    public static DistanceMatrix of(Map<String, ? extends Map<String, ? extends Number>> source) {
        var copy = new LinkedHashMap<String, Map<String, Double>>();
        source.forEach((from, row) -> {
            var targets = new LinkedHashMap<String, Double>();
            row.forEach((to, value) -> {
                if (value == null) {
                    throw new MalformedConfigurationException("Missing distance from " + from + " to " + to);
                }
                var d = value.doubleValue();
                if (!(d >= 0.0)) {
                    throw new MalformedConfigurationException(
                    "Distance from " + from + " to " + to + " must be non-negative: " + d);
                }
                targets.put(to, d);
            });
            copy.put(from, Collections.unmodifiableMap(targets));
        });
        return new DistanceMatrix(Collections.unmodifiableMap(copy));
    }

    public static DistanceMatrix empty() {
        return new DistanceMatrix(Map.of());
    }

    /**
     * @return the distance between the two locations
     * @throws RouteNotFoundException when the matrix has no such entry
     */
    public double distance(String from, String to) {
        return find(from, to).orElseThrow(() -> new RouteNotFoundException(from, to));
    }

    public OptionalDouble find(String from, String to) {
        var row = distances.get(from);
        if (row == null) {
            return OptionalDouble.empty();
        }
        var d = row.get(to);
        return d == null ? OptionalDouble.empty() : OptionalDouble.of(d);
    }

    public boolean hasRoute(String from, String to) {
        return find(from, to).isPresent();
    }

    /**
     * @return unmodifiable view of the underlying matrix
     */
    public Map<String, Map<String, Double>> asMap() {
        return distances;
    }

    @Override
    public String toString() {
        return "DistanceMatrix" + distances;
    }
}
