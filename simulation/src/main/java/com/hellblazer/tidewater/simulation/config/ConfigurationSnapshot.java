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
package com.hellblazer.tidewater.simulation.config;

import com.hellblazer.tidewater.simulation.SimulationException.MalformedConfigurationException;
import com.hellblazer.tidewater.simulation.entity.DistanceMatrix;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable input to one run: ships, customers, distances and parameters with overrides applied.
 *
 * @author hal.hildebrand
 */
public record ConfigurationSnapshot(List<ShipSpec> ships, List<CustomerSpec> customers, DistanceMatrix distances,
                                    SimulationParams params) {

    public ConfigurationSnapshot {
        if (ships == null) {
            throw new MalformedConfigurationException("Missing ships configuration");
        }
        if (customers == null) {
            throw new MalformedConfigurationException("Missing customers configuration");
        }
        if (distances == null) {
            throw new MalformedConfigurationException("Missing distance matrix");
        }
        if (params == null) {
            throw new MalformedConfigurationException("Missing simulation parameters");
        }
        ships = List.copyOf(ships);
        customers = List.copyOf(customers);
        unique("ship", ships.stream().map(ShipSpec::id).toList());
        unique("customer", customers.stream().map(CustomerSpec::id).toList());
    }

    /**
     * Merge raw parameter values with overrides and validate the result.
     *
     * @param rawParams named values from the data source, which may carry extra names
     * @param overrides values replacing the raw ones, applied before validation; every name must be a parameter
     */
    public static ConfigurationSnapshot of(List<ShipSpec> ships, List<CustomerSpec> customers,
                                           DistanceMatrix distances, Map<String, ?> rawParams,
                                           Map<String, ?> overrides) {
        if (rawParams == null) {
            throw new MalformedConfigurationException("Missing simulation parameters");
        }
        SimulationParams.requireKnown(overrides);
        var merged = new LinkedHashMap<String, Object>(rawParams);
        merged.putAll(overrides);
        return new ConfigurationSnapshot(ships, customers, distances, SimulationParams.from(merged));
    }

    private static void unique(String entity, List<String> ids) {
        var seen = new HashSet<String>();
        for (var id : ids) {
            if (!seen.add(id)) {
                throw new MalformedConfigurationException("Duplicate " + entity + " id '" + id + "'");
            }
        }
    }
}
