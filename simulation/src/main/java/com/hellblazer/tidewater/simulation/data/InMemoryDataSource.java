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
package com.hellblazer.tidewater.simulation.data;

import com.hellblazer.tidewater.simulation.SimulationResults;
import com.hellblazer.tidewater.simulation.config.CustomerSpec;
import com.hellblazer.tidewater.simulation.config.ShipSpec;
import com.hellblazer.tidewater.simulation.entity.DistanceMatrix;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Data source holding its snapshot in memory and keeping every saved result.
 *
 * @author hal.hildebrand
 */
public class InMemoryDataSource implements SupplyDataSource {
    private final List<ShipSpec>          ships;
    private final List<CustomerSpec>      customers;
    private final DistanceMatrix          distances;
    private final Map<String, Object>     params;
    private final List<SimulationResults> saved = Collections.synchronizedList(new ArrayList<>());

    public InMemoryDataSource(List<ShipSpec> ships, List<CustomerSpec> customers, DistanceMatrix distances,
                              Map<String, ?> params) {
        this.ships = List.copyOf(ships);
        this.customers = List.copyOf(customers);
        this.distances = distances;
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    @Override
    public List<ShipSpec> getShipsData() {
        return ships;
    }

    @Override
    public List<CustomerSpec> getCustomersData() {
        return customers;
    }

    @Override
    public DistanceMatrix getDistanceMatrix() {
        return distances;
    }

    @Override
    public Map<String, Object> getSimulationParams() {
        return params;
    }

    @Override
    public void saveResults(SimulationResults results) {
        saved.add(results);
    }

    public List<SimulationResults> getSavedResults() {
        return List.copyOf(saved);
    }
}
