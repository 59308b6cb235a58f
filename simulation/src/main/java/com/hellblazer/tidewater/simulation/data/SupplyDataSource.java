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

import java.util.List;
import java.util.Map;

/**
 * Source of the configuration snapshot and sink for run results.
 * <p>
 * Reads happen once, when a simulation is constructed. {@link #saveResults(SimulationResults)} is called once at the
 * end of every run; failures there are logged by the caller and never invalidate the results already computed.
 *
 * @author hal.hildebrand
 */
public interface SupplyDataSource {

    List<ShipSpec> getShipsData();

    List<CustomerSpec> getCustomersData();

    DistanceMatrix getDistanceMatrix();

    /**
     * @return raw named parameter values, validated later against {@code SimulationParams}
     */
    Map<String, Object> getSimulationParams();

    void saveResults(SimulationResults results);
}
