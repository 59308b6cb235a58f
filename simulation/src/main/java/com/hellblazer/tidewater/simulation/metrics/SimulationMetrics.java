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
package com.hellblazer.tidewater.simulation.metrics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * System and per-entity KPIs of one run. Maps iterate in configuration order.
 *
 * @param overallServiceLevel Mean customer service level, 0 with no customer metrics
 * @param totalStockoutEvents Consumption steps that left a customer at zero inventory
 * @param customerMetrics     By customer id, only customers with at least one consumption step
 * @param shipMetrics         By ship id, every ship
 */
public record SimulationMetrics(double overallServiceLevel, long totalStockoutEvents,
                                Map<String, CustomerMetrics> customerMetrics, Map<String, ShipMetrics> shipMetrics) {

    public SimulationMetrics {
        customerMetrics = Collections.unmodifiableMap(new LinkedHashMap<>(customerMetrics));
        shipMetrics = Collections.unmodifiableMap(new LinkedHashMap<>(shipMetrics));
    }
}
