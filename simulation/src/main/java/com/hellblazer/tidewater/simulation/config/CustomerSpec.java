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

/**
 * Configuration of one customer site, as supplied by the data source.
 *
 * @param demandRate units consumed per hour, non-negative
 */
public record CustomerSpec(String id, String name, String location, double demandRate, double initialInventory,
                           double minInventory, double maxInventory) {
    public CustomerSpec {
        Specs.require("customer", id, "id", id);
        Specs.require("customer", id, "name", name);
        Specs.require("customer", id, "location", location);
        Specs.nonNegative("customer", id, "demand_rate", demandRate);
        Specs.nonNegative("customer", id, "initial_inventory", initialInventory);
        Specs.nonNegative("customer", id, "min_inventory", minInventory);
        Specs.nonNegative("customer", id, "max_inventory", maxInventory);
        if (initialInventory > maxInventory) {
            throw new MalformedConfigurationException(
            String.format("customer %s: initial_inventory %.2f exceeds max_inventory %.2f", id, initialInventory,
                          maxInventory));
        }
    }
}
