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

/**
 * Configuration of one ship, as supplied by the data source.
 *
 * @param id              Unique ship identifier
 * @param name            Display name
 * @param capacity        Maximum cargo, non-negative
 * @param speed           Distance units per hour, positive
 * @param initialLocation Starting location
 * @param initialCargo    Starting cargo, non-negative; clamped to capacity when the ship is built
 */
public record ShipSpec(String id, String name, double capacity, double speed, String initialLocation,
                       double initialCargo) {
    public ShipSpec {
        Specs.require("ship", id, "id", id);
        Specs.require("ship", id, "name", name);
        Specs.require("ship", id, "initial_location", initialLocation);
        Specs.nonNegative("ship", id, "capacity", capacity);
        Specs.positive("ship", id, "speed", speed);
        Specs.nonNegative("ship", id, "initial_cargo", initialCargo);
    }

    public ShipSpec(String id, String name, double capacity, double speed, String initialLocation) {
        this(id, name, capacity, speed, initialLocation, 0.0);
    }
}
