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

/**
 * Wire names of the {@link SupplyEvent} variants.
 *
 * @author hal.hildebrand
 */
public enum EventKind {
    CONSUMPTION("consumption"),
    DELIVERY_STARTED("delivery_started"),
    SHIP_ARRIVED("ship_arrived"),
    DELIVERY_FAILED("delivery_failed"),
    DELIVERY_COMPLETED("delivery_completed"),
    RESUPPLY_STARTED("resupply_started"),
    RESUPPLY_COMPLETED("resupply_completed"),
    PROCESS_FAILED("process_failed");

    private final String wireName;

    EventKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
