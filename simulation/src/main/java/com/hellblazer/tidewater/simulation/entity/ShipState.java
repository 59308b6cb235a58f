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

/**
 * Operational state of a {@link Ship}. Only {@link #IDLE} ships can be dispatched.
 *
 * @author hal.hildebrand
 */
public enum ShipState {
    IDLE,
    /** Selected by the dispatcher, delivery not yet under way */
    ASSIGNED,
    TRAVELING,
    UNLOADING,
    /** Held at the port before loading */
    WAITING,
    LOADING;

    public boolean isEngaged() {
        return this != IDLE;
    }
}
