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
package com.hellblazer.tidewater.simulation;

/**
 * Sealed exception hierarchy for the resupply simulation.
 * <p>
 * Exception types:
 * <ul>
 * <li>{@link RouteNotFoundException} - a ship was asked to travel between locations the distance matrix does not
 * connect. Fatal to the process that issued the travel, never to the run.</li>
 * <li>{@link MalformedConfigurationException} - the configuration snapshot is missing a required field or holds an
 * invalid value. Fatal at setup, before the clock starts.</li>
 * </ul>
 *
 * @author hal.hildebrand
 */
public sealed class SimulationException extends RuntimeException
    permits SimulationException.RouteNotFoundException, SimulationException.MalformedConfigurationException {

    public SimulationException(String message) {
        super(message);
    }

    public SimulationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * No distance is known from one location to another.
     */
    public static final class RouteNotFoundException extends SimulationException {
        private final String from;
        private final String to;

        public RouteNotFoundException(String from, String to) {
            super(String.format("No route found from %s to %s", from, to));
            this.from = from;
            this.to = to;
        }

        public String getFrom() {
            return from;
        }

        public String getTo() {
            return to;
        }
    }

    /**
     * Ships, customers, distances or parameters could not be turned into a runnable configuration.
     */
    public static final class MalformedConfigurationException extends SimulationException {

        public MalformedConfigurationException(String message) {
            super(message);
        }

        public MalformedConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
