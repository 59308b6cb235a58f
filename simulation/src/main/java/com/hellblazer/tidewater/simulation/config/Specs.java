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
 * Field checks shared by the configuration records.
 */
final class Specs {

    private Specs() {
    }

    static void require(String entity, String id, String field, Object value) {
        if (value == null) {
            throw new MalformedConfigurationException(
            String.format("%s %s: missing required field '%s'", entity, id == null ? "<unknown>" : id, field));
        }
    }

    static void nonNegative(String entity, String id, String field, double value) {
        if (!(value >= 0.0) || Double.isInfinite(value)) {
            throw new MalformedConfigurationException(
            String.format("%s %s: '%s' must be a finite non-negative number, was %s", entity, id, field, value));
        }
    }

    static void positive(String entity, String id, String field, double value) {
        if (!(value > 0.0) || Double.isInfinite(value)) {
            throw new MalformedConfigurationException(
            String.format("%s %s: '%s' must be a finite positive number, was %s", entity, id, field, value));
        }
    }
}
