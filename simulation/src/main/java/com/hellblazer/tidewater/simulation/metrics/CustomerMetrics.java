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

/**
 * Service statistics of one customer site over a run.
 *
 * @param avgInventory  Mean inventory across consumption steps
 * @param minInventory  Lowest inventory seen after a consumption step
 * @param stockoutHours Hours spent at zero inventory
 * @param serviceLevel  Fraction of the run with inventory above zero
 */
public record CustomerMetrics(double avgInventory, double minInventory, double stockoutHours, double serviceLevel) {
}
