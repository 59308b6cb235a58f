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

import com.hellblazer.tidewater.simulation.metrics.SimulationMetrics;

/**
 * Metrics of one run of a {@link ParameterStudy}.
 *
 * @param paramName  The varied parameter
 * @param paramValue The value used for this run
 * @param metrics    The run's metrics
 */
public record StudyResult(String paramName, Object paramValue, SimulationMetrics metrics) {
}
