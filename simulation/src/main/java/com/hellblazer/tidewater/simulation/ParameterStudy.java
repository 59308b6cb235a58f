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

import com.hellblazer.tidewater.simulation.data.SupplyDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the simulation once per value of a single parameter. Every run gets its own {@link SupplySimulation} and
 * therefore its own entities, scheduler and event log, so results are comparable across values. Base overrides apply
 * to every run; the studied value replaces any base override of the same name.
 *
 * @author hal.hildebrand
 */
public class ParameterStudy {
    private static final Logger log = LoggerFactory.getLogger(ParameterStudy.class);

    private final SupplyDataSource    dataSource;
    private final Map<String, Object> baseOverrides;
    private final String              paramName;
    private final List<?>             paramValues;

    public ParameterStudy(SupplyDataSource dataSource, String paramName, List<?> paramValues) {
        this(dataSource, Map.of(), paramName, paramValues);
    }

    public ParameterStudy(SupplyDataSource dataSource, Map<String, ?> baseOverrides, String paramName,
                          List<?> paramValues) {
        this.dataSource = dataSource;
        this.baseOverrides = Map.copyOf(baseOverrides);
        this.paramName = paramName;
        this.paramValues = List.copyOf(paramValues);
    }

    public List<StudyResult> run() {
        var results = new ArrayList<StudyResult>();
        for (var value : paramValues) {
            log.info("Running simulation with {} = {}", paramName, value);
            var overrides = new LinkedHashMap<String, Object>(baseOverrides);
            overrides.put(paramName, value);
            var simulation = new SupplySimulation(dataSource, overrides);
            results.add(new StudyResult(paramName, value, simulation.run().metrics()));
        }
        return results;
    }
}
