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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Named run parameters. Times are in hours, rates in units per hour.
 * <p>
 * {@code simulation_duration} and {@code time_step} are required; everything else has a default. A duration of zero
 * or less is a valid, empty run. Names outside {@link #NAMES} may accompany the parameters and are ignored.
 *
 * @param simulationDuration    Horizon of the run
 * @param timeStep              Consumption interval, positive
 * @param resupplyThresholdDays Days of supply below which a customer asks for a delivery
 * @param loadingRate           Port loading rate, positive
 * @param unloadingRate         Customer unloading rate, positive
 * @param portResupplyDelay     Fixed wait at the port before loading, non-negative
 * @param randomSeed            Seed recorded with the run for reproducibility
 * @param portLocation          The location where ships reload
 * @param shipSpeedMultiplier   Factor applied to every ship's speed at setup, positive
 */
public record SimulationParams(double simulationDuration, double timeStep, double resupplyThresholdDays,
                               double loadingRate, double unloadingRate, double portResupplyDelay, long randomSeed,
                               String portLocation, double shipSpeedMultiplier) {

    private static final Logger log = LoggerFactory.getLogger(SimulationParams.class);

    public static final String SIMULATION_DURATION     = "simulation_duration";
    public static final String TIME_STEP               = "time_step";
    public static final String RESUPPLY_THRESHOLD_DAYS = "resupply_threshold_days";
    public static final String LOADING_RATE            = "loading_rate";
    public static final String UNLOADING_RATE          = "unloading_rate";
    public static final String PORT_RESUPPLY_DELAY     = "port_resupply_delay";
    public static final String RANDOM_SEED             = "random_seed";
    public static final String PORT_LOCATION           = "port_location";
    public static final String SHIP_SPEED_MULTIPLIER   = "ship_speed_multiplier";

    public static final List<String> NAMES = List.of(SIMULATION_DURATION, TIME_STEP, RESUPPLY_THRESHOLD_DAYS,
                                                     LOADING_RATE, UNLOADING_RATE, PORT_RESUPPLY_DELAY, RANDOM_SEED,
                                                     PORT_LOCATION, SHIP_SPEED_MULTIPLIER);

    public static final double DEFAULT_RESUPPLY_THRESHOLD_DAYS = 3.0;
    public static final double DEFAULT_LOADING_RATE            = 5000.0;
    public static final double DEFAULT_UNLOADING_RATE          = 4000.0;
    public static final double DEFAULT_PORT_RESUPPLY_DELAY     = 12.0;
    public static final long   DEFAULT_RANDOM_SEED             = 42L;
    public static final String DEFAULT_PORT_LOCATION           = "port_main";

    public SimulationParams {
        if (!(timeStep > 0.0) || Double.isInfinite(timeStep)) {
            throw invalid(TIME_STEP, timeStep, "a finite positive number");
        }
        if (Double.isNaN(simulationDuration) || Double.isInfinite(simulationDuration)) {
            throw invalid(SIMULATION_DURATION, simulationDuration, "a finite number");
        }
        if (Double.isNaN(resupplyThresholdDays)) {
            throw invalid(RESUPPLY_THRESHOLD_DAYS, resupplyThresholdDays, "a number");
        }
        if (!(loadingRate > 0.0)) {
            throw invalid(LOADING_RATE, loadingRate, "positive");
        }
        if (!(unloadingRate > 0.0)) {
            throw invalid(UNLOADING_RATE, unloadingRate, "positive");
        }
        if (!(portResupplyDelay >= 0.0) || Double.isInfinite(portResupplyDelay)) {
            throw invalid(PORT_RESUPPLY_DELAY, portResupplyDelay, "a finite non-negative number");
        }
        if (!(shipSpeedMultiplier > 0.0) || Double.isInfinite(shipSpeedMultiplier)) {
            throw invalid(SHIP_SPEED_MULTIPLIER, shipSpeedMultiplier, "a finite positive number");
        }
        if (portLocation == null || portLocation.isBlank()) {
            throw invalid(PORT_LOCATION, portLocation, "a location name");
        }
    }

    /**
     * Build parameters from named values, applying defaults for the optional ones.
     *
     * @throws MalformedConfigurationException on a missing required value or a value of the wrong type
     */
    public static SimulationParams from(Map<String, ?> values) {
        for (var name : values.keySet()) {
            if (!NAMES.contains(name)) {
                log.debug("Ignoring extra simulation parameter '{}'", name);
            }
        }
        return new SimulationParams(required(values, SIMULATION_DURATION), required(values, TIME_STEP),
                                    optional(values, RESUPPLY_THRESHOLD_DAYS, DEFAULT_RESUPPLY_THRESHOLD_DAYS),
                                    optional(values, LOADING_RATE, DEFAULT_LOADING_RATE),
                                    optional(values, UNLOADING_RATE, DEFAULT_UNLOADING_RATE),
                                    optional(values, PORT_RESUPPLY_DELAY, DEFAULT_PORT_RESUPPLY_DELAY),
                                    seed(values), port(values), optional(values, SHIP_SPEED_MULTIPLIER, 1.0));
    }

    /**
     * Reject names that are not simulation parameters. Overrides are checked this way so a misspelled name fails the
     * run instead of being ignored.
     *
     * @throws MalformedConfigurationException naming the first unknown parameter
     */
    public static void requireKnown(Map<String, ?> values) {
        for (var name : values.keySet()) {
            if (!NAMES.contains(name)) {
                throw new MalformedConfigurationException("Unknown simulation parameter '" + name + "'");
            }
        }
    }

    /**
     * @return every parameter by name, in canonical order
     */
    public Map<String, Object> asMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put(SIMULATION_DURATION, simulationDuration);
        map.put(TIME_STEP, timeStep);
        map.put(RESUPPLY_THRESHOLD_DAYS, resupplyThresholdDays);
        map.put(LOADING_RATE, loadingRate);
        map.put(UNLOADING_RATE, unloadingRate);
        map.put(PORT_RESUPPLY_DELAY, portResupplyDelay);
        map.put(RANDOM_SEED, randomSeed);
        map.put(PORT_LOCATION, portLocation);
        map.put(SHIP_SPEED_MULTIPLIER, shipSpeedMultiplier);
        return map;
    }

    private static double required(Map<String, ?> values, String name) {
        var value = values.get(name);
        if (value == null) {
            throw new MalformedConfigurationException("Missing required simulation parameter '" + name + "'");
        }
        return number(name, value).doubleValue();
    }

    private static double optional(Map<String, ?> values, String name, double defaultValue) {
        var value = values.get(name);
        return value == null ? defaultValue : number(name, value).doubleValue();
    }

    private static long seed(Map<String, ?> values) {
        var value = values.get(RANDOM_SEED);
        return value == null ? DEFAULT_RANDOM_SEED : number(RANDOM_SEED, value).longValue();
    }

    private static String port(Map<String, ?> values) {
        var value = values.get(PORT_LOCATION);
        if (value == null) {
            return DEFAULT_PORT_LOCATION;
        }
        if (!(value instanceof String s)) {
            throw new MalformedConfigurationException(
            "Simulation parameter '" + PORT_LOCATION + "' must be a string, was " + value);
        }
        return s;
    }

    private static Number number(String name, Object value) {
        if (value instanceof Number n) {
            return n;
        }
        throw new MalformedConfigurationException("Simulation parameter '" + name + "' must be numeric, was " + value);
    }

    private static MalformedConfigurationException invalid(String name, Object value, String expected) {
        return new MalformedConfigurationException(
        "Simulation parameter '" + name + "' must be " + expected + ", was " + value);
    }
}
