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

import com.hellblazer.tidewater.simulation.config.ConfigurationSnapshot;
import com.hellblazer.tidewater.simulation.config.CustomerSpec;
import com.hellblazer.tidewater.simulation.config.ShipSpec;
import com.hellblazer.tidewater.simulation.data.SupplyDataSource;
import com.hellblazer.tidewater.simulation.entity.DistanceMatrix;
import com.hellblazer.tidewater.simulation.event.EventKind;
import com.hellblazer.tidewater.simulation.metrics.MetricsEngine;
import com.hellblazer.tidewater.simulation.process.ConsumptionProcess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The resupply simulation engine.
 * <p>
 * Lifecycle of {@link #run()}:
 * <ol>
 *   <li>Validate the configuration snapshot and build fresh ships and customers</li>
 *   <li>Start one consumption process per customer, in configuration order</li>
 *   <li>Drive the scheduler to the horizon</li>
 *   <li>Compute metrics from the event log and final entity state</li>
 *   <li>Hand the results document to the data source, best effort</li>
 * </ol>
 * Every run rebuilds its state from the snapshot, so the same configuration always yields the same event log and
 * metrics.
 * <p>
 * Usage:
 * <pre>
 * var simulation = new SupplySimulation(new JsonDataSource(dataDir), Map.of("loading_rate", 8000.0));
 * var results = simulation.run();
 * log.info("Service level {}", results.metrics().overallServiceLevel());
 * </pre>
 *
 * @author hal.hildebrand
 */
public class SupplySimulation {
    private static final Logger log = LoggerFactory.getLogger(SupplySimulation.class);

    private final SupplyDataSource    dataSource;
    private final List<ShipSpec>      shipsData;
    private final List<CustomerSpec>  customersData;
    private final DistanceMatrix      distanceMatrix;
    private final Map<String, Object> simulationParams;
    private final Map<String, Object> overrides;
    private       SimulationContext   context;

    public SupplySimulation(SupplyDataSource dataSource) {
        this(dataSource, Map.of());
    }

    /**
     * Read the configuration from the data source.
     *
     * @param overrides parameter values replacing the data source's, applied before setup
     */
    public SupplySimulation(SupplyDataSource dataSource, Map<String, ?> overrides) {
        this.dataSource = dataSource;
        this.shipsData = dataSource.getShipsData();
        this.customersData = dataSource.getCustomersData();
        this.distanceMatrix = dataSource.getDistanceMatrix();
        var params = dataSource.getSimulationParams();
        this.simulationParams = params == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        this.overrides = Collections.unmodifiableMap(new LinkedHashMap<>(overrides));
    }

    /**
     * Build a fresh context from the configuration.
     *
     * @throws SimulationException.MalformedConfigurationException when the configuration is unusable
     */
    public SimulationContext setup() {
        var snapshot = ConfigurationSnapshot.of(shipsData, customersData, distanceMatrix, simulationParams,
                                                overrides);
        context = new SimulationContext(snapshot);
        return context;
    }

    public SimulationResults run() {
        var context = setup();
        var params = context.params();
        var start = Instant.now();
        log.info("Starting simulation: {} ships, {} customers, horizon {}h, step {}h", context.ships().size(),
                 context.customers().size(), params.simulationDuration(), params.timeStep());

        for (var customer : context.customers()) {
            context.start(new ConsumptionProcess(context, customer));
        }
        context.scheduler().run(params.simulationDuration());

        var end = Instant.now();
        var metrics = MetricsEngine.compute(context.eventLog(), context.ships(), context.customers(),
                                            context.distances(), params);
        var eventCounts = new LinkedHashMap<String, Long>();
        context.eventLog().countsByKind().forEach((kind, count) -> eventCounts.put(kind.wireName(), count));
        var metadata = new SimulationResults.Metadata(start.toString(), end.toString(),
                                                      Duration.between(start, end).toNanos() / 1e9, params.asMap(),
                                                      context.ships().size(), context.customers().size(),
                                                      eventCounts, context.scheduler().getFailures());
        var results = new SimulationResults(metadata, context.eventLog().events(), metrics,
                                            SimulationResults.shipsHistory(context.ships()),
                                            SimulationResults.customersHistory(context.customers()));

        log.info("Simulation finished: {} events, {} stockouts, {} failed deliveries, overall service level {}",
                 context.eventLog().size(), metrics.totalStockoutEvents(),
                 eventCounts.get(EventKind.DELIVERY_FAILED.wireName()),
                 String.format("%.4f", metrics.overallServiceLevel()));
        save(results);
        return results;
    }

    /**
     * @return the context of the most recent setup, or null before the first
     */
    public SimulationContext getContext() {
        return context;
    }

    private void save(SimulationResults results) {
        try {
            dataSource.saveResults(results);
        } catch (RuntimeException e) {
            log.warn("Unable to save simulation results, returning them in memory only", e);
        }
    }
}
