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

import com.hellblazer.tidewater.kernel.Scheduler;
import com.hellblazer.tidewater.kernel.SimProcess;
import com.hellblazer.tidewater.simulation.SimulationException.RouteNotFoundException;
import com.hellblazer.tidewater.simulation.config.ConfigurationSnapshot;
import com.hellblazer.tidewater.simulation.config.SimulationParams;
import com.hellblazer.tidewater.simulation.dispatch.Dispatcher;
import com.hellblazer.tidewater.simulation.entity.CustomerSite;
import com.hellblazer.tidewater.simulation.entity.DistanceMatrix;
import com.hellblazer.tidewater.simulation.entity.Ship;
import com.hellblazer.tidewater.simulation.event.EventLog;
import com.hellblazer.tidewater.simulation.event.SupplyEvent;
import com.hellblazer.tidewater.simulation.process.VesselProcess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything one run shares: the scheduler, the ship and customer registries, the distances, the parameters, the
 * dispatcher and the event log. Built fresh from a {@link ConfigurationSnapshot} for every run and passed to every
 * process, so no state survives from one run to the next.
 *
 * @author hal.hildebrand
 */
public class SimulationContext {
    private static final Logger log = LoggerFactory.getLogger(SimulationContext.class);

    private final Scheduler                 scheduler;
    private final SimulationParams          params;
    private final DistanceMatrix            distances;
    private final Map<String, Ship>         ships     = new LinkedHashMap<>();
    private final Map<String, CustomerSite> customers = new LinkedHashMap<>();
    private final EventLog                  eventLog  = new EventLog();
    private final Dispatcher                dispatcher;

    public SimulationContext(ConfigurationSnapshot snapshot) {
        this(snapshot, new Dispatcher());
    }

    public SimulationContext(ConfigurationSnapshot snapshot, Dispatcher dispatcher) {
        this.params = snapshot.params();
        this.distances = snapshot.distances();
        this.dispatcher = dispatcher;
        this.scheduler = new Scheduler(this::processFailed);
        for (var spec : snapshot.ships()) {
            ships.put(spec.id(), new Ship(spec.id(), spec.name(), spec.capacity(),
                                          spec.speed() * params.shipSpeedMultiplier(), spec.initialLocation(),
                                          spec.initialCargo()));
        }
        for (var spec : snapshot.customers()) {
            customers.put(spec.id(),
                          new CustomerSite(spec.id(), spec.name(), spec.location(), spec.demandRate(),
                                           spec.initialInventory(), spec.minInventory(), spec.maxInventory()));
        }
    }

    public double now() {
        return scheduler.now();
    }

    public void emit(SupplyEvent event) {
        eventLog.append(event);
    }

    public void start(SimProcess process) {
        scheduler.start(process);
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    public SimulationParams params() {
        return params;
    }

    public DistanceMatrix distances() {
        return distances;
    }

    public Dispatcher dispatcher() {
        return dispatcher;
    }

    public EventLog eventLog() {
        return eventLog;
    }

    /**
     * @return ships in configuration order
     */
    public Collection<Ship> ships() {
        return Collections.unmodifiableCollection(ships.values());
    }

    /**
     * @return customers in configuration order
     */
    public Collection<CustomerSite> customers() {
        return Collections.unmodifiableCollection(customers.values());
    }

    public Ship ship(String id) {
        return ships.get(id);
    }

    public CustomerSite customer(String id) {
        return customers.get(id);
    }

    /**
     * A failed process is dropped; entities keep the state of its last completed step.
     */
    private void processFailed(SimProcess process, double time, RuntimeException failure) {
        var shipId = process instanceof VesselProcess vessel ? vessel.ship().id() : null;
        var reason = failure instanceof RouteNotFoundException ? SupplyEvent.ROUTE_NOT_FOUND
                                                               : SupplyEvent.UNEXPECTED_FAILURE;
        if (failure instanceof SimulationException) {
            log.warn("Process {} failed at {}: {}", process.name(), time, failure.getMessage());
        } else {
            log.warn("Process {} failed at {}", process.name(), time, failure);
        }
        eventLog.append(new SupplyEvent.ProcessFailed(time, process.name(), shipId, reason, failure.getMessage()));
    }
}
