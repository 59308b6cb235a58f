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

import com.hellblazer.tidewater.simulation.entity.CustomerSite;
import com.hellblazer.tidewater.simulation.entity.Ship;
import com.hellblazer.tidewater.simulation.event.SupplyEvent;
import com.hellblazer.tidewater.simulation.metrics.SimulationMetrics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * The document handed to the data source at the end of a run.
 * <p>
 * Serialized shape:
 * <pre>
 * {metadata:{...}, events:[...], metrics:{...}, ships_history:[...], customers_history:[...]}
 * </pre>
 *
 * @author hal.hildebrand
 */
public record SimulationResults(Metadata metadata, List<SupplyEvent> events, SimulationMetrics metrics,
                                List<JourneyRow> shipsHistory, List<InventoryRow> customersHistory) {

    public SimulationResults {
        events = List.copyOf(events);
        shipsHistory = List.copyOf(shipsHistory);
        customersHistory = List.copyOf(customersHistory);
    }

    /**
     * @param startTime       wall clock start, ISO-8601
     * @param endTime         wall clock end, ISO-8601
     * @param durationSeconds wall clock duration of the run
     * @param params          effective parameters, overrides applied
     * @param eventCounts     events per kind, by wire name
     * @param failedProcesses processes that terminated abnormally
     */
    public record Metadata(String startTime, String endTime, double durationSeconds, Map<String, Object> params,
                           int numShips, int numCustomers, Map<String, Long> eventCounts, long failedProcesses) {
    }

    /**
     * One journey of one ship, flattened for tabular consumers.
     */
    public record JourneyRow(String shipId, String shipName, String departure, String destination,
                             double departureTime, double arrivalTime, double cargo) {
    }

    /**
     * One consumption step of one customer, flattened for tabular consumers.
     */
    public record InventoryRow(String customerId, String customerName, double time, double inventory, double demand,
                               double fulfilled, double shortage) {
    }

    static List<JourneyRow> shipsHistory(Collection<Ship> ships) {
        var rows = new ArrayList<JourneyRow>();
        for (var ship : ships) {
            for (var journey : ship.travelHistory()) {
                rows.add(new JourneyRow(ship.id(), ship.name(), journey.departure(), journey.destination(),
                                        journey.departureTime(), journey.arrivalTime(), journey.cargo()));
            }
        }
        return rows;
    }

    static List<InventoryRow> customersHistory(Collection<CustomerSite> customers) {
        var rows = new ArrayList<InventoryRow>();
        for (var customer : customers) {
            for (var record : customer.inventoryHistory()) {
                rows.add(new InventoryRow(customer.id(), customer.name(), record.time(), record.inventory(),
                                          record.demand(), record.fulfilled(), record.shortage()));
            }
        }
        return rows;
    }
}
