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

import com.hellblazer.tidewater.simulation.config.SimulationParams;
import com.hellblazer.tidewater.simulation.entity.CustomerSite;
import com.hellblazer.tidewater.simulation.entity.DistanceMatrix;
import com.hellblazer.tidewater.simulation.entity.Ship;
import com.hellblazer.tidewater.simulation.event.EventLog;
import com.hellblazer.tidewater.simulation.event.SupplyEvent;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Post-run aggregation of the event log and final entity state into {@link SimulationMetrics}.
 * <p>
 * Pure: reads its inputs, mutates nothing. Empty logs, zero customers and non-positive durations all produce
 * zeroed metrics rather than errors.
 *
 * @author hal.hildebrand
 */
public final class MetricsEngine {

    private MetricsEngine() {
    }

    public static SimulationMetrics compute(EventLog log, Collection<Ship> ships, Collection<CustomerSite> customers,
                                            DistanceMatrix distances, SimulationParams params) {
        var byCustomer = new LinkedHashMap<String, List<SupplyEvent.Consumption>>();
        customers.forEach(c -> byCustomer.put(c.id(), new ArrayList<>()));
        var deliveries = new LinkedHashMap<String, Long>();
        var resupplies = new LinkedHashMap<String, Long>();
        long stockouts = 0;

        for (var event : log.events()) {
            if (event instanceof SupplyEvent.Consumption consumption) {
                if (consumption.isStockout()) {
                    stockouts++;
                }
                var series = byCustomer.get(consumption.customerId());
                if (series != null) {
                    series.add(consumption);
                }
            } else if (event instanceof SupplyEvent.DeliveryCompleted completed) {
                deliveries.merge(completed.shipId(), 1L, Long::sum);
            } else if (event instanceof SupplyEvent.ResupplyCompleted completed) {
                resupplies.merge(completed.shipId(), 1L, Long::sum);
            }
        }

        var customerMetrics = new LinkedHashMap<String, CustomerMetrics>();
        byCustomer.forEach((id, series) -> {
            if (!series.isEmpty()) {
                customerMetrics.put(id, customerMetrics(series, params));
            }
        });

        var shipMetrics = new LinkedHashMap<String, ShipMetrics>();
        for (var ship : ships) {
            shipMetrics.put(ship.id(), new ShipMetrics(totalDistance(ship, distances),
                                                       deliveries.getOrDefault(ship.id(), 0L),
                                                       resupplies.getOrDefault(ship.id(), 0L)));
        }

        return new SimulationMetrics(overallServiceLevel(customerMetrics), stockouts, customerMetrics, shipMetrics);
    }

    static CustomerMetrics customerMetrics(List<SupplyEvent.Consumption> series, SimulationParams params) {
        var sum = 0.0;
        var min = Double.POSITIVE_INFINITY;
        long stockouts = 0;
        for (var c : series) {
            sum += c.currentInventory();
            min = Math.min(min, c.currentInventory());
            if (c.isStockout()) {
                stockouts++;
            }
        }
        var stockoutHours = stockouts * params.timeStep();
        var duration = params.simulationDuration();
        var serviceLevel = duration > 0.0 ? 1.0 - stockoutHours / duration : 1.0;
        return new CustomerMetrics(sum / series.size(), min, stockoutHours, serviceLevel);
    }

    static double totalDistance(Ship ship, DistanceMatrix distances) {
        var total = 0.0;
        for (var journey : ship.travelHistory()) {
            var d = distances.find(journey.departure(), journey.destination());
            if (d.isPresent()) {
                total += d.getAsDouble();
            }
        }
        return total;
    }

    static double overallServiceLevel(Map<String, CustomerMetrics> customerMetrics) {
        if (customerMetrics.isEmpty()) {
            return 0.0;
        }
        return customerMetrics.values().stream().mapToDouble(CustomerMetrics::serviceLevel).sum()
        / customerMetrics.size();
    }
}
