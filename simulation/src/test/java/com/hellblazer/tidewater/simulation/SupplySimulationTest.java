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

import com.hellblazer.tidewater.simulation.SimulationException.MalformedConfigurationException;
import com.hellblazer.tidewater.simulation.data.InMemoryDataSource;
import com.hellblazer.tidewater.simulation.data.JsonDataSource;
import com.hellblazer.tidewater.simulation.data.SupplyDataSource;
import com.hellblazer.tidewater.simulation.data.TidewaterJson;
import com.hellblazer.tidewater.simulation.event.EventKind;
import com.hellblazer.tidewater.simulation.event.SupplyEvent;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static com.hellblazer.tidewater.simulation.Scenarios.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * End to end runs of the resupply simulation.
 *
 * @author hal.hildebrand
 */
class SupplySimulationTest {

    private static JsonDataSource baseline() throws Exception {
        return new JsonDataSource(Path.of(SupplySimulationTest.class.getResource("/baseline").toURI()));
    }

    private static InMemoryDataSource inMemory(SupplyDataSource source) {
        return new InMemoryDataSource(source.getShipsData(), source.getCustomersData(), source.getDistanceMatrix(),
                                      source.getSimulationParams());
    }

    private static <T extends SupplyEvent> List<T> events(SimulationResults results, Class<T> type) {
        return results.events().stream().filter(type::isInstance).map(type::cast).toList();
    }

    @Test
    void testFirstTickTriggersDelivery() {
        var source = dataSource(List.of(ship("s1", 8000.0)), List.of(customer("c1", "site_a")), distances("site_a"),
                                params(7.0));

        var results = new SupplySimulation(source).run();

        var started = events(results, SupplyEvent.DeliveryStarted.class);
        assertEquals(1, started.size());
        assertEquals(1.0, started.get(0).time());
        assertEquals("s1", started.get(0).shipId());
        assertEquals(0.8 * 6000.0 - 2300.0, started.get(0).requestedAmount());

        var arrived = events(results, SupplyEvent.ShipArrived.class);
        assertEquals(6.0, arrived.get(0).time());

        var completed = events(results, SupplyEvent.DeliveryCompleted.class);
        assertEquals(6.625, completed.get(0).time());
        assertEquals(1800.0 + 2500.0, completed.get(0).customerInventory());

        var failed = events(results, SupplyEvent.DeliveryFailed.class);
        assertEquals(List.of(2.0, 3.0, 4.0, 5.0, 6.0), failed.stream().map(SupplyEvent::time).toList(),
                     "requests repeat every step while the only ship is busy");
        assertEquals(1, source.getSavedResults().size());
    }

    @Test
    void testNoCargoMeansFailedRequestsOnly() {
        var source = dataSource(List.of(ship("s1", 0.0), ship("s2", 0.0)), List.of(customer("c1", "site_a")),
                                distances("site_a"), params(24.0));

        var results = new SupplySimulation(source).run();

        var failed = events(results, SupplyEvent.DeliveryFailed.class);
        assertEquals(1L, failed.stream().filter(e -> e.time() == 1.0).count());
        assertEquals(SupplyEvent.NO_SHIPS_AVAILABLE, failed.get(0).reason());
        assertEquals(0L, results.metadata().eventCounts().get(EventKind.DELIVERY_STARTED.wireName()));
        assertTrue(events(results, SupplyEvent.DeliveryStarted.class).isEmpty());
    }

    @Test
    void testZeroDuration() {
        var source = dataSource(List.of(ship("s1", 8000.0)), List.of(customer("c1", "site_a")), distances("site_a"),
                                params(0.0));

        var results = new SupplySimulation(source).run();

        assertEquals(0L, results.metrics().totalStockoutEvents());
        assertTrue(results.metrics().customerMetrics().isEmpty());
        assertEquals(0.0, results.metrics().overallServiceLevel());
        assertTrue(results.events().isEmpty());
        assertEquals(0.0, results.metrics().shipMetrics().get("s1").totalDistance());
    }

    @Test
    void testMissingRouteIsIsolated() {
        var source = dataSource(List.of(ship("a", 8000.0), ship("b", 5000.0)),
                                List.of(customer("y", "site_y"), customer("x", "site_x")), distances("site_y"),
                                params(24.0));

        var results = new SupplySimulation(source).run();

        var failures = events(results, SupplyEvent.ProcessFailed.class);
        assertFalse(failures.isEmpty());
        assertTrue(failures.stream().allMatch(f -> SupplyEvent.ROUTE_NOT_FOUND.equals(f.reason())));
        assertEquals(failures.size(), results.metadata().failedProcesses());

        var consumption = events(results, SupplyEvent.Consumption.class);
        assertEquals(24L, consumption.stream().filter(c -> c.customerId().equals("y")).count());
        assertEquals(24L, consumption.stream().filter(c -> c.customerId().equals("x")).count());
        assertTrue(events(results, SupplyEvent.DeliveryCompleted.class).stream()
                                                                        .anyMatch(c -> c.customerId().equals("y")));
        assertEquals(2, results.metrics().customerMetrics().size());
    }

    @Test
    void testOneShipPerTick() {
        var source = dataSource(List.of(ship("s1", 8000.0)),
                                List.of(customer("c1", "site_a"), customer("c2", "site_b")),
                                distances("site_a", "site_b"), params(1.0));

        var results = new SupplySimulation(source).run();

        var started = events(results, SupplyEvent.DeliveryStarted.class);
        assertEquals(1, started.size());
        assertEquals("c1", started.get(0).customerId(), "customers are served in configuration order");
        var failed = events(results, SupplyEvent.DeliveryFailed.class);
        assertEquals(1, failed.size());
        assertEquals("c2", failed.get(0).customerId());
        assertEquals(1.0, failed.get(0).time());
    }

    @Test
    void testSpeedMultiplierOverride() {
        var source = dataSource(List.of(ship("s1", 8000.0)), List.of(customer("c1", "site_a")), distances("site_a"),
                                params(7.0));

        var results = new SupplySimulation(source, Map.of("ship_speed_multiplier", 2.0)).run();

        assertEquals(3.5, events(results, SupplyEvent.ShipArrived.class).get(0).time());
        assertEquals(2.0, results.metadata().params().get("ship_speed_multiplier"));
    }

    @Test
    void testUnknownOverrideRejected() {
        var source = dataSource(List.of(ship("s1", 8000.0)), List.of(customer("c1", "site_a")), distances("site_a"),
                                params(7.0));

        var simulation = new SupplySimulation(source, Map.of("warp_factor", 9.0));
        assertThrows(MalformedConfigurationException.class, simulation::run);
    }

    @Test
    void testInfiniteDurationRejected() {
        var source = dataSource(List.of(ship("s1", 8000.0)), List.of(customer("c1", "site_a")), distances("site_a"),
                                params(7.0));

        var simulation = new SupplySimulation(source, Map.of("simulation_duration", Double.POSITIVE_INFINITY));
        assertTimeoutPreemptively(Duration.ofSeconds(5),
                                  () -> assertThrows(MalformedConfigurationException.class, simulation::run));
    }

    @Test
    void testExtraParameterInDocumentIgnored() {
        var params = params(7.0);
        params.put("scenario", "north_sea");
        var source = dataSource(List.of(ship("s1", 8000.0)), List.of(customer("c1", "site_a")), distances("site_a"),
                                params);

        var results = new SupplySimulation(source).run();

        assertEquals(7.0, results.metadata().params().get("simulation_duration"));
        assertFalse(results.metadata().params().containsKey("scenario"));
    }

    @Test
    void testBaselineInvariants() throws Exception {
        var source = baseline();
        var results = new SupplySimulation(inMemory(source)).run();
        var capacity = new HashMap<String, Double>();
        var cargo = new HashMap<String, Double>();
        source.getShipsData().forEach(s -> {
            capacity.put(s.id(), s.capacity());
            cargo.put(s.id(), s.initialCargo());
        });
        var inventory = new HashMap<String, Double>();
        var maxInventory = new HashMap<String, Double>();
        source.getCustomersData().forEach(c -> {
            inventory.put(c.id(), c.initialInventory());
            maxInventory.put(c.id(), c.maxInventory());
        });

        var last = Double.NEGATIVE_INFINITY;
        var onDelivery = new HashSet<String>();
        var unloaded = 0.0;
        var delivered = 0.0;
        for (var event : results.events()) {
            assertTrue(event.time() >= last, "time never runs backwards: " + event);
            last = event.time();
            if (event instanceof SupplyEvent.Consumption c) {
                inventory.merge(c.customerId(), -c.amountConsumed(), Double::sum);
                assertEquals(inventory.get(c.customerId()), c.currentInventory(), 1e-6);
                assertTrue(c.currentInventory() >= 0.0);
            } else if (event instanceof SupplyEvent.DeliveryStarted s) {
                assertTrue(onDelivery.add(s.shipId()), "ship on two deliveries at once: " + s);
                assertTrue(s.availableCargo() > 0.0);
            } else if (event instanceof SupplyEvent.DeliveryCompleted d) {
                assertTrue(onDelivery.remove(d.shipId()));
                assertTrue(d.amountDelivered() <= d.amountUnloaded());
                unloaded += d.amountUnloaded();
                delivered += d.amountDelivered();
                cargo.merge(d.shipId(), -d.amountUnloaded(), Double::sum);
                inventory.merge(d.customerId(), d.amountDelivered(), Double::sum);
                assertEquals(cargo.get(d.shipId()), d.shipRemainingCargo(), 1e-6);
                assertEquals(inventory.get(d.customerId()), d.customerInventory(), 1e-6);
                assertTrue(d.customerInventory() <= maxInventory.get(d.customerId()) + 1e-6);
                assertTrue(d.shipRemainingCargo() >= 0.0);
            } else if (event instanceof SupplyEvent.ResupplyCompleted r) {
                assertEquals(capacity.get(r.shipId()), r.newCargoLevel());
                cargo.put(r.shipId(), r.newCargoLevel());
            }
        }

        assertTrue(unloaded > 0.0);
        assertTrue(unloaded >= delivered);
        assertEquals(0L, results.metadata().failedProcesses());
        assertEquals(3, results.metadata().numShips());
        var lastInventory = results.customersHistory()
                                   .stream()
                                   .filter(row -> row.customerId().equals("customer_1"))
                                   .reduce((first, second) -> second)
                                   .orElseThrow();
        assertEquals(720.0, lastInventory.time());
        assertTrue(results.metrics().overallServiceLevel() >= 0.0 && results.metrics().overallServiceLevel() <= 1.0);
        for (var row : results.shipsHistory()) {
            assertTrue(row.cargo() >= 0.0 && row.cargo() <= capacity.get(row.shipId()));
            assertTrue(row.arrivalTime() >= row.departureTime());
        }
    }

    @Test
    void testRunsAreDeterministic() throws Exception {
        var source = inMemory(baseline());
        var mapper = TidewaterJson.newMapper();

        var first = new SupplySimulation(source).run();
        var second = new SupplySimulation(source).run();

        assertEquals(first.events(), second.events());
        assertEquals(mapper.writeValueAsString(first.metrics()), mapper.writeValueAsString(second.metrics()));
        assertEquals(first.shipsHistory(), second.shipsHistory());
    }

    @Test
    void testRepeatedRunsStartFresh() {
        var source = dataSource(List.of(ship("s1", 8000.0)), List.of(customer("c1", "site_a")), distances("site_a"),
                                params(30.0));
        var simulation = new SupplySimulation(source);

        var first = simulation.run();
        var firstContext = simulation.getContext();
        var second = simulation.run();

        assertNotSame(firstContext, simulation.getContext());
        assertEquals(first.events(), second.events());
        assertEquals(2, source.getSavedResults().size());
    }

    @Test
    void testSaveFailureStillReturnsResults() {
        var source = mock(SupplyDataSource.class);
        when(source.getShipsData()).thenReturn(List.of(ship("s1", 8000.0)));
        when(source.getCustomersData()).thenReturn(List.of(customer("c1", "site_a")));
        when(source.getDistanceMatrix()).thenReturn(distances("site_a"));
        when(source.getSimulationParams()).thenReturn(params(10.0));
        doThrow(new UncheckedIOException("disk full", new IOException("disk full"))).when(source)
                                                                                           .saveResults(any());

        var results = new SupplySimulation(source).run();

        assertEquals(10L, results.metadata().eventCounts().get(EventKind.CONSUMPTION.wireName()));
        verify(source).saveResults(results);
    }
}
