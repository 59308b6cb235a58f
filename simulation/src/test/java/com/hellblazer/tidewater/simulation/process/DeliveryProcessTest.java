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
package com.hellblazer.tidewater.simulation.process;

import com.hellblazer.tidewater.simulation.SimulationContext;
import com.hellblazer.tidewater.simulation.config.CustomerSpec;
import com.hellblazer.tidewater.simulation.entity.DistanceMatrix;
import com.hellblazer.tidewater.simulation.entity.ShipState;
import com.hellblazer.tidewater.simulation.event.EventKind;
import com.hellblazer.tidewater.simulation.event.SupplyEvent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hellblazer.tidewater.simulation.Scenarios.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DeliveryProcess - travel and unloading timing, the hand over and what happens to the ship afterwards.
 *
 * @author hal.hildebrand
 */
class DeliveryProcessTest {

    private SimulationContext deliver(double cargo, CustomerSpec customer, DistanceMatrix distances, double needed,
                                      double horizon) {
        var context = context(List.of(ship("s1", cargo)), List.of(customer), distances, params(horizon));
        var ship = context.ship("s1");
        ship.assign();
        context.start(new DeliveryProcess(context, ship, context.customer(customer.id()), needed));
        context.scheduler().run(horizon);
        return context;
    }

    @Test
    void testDeliveryTimeline() {
        var context = deliver(8000.0, customer("c1", "site_a"), distances("site_a"), 2500.0, 24.0);

        var kinds = context.eventLog().events().stream().map(SupplyEvent::kind).toList();
        assertEquals(List.of(EventKind.DELIVERY_STARTED, EventKind.SHIP_ARRIVED, EventKind.DELIVERY_COMPLETED), kinds);

        var started = (SupplyEvent.DeliveryStarted) context.eventLog().events().get(0);
        assertEquals(0.0, started.time());
        assertEquals(2500.0, started.requestedAmount());
        assertEquals(8000.0, started.availableCargo());

        var arrived = (SupplyEvent.ShipArrived) context.eventLog().events().get(1);
        assertEquals(5.0, arrived.time());
        assertEquals("site_a", arrived.location());
        assertEquals("c1", arrived.customerId());

        var completed = (SupplyEvent.DeliveryCompleted) context.eventLog().events().get(2);
        assertEquals(5.625, completed.time());
        assertEquals(2500.0, completed.amountUnloaded());
        assertEquals(2500.0, completed.amountDelivered());
        assertEquals(4900.0, completed.customerInventory());
        assertEquals(5500.0, completed.shipRemainingCargo());

        var ship = context.ship("s1");
        assertEquals(ShipState.IDLE, ship.state(), "a well stocked ship goes back into the pool");
        assertEquals(5.625, ship.busyUntil());
        assertEquals("site_a", ship.currentLocation());
        assertEquals(1, ship.travelHistory().size());
    }

    @Test
    void testDeliveryLimitedByCargo() {
        var context = deliver(1500.0, customer("c1", "site_a"), distances("site_a"), 2500.0, 24.0);

        var completed = context.eventLog().ofType(SupplyEvent.DeliveryCompleted.class).findFirst().orElseThrow();
        assertEquals(5.0 + 1500.0 / 4000.0, completed.time());
        assertEquals(1500.0, completed.amountUnloaded());
        assertEquals(0.0, completed.shipRemainingCargo());
    }

    @Test
    void testExcessOverCeilingIsLost() {
        var nearlyFull = new CustomerSpec("c1", "Nearly Full", "site_a", 100.0, 5000.0, 0.0, 6000.0);
        var context = deliver(8000.0, nearlyFull, distances("site_a"), 3000.0, 24.0);

        var completed = context.eventLog().ofType(SupplyEvent.DeliveryCompleted.class).findFirst().orElseThrow();
        assertEquals(3000.0, completed.amountUnloaded());
        assertEquals(1000.0, completed.amountDelivered());
        assertEquals(6000.0, completed.customerInventory());
        assertEquals(5000.0, completed.shipRemainingCargo());
        var order = context.customer("c1").ordersHistory().get(0);
        assertEquals(3000.0, order.amountRequested());
        assertEquals(1000.0, order.amountReceived());
    }

    @Test
    void testLowCargoTriggersResupply() {
        var context = deliver(3000.0, customer("c1", "site_a"), distances("site_a"), 2500.0, 24.0);

        var resupply = context.eventLog().ofType(SupplyEvent.ResupplyStarted.class).findFirst().orElseThrow();
        assertEquals(5.625, resupply.time());
        assertEquals("site_a", resupply.currentLocation());
        assertEquals(PORT, resupply.destination());
        assertEquals(500.0, resupply.currentCargo());
        assertNotEquals(ShipState.IDLE, context.ship("s1").state());
    }

    @Test
    void testMissingRouteStrandsShip() {
        var context = deliver(8000.0, customer("c1", "nowhere"), distances("site_a"), 2500.0, 24.0);

        var failed = context.eventLog().ofType(SupplyEvent.ProcessFailed.class).findFirst().orElseThrow();
        assertEquals(0.0, failed.time());
        assertEquals("s1", failed.shipId());
        assertEquals(SupplyEvent.ROUTE_NOT_FOUND, failed.reason());
        assertEquals("delivery[s1->c1]", failed.process());

        var ship = context.ship("s1");
        assertEquals(ShipState.ASSIGNED, ship.state());
        assertEquals(PORT, ship.currentLocation());
        assertEquals(8000.0, ship.currentCargo());
        assertTrue(ship.travelHistory().isEmpty());
        assertEquals(1L, context.scheduler().getFailures());
    }

    @Test
    void testHorizonStopsMidVoyage() {
        var context = deliver(8000.0, customer("c1", "site_a"), distances("site_a"), 2500.0, 3.0);

        assertEquals(1, context.eventLog().size());
        assertEquals(ShipState.TRAVELING, context.ship("s1").state());
        assertEquals(1L, context.scheduler().getDiscarded());
    }
}
