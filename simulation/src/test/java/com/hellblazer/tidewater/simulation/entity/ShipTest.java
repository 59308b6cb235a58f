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
package com.hellblazer.tidewater.simulation.entity;

import com.hellblazer.tidewater.simulation.SimulationException.RouteNotFoundException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class ShipTest {

    private final DistanceMatrix distances = DistanceMatrix.of(
    Map.of("port", Map.of("port", 0.0, "a", 100.0), "a", Map.of("port", 100.0, "a", 0.0)));

    @Test
    void testInitialCargoIsClampedToCapacity() {
        assertEquals(500.0, new Ship("s", "S", 500.0, 10.0, "port", 900.0).currentCargo());
        assertEquals(0.0, new Ship("s", "S", 500.0, 10.0, "port", -5.0).currentCargo());
    }

    @Test
    void testLoadAndUnloadAreClamped() {
        var ship = new Ship("s", "S", 1000.0, 10.0, "port", 800.0);

        assertEquals(200.0, ship.load(500.0));
        assertEquals(1000.0, ship.currentCargo());
        assertEquals(0.0, ship.availableCapacity());

        assertEquals(1000.0, ship.unload(1500.0));
        assertEquals(0.0, ship.currentCargo());

        assertEquals(0.0, ship.load(-10.0));
        assertEquals(0.0, ship.unload(-10.0));
        assertEquals(0.0, ship.currentCargo());
    }

    @Test
    void testTravelRecordsJourneyAndMovesShip() {
        var ship = new Ship("s", "S", 1000.0, 20.0, "port", 600.0);

        assertEquals(5.0, ship.travelTime("a", distances));
        var arrival = ship.travelTo("a", distances, 2.0);

        assertEquals(7.0, arrival);
        assertEquals("a", ship.currentLocation());
        assertEquals(ShipState.TRAVELING, ship.state());
        assertEquals(7.0, ship.busyUntil());
        assertEquals(1, ship.travelHistory().size());
        assertEquals(new Journey("port", "a", 2.0, 7.0, 600.0), ship.travelHistory().get(0));
    }

    @Test
    void testTravelWithoutRouteLeavesShipUnchanged() {
        var ship = new Ship("s", "S", 1000.0, 20.0, "port", 600.0);

        var e = assertThrows(RouteNotFoundException.class, () -> ship.travelTo("nowhere", distances, 0.0));

        assertEquals("port", e.getFrom());
        assertEquals("nowhere", e.getTo());
        assertEquals("port", ship.currentLocation());
        assertTrue(ship.travelHistory().isEmpty());
    }

    @Test
    void testAvailability() {
        var ship = new Ship("s", "S", 1000.0, 20.0, "port", 600.0);
        assertTrue(ship.isAvailable(0.0));

        ship.assign();
        assertFalse(ship.isAvailable(0.0));
        assertThrows(IllegalStateException.class, ship::assign);

        ship.engage(ShipState.UNLOADING, 4.0);
        ship.release(2.0);
        assertEquals(ShipState.IDLE, ship.state());
        assertEquals(4.0, ship.busyUntil(), "busy until never decreases");
        assertFalse(ship.isAvailable(3.0));
        assertTrue(ship.isAvailable(4.0));

        ship.unload(600.0);
        assertFalse(ship.isAvailable(5.0), "empty ships are never dispatched");
    }

    @Test
    void testEngageRejectsIdle() {
        var ship = new Ship("s", "S", 1000.0, 20.0, "port", 600.0);
        assertThrows(IllegalArgumentException.class, () -> ship.engage(ShipState.IDLE, 1.0));
    }

    @Test
    void testStatus() {
        var ship = new Ship("s", "Swift", 1000.0, 20.0, "port", 600.0);
        var status = ship.status();

        assertEquals("s", status.get("id"));
        assertEquals("Swift", status.get("name"));
        assertEquals("port", status.get("location"));
        assertEquals(600.0, status.get("cargo"));
        assertEquals(400.0, status.get("available_capacity"));
        assertEquals("IDLE", status.get("state"));
    }

    @Test
    void testTravelHistoryIsReadOnly() {
        var ship = new Ship("s", "S", 1000.0, 20.0, "port", 600.0);
        assertThrows(UnsupportedOperationException.class,
                     () -> ship.travelHistory().add(new Journey("a", "b", 0.0, 1.0, 0.0)));
    }
}
