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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A cargo vessel shuttling between the port and customer sites.
 * <p>
 * State is mutated only by the dispatcher and by the delivery or resupply process currently holding the ship, and
 * only between waits. Invariants: {@code 0 <= cargo <= capacity}; {@code busyUntil} never decreases.
 *
 * @author hal.hildebrand
 */
public class Ship {
    private final String        id;
    private final String        name;
    private final double        capacity;
    private final double        speed;
    private final List<Journey> travelHistory = new ArrayList<>();
    private       String        currentLocation;
    private       double        currentCargo;
    private       double        busyUntil;
    private       ShipState     state         = ShipState.IDLE;

    /**
     * @param capacity       maximum cargo
     * @param speed          distance units per hour, positive
     * @param initialCargo   starting cargo, clamped to {@code [0, capacity]}
     */
    public Ship(String id, String name, double capacity, double speed, String initialLocation, double initialCargo) {
        this.id = id;
        this.name = name;
        this.capacity = capacity;
        this.speed = speed;
        this.currentLocation = initialLocation;
        this.currentCargo = Math.max(0.0, Math.min(initialCargo, capacity));
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public double capacity() {
        return capacity;
    }

    public double speed() {
        return speed;
    }

    public String currentLocation() {
        return currentLocation;
    }

    public double currentCargo() {
        return currentCargo;
    }

    public double availableCapacity() {
        return capacity - currentCargo;
    }

    public double busyUntil() {
        return busyUntil;
    }

    public ShipState state() {
        return state;
    }

    public List<Journey> travelHistory() {
        return Collections.unmodifiableList(travelHistory);
    }

    /**
     * Load cargo, clamped to the remaining capacity.
     *
     * @return the amount actually loaded
     */
    public double load(double amount) {
        var actual = Math.min(Math.max(0.0, amount), capacity - currentCargo);
        currentCargo += actual;
        return actual;
    }

    /**
     * Unload cargo, clamped to what is on board.
     *
     * @return the amount actually unloaded
     */
    public double unload(double amount) {
        var actual = Math.min(Math.max(0.0, amount), currentCargo);
        currentCargo -= actual;
        return actual;
    }

    public double travelTime(String destination, DistanceMatrix distances) {
        return distances.distance(currentLocation, destination) / speed;
    }

    /**
     * Depart for the destination, recording the journey. The ship is considered at the destination immediately; the
     * caller waits out the travel time.
     *
     * @return the arrival time
     * @throws RouteNotFoundException when the matrix has no route from the current location
     */
    public double travelTo(String destination, DistanceMatrix distances, double now) {
        var arrival = now + travelTime(destination, distances);
        travelHistory.add(new Journey(currentLocation, destination, now, arrival, currentCargo));
        currentLocation = destination;
        state = ShipState.TRAVELING;
        holdUntil(arrival);
        return arrival;
    }

    /**
     * Dispatch-eligible: idle, free by {@code now}, with cargo on board.
     */
    public boolean isAvailable(double now) {
        return state == ShipState.IDLE && busyUntil <= now && currentCargo > 0.0;
    }

    /**
     * Reserve the ship for a delivery at the moment it is selected.
     *
     * @throws IllegalStateException if the ship is already engaged
     */
    public void assign() {
        if (state.isEngaged()) {
            throw new IllegalStateException("Ship " + id + " is already " + state);
        }
        state = ShipState.ASSIGNED;
    }

    /**
     * Enter an engaged state lasting until {@code until}.
     */
    public void engage(ShipState next, double until) {
        if (next == ShipState.IDLE) {
            throw new IllegalArgumentException("Use release() to idle ship " + id);
        }
        state = next;
        holdUntil(until);
    }

    /**
     * Return the ship to the dispatchable pool.
     */
    public void release(double now) {
        state = ShipState.IDLE;
        holdUntil(now);
    }

    public Map<String, Object> status() {
        var status = new LinkedHashMap<String, Object>();
        status.put("id", id);
        status.put("name", name);
        status.put("location", currentLocation);
        status.put("cargo", currentCargo);
        status.put("available_capacity", availableCapacity());
        status.put("busy_until", busyUntil);
        status.put("state", state.name());
        return status;
    }

    private void holdUntil(double time) {
        busyUntil = Math.max(busyUntil, time);
    }

    @Override
    public String toString() {
        return String.format("Ship{%s, at=%s, cargo=%.1f/%.1f, %s until %.2f}", id, currentLocation, currentCargo,
                             capacity, state, busyUntil);
    }
}
