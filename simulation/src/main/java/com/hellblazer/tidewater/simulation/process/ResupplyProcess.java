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

import com.hellblazer.tidewater.kernel.Scheduler;
import com.hellblazer.tidewater.kernel.Step;
import com.hellblazer.tidewater.simulation.SimulationContext;
import com.hellblazer.tidewater.simulation.entity.Ship;
import com.hellblazer.tidewater.simulation.entity.ShipState;
import com.hellblazer.tidewater.simulation.event.SupplyEvent;

/**
 * Takes a ship back to the port, waits out the port delay, tops the ship off and returns it to the pool.
 * <p>
 * States: {@code START -> TRAVELING -> WAITING -> LOADING -> DONE}. A ship already at the port skips the travel but
 * still reports its arrival.
 *
 * @author hal.hildebrand
 */
public class ResupplyProcess implements VesselProcess {

    private enum Phase {
        START, TRAVELING, WAITING, LOADING, DONE
    }

    private final SimulationContext context;
    private final Ship              ship;
    private       Phase             phase = Phase.START;

    public ResupplyProcess(SimulationContext context, Ship ship) {
        this.context = context;
        this.ship = ship;
    }

    @Override
    public String name() {
        return "resupply[" + ship.id() + "]";
    }

    @Override
    public Ship ship() {
        return ship;
    }

    @Override
    public Step resume(Scheduler scheduler) {
        var now = scheduler.now();
        return switch (phase) {
            case START -> start(now);
            case TRAVELING -> dock(now);
            case WAITING -> beginLoading(now);
            case LOADING -> complete(now);
            case DONE -> throw new IllegalStateException(name() + " resumed after completion");
        };
    }

    private Step start(double now) {
        var port = context.params().portLocation();
        context.emit(new SupplyEvent.ResupplyStarted(now, ship.id(), ship.name(), ship.currentLocation(), port,
                                                     ship.currentCargo()));
        if (port.equals(ship.currentLocation())) {
            return dock(now);
        }
        var arrival = ship.travelTo(port, context.distances(), now);
        phase = Phase.TRAVELING;
        return Step.hold(arrival - now);
    }

    private Step dock(double now) {
        var port = context.params().portLocation();
        context.emit(new SupplyEvent.ShipArrived(now, ship.id(), ship.name(), port, null, null));
        var delay = context.params().portResupplyDelay();
        ship.engage(ShipState.WAITING, now + delay);
        phase = Phase.WAITING;
        return Step.hold(delay);
    }

    private Step beginLoading(double now) {
        var loadingTime = ship.availableCapacity() / context.params().loadingRate();
        ship.engage(ShipState.LOADING, now + loadingTime);
        phase = Phase.LOADING;
        return Step.hold(loadingTime);
    }

    private Step complete(double now) {
        ship.load(ship.availableCapacity());
        context.emit(new SupplyEvent.ResupplyCompleted(now, ship.id(), ship.name(), ship.currentLocation(),
                                                       ship.currentCargo()));
        ship.release(now);
        phase = Phase.DONE;
        return Step.finish();
    }
}
