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
import com.hellblazer.tidewater.simulation.entity.CustomerSite;
import com.hellblazer.tidewater.simulation.entity.Ship;
import com.hellblazer.tidewater.simulation.entity.ShipState;
import com.hellblazer.tidewater.simulation.event.SupplyEvent;

/**
 * One trip of a reserved ship to a customer: travel, unload, hand over, then either go back into the pool or head to
 * the port when the ship is running low.
 * <p>
 * States: {@code START -> TRAVELING -> UNLOADING -> DONE}.
 *
 * @author hal.hildebrand
 */
public class DeliveryProcess implements VesselProcess {

    /**
     * Below this fraction of capacity a ship reloads instead of returning to the pool.
     */
    public static final double RESUPPLY_FRACTION = 0.2;

    private enum Phase {
        START, TRAVELING, UNLOADING, DONE
    }

    private final SimulationContext context;
    private final Ship              ship;
    private final CustomerSite      customer;
    private final double            needed;
    private       double            deliveryAmount;
    private       Phase             phase = Phase.START;

    public DeliveryProcess(SimulationContext context, Ship ship, CustomerSite customer, double needed) {
        this.context = context;
        this.ship = ship;
        this.customer = customer;
        this.needed = needed;
    }

    @Override
    public String name() {
        return "delivery[" + ship.id() + "->" + customer.id() + "]";
    }

    @Override
    public Ship ship() {
        return ship;
    }

    @Override
    public Step resume(Scheduler scheduler) {
        var now = scheduler.now();
        return switch (phase) {
            case START -> depart(now);
            case TRAVELING -> arrive(now);
            case UNLOADING -> handOver(now);
            case DONE -> throw new IllegalStateException(name() + " resumed after completion");
        };
    }

    private Step depart(double now) {
        context.emit(new SupplyEvent.DeliveryStarted(now, ship.id(), ship.name(), customer.id(), customer.name(),
                                                     needed, ship.currentCargo()));
        var arrival = ship.travelTo(customer.location(), context.distances(), now);
        phase = Phase.TRAVELING;
        return Step.hold(arrival - now);
    }

    private Step arrive(double now) {
        context.emit(new SupplyEvent.ShipArrived(now, ship.id(), ship.name(), customer.location(), customer.id(),
                                                 customer.name()));
        deliveryAmount = Math.min(needed, ship.currentCargo());
        var unloadingTime = deliveryAmount / context.params().unloadingRate();
        ship.engage(ShipState.UNLOADING, now + unloadingTime);
        phase = Phase.UNLOADING;
        return Step.hold(unloadingTime);
    }

    private Step handOver(double now) {
        var unloaded = ship.unload(deliveryAmount);
        var received = customer.receiveDelivery(unloaded, now);
        context.emit(new SupplyEvent.DeliveryCompleted(now, ship.id(), ship.name(), customer.id(), customer.name(),
                                                       unloaded, received, customer.currentInventory(),
                                                       ship.currentCargo()));
        if (ship.currentCargo() < RESUPPLY_FRACTION * ship.capacity()) {
            context.start(new ResupplyProcess(context, ship));
        } else {
            ship.release(now);
        }
        phase = Phase.DONE;
        return Step.finish();
    }
}
