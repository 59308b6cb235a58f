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
import com.hellblazer.tidewater.kernel.SimProcess;
import com.hellblazer.tidewater.kernel.Step;
import com.hellblazer.tidewater.simulation.SimulationContext;
import com.hellblazer.tidewater.simulation.entity.CustomerSite;
import com.hellblazer.tidewater.simulation.event.SupplyEvent;

/**
 * Draws a customer's inventory down every time step and asks the dispatcher for a delivery while the customer is
 * below its resupply threshold. Runs until the horizon cuts it off.
 * <p>
 * Re-evaluation on every step is the only retry: a request that finds no ship is simply made again next step.
 *
 * @author hal.hildebrand
 */
public class ConsumptionProcess implements SimProcess {

    private enum Phase {
        START, CONSUMING
    }

    private final SimulationContext context;
    private final CustomerSite      customer;
    private       Phase             phase = Phase.START;

    public ConsumptionProcess(SimulationContext context, CustomerSite customer) {
        this.context = context;
        this.customer = customer;
    }

    @Override
    public String name() {
        return "consumption[" + customer.id() + "]";
    }

    @Override
    public Step resume(Scheduler scheduler) {
        var timeStep = context.params().timeStep();
        if (phase == Phase.START) {
            phase = Phase.CONSUMING;
            return Step.hold(timeStep);
        }
        var now = scheduler.now();
        var demand = customer.demandFor(timeStep);
        var consumed = customer.consume(timeStep, now);
        var daysOfSupply = customer.daysOfSupply();
        context.emit(new SupplyEvent.Consumption(now, customer.id(), customer.name(), consumed, demand,
                                                 Math.max(0.0, demand - consumed), customer.currentInventory(),
                                                 daysOfSupply));
        if (daysOfSupply < context.params().resupplyThresholdDays()) {
            context.dispatcher().dispatch(context, customer);
        }
        return Step.hold(timeStep);
    }
}
