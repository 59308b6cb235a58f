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
package com.hellblazer.tidewater.simulation.dispatch;

import com.hellblazer.tidewater.simulation.SimulationContext;
import com.hellblazer.tidewater.simulation.entity.CustomerSite;
import com.hellblazer.tidewater.simulation.entity.Ship;
import com.hellblazer.tidewater.simulation.event.SupplyEvent;
import com.hellblazer.tidewater.simulation.process.DeliveryProcess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.Optional;

/**
 * Matches an under-supplied customer with an idle, loaded ship.
 * <p>
 * Dispatch algorithm:
 * 1. Target 80% of the customer's maximum inventory; nothing to do if already there
 * 2. Keep ships that are idle, free by now and carrying cargo
 * 3. None: record delivery_failed and return, the customer asks again next step
 * 4. Pick the ship with the most cargo, lowest id on equal cargo
 * 5. Reserve the ship immediately so no other request in the same instant can take it
 * 6. Start a delivery process for the shortfall
 *
 * @author hal.hildebrand
 */
public class Dispatcher {
    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    public static final double TARGET_FILL_FRACTION = 0.8;

    /**
     * Most cargo first, then lowest id.
     */
    public static final Comparator<Ship> SELECTION_ORDER = Comparator.comparingDouble(Ship::currentCargo)
                                                                     .reversed()
                                                                     .thenComparing(Ship::id);

    /**
     * @return the reserved ship, or empty when no delivery was started
     */
    public Optional<Ship> dispatch(SimulationContext context, CustomerSite customer) {
        var now = context.now();
        var needed = TARGET_FILL_FRACTION * customer.maxInventory() - customer.currentInventory();
        if (needed <= 0.0) {
            return Optional.empty();
        }

        var selected = context.ships().stream().filter(s -> s.isAvailable(now)).min(SELECTION_ORDER);
        if (selected.isEmpty()) {
            log.debug("No ship available for {} at {}, needs {}", customer.id(), now, needed);
            context.emit(new SupplyEvent.DeliveryFailed(now, customer.id(), SupplyEvent.NO_SHIPS_AVAILABLE, needed));
            return Optional.empty();
        }

        var ship = selected.get();
        ship.assign();
        log.debug("Dispatching {} ({} aboard) to {} for {} at {}", ship.id(), ship.currentCargo(), customer.id(),
                  needed, now);
        context.start(new DeliveryProcess(context, ship, customer, needed));
        return selected;
    }
}
