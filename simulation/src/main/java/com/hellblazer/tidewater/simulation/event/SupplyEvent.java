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
package com.hellblazer.tidewater.simulation.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Sealed family of domain events emitted during a run, one record per event kind.
 * <p>
 * Serialized as flat JSON objects carrying a {@code type} discriminator, e.g.
 * <pre>
 * {"type":"delivery_failed","time":14.0,"customer_id":"customer_2","reason":"no_ships_available",...}
 * </pre>
 *
 * @author hal.hildebrand
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({ @JsonSubTypes.Type(value = SupplyEvent.Consumption.class, name = "consumption"),
                @JsonSubTypes.Type(value = SupplyEvent.DeliveryStarted.class, name = "delivery_started"),
                @JsonSubTypes.Type(value = SupplyEvent.ShipArrived.class, name = "ship_arrived"),
                @JsonSubTypes.Type(value = SupplyEvent.DeliveryFailed.class, name = "delivery_failed"),
                @JsonSubTypes.Type(value = SupplyEvent.DeliveryCompleted.class, name = "delivery_completed"),
                @JsonSubTypes.Type(value = SupplyEvent.ResupplyStarted.class, name = "resupply_started"),
                @JsonSubTypes.Type(value = SupplyEvent.ResupplyCompleted.class, name = "resupply_completed"),
                @JsonSubTypes.Type(value = SupplyEvent.ProcessFailed.class, name = "process_failed") })
public sealed interface SupplyEvent {

    String NO_SHIPS_AVAILABLE = "no_ships_available";
    String ROUTE_NOT_FOUND    = "route_not_found";
    String UNEXPECTED_FAILURE = "unexpected_failure";

    double time();

    @JsonIgnore
    EventKind kind();

    /**
     * A customer drew one time step of demand.
     */
    record Consumption(double time, String customerId, String customerName, double amountConsumed, double demand,
                       double shortage, double currentInventory, double daysOfSupply) implements SupplyEvent {
        @Override
        public EventKind kind() {
            return EventKind.CONSUMPTION;
        }

        @JsonIgnore
        public boolean isStockout() {
            return currentInventory == 0.0;
        }
    }

    record DeliveryStarted(double time, String shipId, String shipName, String customerId, String customerName,
                           double requestedAmount, double availableCargo) implements SupplyEvent {
        @Override
        public EventKind kind() {
            return EventKind.DELIVERY_STARTED;
        }
    }

    /**
     * A ship reached a customer site or the port; the customer fields are null for port arrivals.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ShipArrived(double time, String shipId, String shipName, String location, String customerId,
                       String customerName) implements SupplyEvent {
        @Override
        public EventKind kind() {
            return EventKind.SHIP_ARRIVED;
        }
    }

    /**
     * Dispatch found no eligible ship. The customer asks again on its next consumption step.
     */
    record DeliveryFailed(double time, String customerId, String reason, double neededAmount)
    implements SupplyEvent {
        @Override
        public EventKind kind() {
            return EventKind.DELIVERY_FAILED;
        }
    }

    /**
     * @param amountUnloaded  cargo taken off the ship
     * @param amountDelivered portion the customer could take in, the rest was lost to the inventory ceiling
     */
    record DeliveryCompleted(double time, String shipId, String shipName, String customerId, String customerName,
                             double amountUnloaded, double amountDelivered, double customerInventory,
                             double shipRemainingCargo) implements SupplyEvent {
        @Override
        public EventKind kind() {
            return EventKind.DELIVERY_COMPLETED;
        }
    }

    record ResupplyStarted(double time, String shipId, String shipName, String currentLocation, String destination,
                           double currentCargo) implements SupplyEvent {
        @Override
        public EventKind kind() {
            return EventKind.RESUPPLY_STARTED;
        }
    }

    record ResupplyCompleted(double time, String shipId, String shipName, String location, double newCargoLevel)
    implements SupplyEvent {
        @Override
        public EventKind kind() {
            return EventKind.RESUPPLY_COMPLETED;
        }
    }

    /**
     * A process terminated abnormally; the rest of the run carried on without it.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ProcessFailed(double time, String process, String shipId, String reason, String message)
    implements SupplyEvent {
        @Override
        public EventKind kind() {
            return EventKind.PROCESS_FAILED;
        }
    }
}
