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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A site that draws down inventory continuously and is topped up by deliveries.
 * <p>
 * Invariant: {@code 0 <= currentInventory <= maxInventory}.
 *
 * @author hal.hildebrand
 */
public class CustomerSite {
    public static final double HOURS_PER_DAY = 24.0;

    private final String                id;
    private final String                name;
    private final String                location;
    private final double                demandRate;
    private final double                minInventory;
    private final double                maxInventory;
    private final List<InventoryRecord> inventoryHistory = new ArrayList<>();
    private final List<OrderRecord>     ordersHistory    = new ArrayList<>();
    private       double                currentInventory;

    /**
     * @param demandRate units consumed per hour
     */
    public CustomerSite(String id, String name, String location, double demandRate, double initialInventory,
                        double minInventory, double maxInventory) {
        this.id = id;
        this.name = name;
        this.location = location;
        this.demandRate = demandRate;
        this.currentInventory = initialInventory;
        this.minInventory = minInventory;
        this.maxInventory = maxInventory;
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String location() {
        return location;
    }

    public double demandRate() {
        return demandRate;
    }

    public double currentInventory() {
        return currentInventory;
    }

    public double minInventory() {
        return minInventory;
    }

    public double maxInventory() {
        return maxInventory;
    }

    public List<InventoryRecord> inventoryHistory() {
        return Collections.unmodifiableList(inventoryHistory);
    }

    public List<OrderRecord> ordersHistory() {
        return Collections.unmodifiableList(ordersHistory);
    }

    public double demandFor(double period) {
        return demandRate * period;
    }

    /**
     * Draw one period's demand from inventory, never below zero, and record the outcome at {@code now}.
     *
     * @return the amount actually consumed
     */
    public double consume(double period, double now) {
        var demand = demandFor(period);
        var fulfilled = Math.max(0.0, Math.min(demand, currentInventory));
        currentInventory -= fulfilled;
        inventoryHistory.add(new InventoryRecord(now, currentInventory, demand, fulfilled,
                                                 Math.max(0.0, demand - fulfilled)));
        return fulfilled;
    }

    /**
     * Take in a delivery, clamped to the free capacity below {@link #maxInventory()}.
     *
     * @return the amount actually received
     */
    public double receiveDelivery(double amount, double now) {
        var received = Math.max(0.0, Math.min(amount, maxInventory - currentInventory));
        currentInventory += received;
        ordersHistory.add(new OrderRecord(now, amount, received, currentInventory));
        return received;
    }

    /**
     * Inventory expressed in days of demand; infinite when the site consumes nothing.
     */
    public double daysOfSupply() {
        if (demandRate <= 0.0) {
            return Double.POSITIVE_INFINITY;
        }
        return currentInventory / (demandRate * HOURS_PER_DAY);
    }

    public Map<String, Object> status() {
        var status = new LinkedHashMap<String, Object>();
        status.put("id", id);
        status.put("name", name);
        status.put("location", location);
        status.put("inventory", currentInventory);
        status.put("min_inventory", minInventory);
        status.put("inventory_deficit", Math.max(0.0, minInventory - currentInventory));
        status.put("fill_capacity", maxInventory - currentInventory);
        return status;
    }

    @Override
    public String toString() {
        return String.format("CustomerSite{%s, at=%s, inventory=%.1f/%.1f}", id, location, currentInventory,
                             maxInventory);
    }
}
