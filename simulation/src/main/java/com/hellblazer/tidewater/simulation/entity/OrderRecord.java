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

/**
 * A delivery received by a customer site.
 *
 * @param time            Virtual time the delivery was taken in
 * @param amountRequested Units offered by the ship
 * @param amountReceived  Units that fit under the site's maximum inventory
 * @param inventoryAfter  Inventory after receipt
 */
public record OrderRecord(double time, double amountRequested, double amountReceived, double inventoryAfter) {
}
