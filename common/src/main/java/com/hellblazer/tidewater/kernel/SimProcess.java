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

package com.hellblazer.tidewater.kernel;

/**
 * A logically concurrent activity driven by the {@link Scheduler}.
 * <p>
 * Implementations are explicit state machines: each call to {@link #resume(Scheduler)} runs synchronously from the
 * previous wait point up to the next one and reports how long to wait via the returned {@link Step}. Shared state may
 * only be touched inside {@code resume}; nothing happens while a process is suspended.
 *
 * @author hal.hildebrand
 */
public interface SimProcess {

    /**
     * Human readable identity, used in logs and failure reports.
     */
    String name();

    /**
     * Run the process up to its next wait point.
     *
     * @param scheduler the driving scheduler, for the current time and for starting further processes
     * @return the next wait, or {@link Step#finish()}
     */
    Step resume(Scheduler scheduler);
}
