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
 * Receives processes that terminated by throwing from {@link SimProcess#resume(Scheduler)}.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface ProcessFailureHandler {

    /**
     * @param process the failed process, which will not be resumed again
     * @param time    virtual time of the failure
     * @param failure the exception thrown by the process
     */
    void processFailed(SimProcess process, double time, RuntimeException failure);
}
