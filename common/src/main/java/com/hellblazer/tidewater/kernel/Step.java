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
 * The outcome of resuming a {@link SimProcess}: either a wait of some virtual duration, or completion.
 *
 * @author hal.hildebrand
 */
public sealed interface Step permits Step.Hold, Step.Finish {

    /**
     * Suspend the process for {@code delay} units of virtual time.
     *
     * @param delay non-negative wait duration
     * @return the hold step
     */
    static Step hold(double delay) {
        return new Hold(delay);
    }

    /**
     * The process has nothing further to do.
     */
    static Step finish() {
        return Finish.INSTANCE;
    }

    /**
     * Wait for {@code delay} virtual time units before the next resumption.
     *
     * @param delay Wait duration, never negative or NaN
     */
    record Hold(double delay) implements Step {
        public Hold {
            if (!(delay >= 0.0)) {
                throw new IllegalArgumentException("Hold delay must be non-negative: " + delay);
            }
        }
    }

    /**
     * Process completion.
     */
    final class Finish implements Step {
        private static final Finish INSTANCE = new Finish();

        private Finish() {
        }

        @Override
        public String toString() {
            return "Finish";
        }
    }
}
