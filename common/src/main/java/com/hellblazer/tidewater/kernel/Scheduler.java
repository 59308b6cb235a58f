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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.PriorityQueue;

/**
 * Single threaded, cooperative discrete event scheduler.
 * <p>
 * Owns virtual time and a queue of pending process resumptions ordered by {@code (wakeTime, sequence)}, where the
 * sequence is assigned at submission. The earliest resumption always runs next and ties are resumed in submission
 * order, so a given set of processes started in a given order replays identically.
 * <p>
 * {@link #run(double)} stops at the horizon: a resumption due later than the horizon is discarded, never deferred.
 * A process that throws is dropped and reported to the {@link ProcessFailureHandler}; every other process keeps
 * running.
 * <p>
 * Usage:
 * <pre>
 * var scheduler = new Scheduler((process, time, failure) -> log.warn("{} failed", process.name(), failure));
 * scheduler.start(new TickingProcess());
 * scheduler.run(720.0);
 * </pre>
 *
 * @author hal.hildebrand
 */
public class Scheduler {
    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private record Resumption(double wakeTime, long sequence, SimProcess process)
    implements Comparable<Resumption> {
        @Override
        public int compareTo(Resumption o) {
            var byTime = Double.compare(wakeTime, o.wakeTime);
            return byTime != 0 ? byTime : Long.compare(sequence, o.sequence);
        }
    }

    private final PriorityQueue<Resumption> pending = new PriorityQueue<>();
    private final ProcessFailureHandler     failureHandler;
    private       double                    now;
    private       long                      sequence;
    private       long                      resumptions;
    private       long                      failures;
    private       long                      discarded;
    private       boolean                   running;

    public Scheduler(ProcessFailureHandler failureHandler) {
        this.failureHandler = Objects.requireNonNull(failureHandler, "failureHandler");
    }

    /**
     * Submit a process for its first resumption at the current time.
     *
     * @param process the process to start
     */
    public void start(SimProcess process) {
        submit(process, now);
    }

    /**
     * @return the current virtual time
     */
    public double now() {
        return now;
    }

    /**
     * Drive all processes until the queue drains or the next resumption lies beyond the horizon.
     *
     * @param horizon the last virtual time at which resumptions still run
     * @return the virtual time of the last resumption executed
     */
    public double run(double horizon) {
        if (running) {
            throw new IllegalStateException("Scheduler is already running");
        }
        running = true;
        try {
            while (!pending.isEmpty()) {
                var next = pending.peek();
                if (next.wakeTime() > horizon) {
                    discarded += pending.size();
                    log.debug("Horizon {} reached, discarding {} pending resumptions", horizon, pending.size());
                    pending.clear();
                    break;
                }
                pending.poll();
                now = next.wakeTime();
                resume(next.process());
            }
        } finally {
            running = false;
        }
        return now;
    }

    public int pendingCount() {
        return pending.size();
    }

    public long getResumptions() {
        return resumptions;
    }

    public long getFailures() {
        return failures;
    }

    public long getDiscarded() {
        return discarded;
    }

    private void resume(SimProcess process) {
        Step step;
        try {
            step = process.resume(this);
        } catch (RuntimeException e) {
            failures++;
            failureHandler.processFailed(process, now, e);
            return;
        }
        resumptions++;
        if (step instanceof Step.Hold hold) {
            submit(process, now + hold.delay());
        }
    }

    private void submit(SimProcess process, double wakeTime) {
        pending.add(new Resumption(wakeTime, sequence++, process));
    }

    @Override
    public String toString() {
        return String.format("Scheduler{now=%.3f, pending=%d, resumptions=%d, failures=%d}", now, pending.size(),
                             resumptions, failures);
    }
}
