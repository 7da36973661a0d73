/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *     http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.dbmsampler.mysql.sampler;

import com.google.common.base.Ticker;

import java.time.Duration;
import java.util.Objects;

/**
 * Enforces a minimum wall-clock interval between successive collection cycles.
 *
 * <p>This is an advisory sleep, not a token bucket: a cycle that overruns the
 * interval is followed immediately by the next one and no credit accrues.
 */
public class ConstantRateLimiter {

    /**
     * Suspension hook so tests can observe waits without sleeping.
     */
    @FunctionalInterface
    public interface Sleeper {
        Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);

        void sleep(Duration duration) throws InterruptedException;
    }

    private final Ticker ticker;
    private final Sleeper sleeper;

    private volatile double rate;
    private long lastEventNanos;
    private boolean started;

    public ConstantRateLimiter(double rate) {
        this(rate, Ticker.systemTicker(), Sleeper.SYSTEM);
    }

    public ConstantRateLimiter(double rate, Ticker ticker, Sleeper sleeper) {
        validateRate(rate);
        this.rate = rate;
        this.ticker = Objects.requireNonNull(ticker, "ticker");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Block until at least {@code 1/rate} seconds have passed since the previous
     * call returned. The first call never blocks.
     *
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public void await() throws InterruptedException {
        if (started) {
            long periodNanos = periodNanos(rate);
            long elapsed = ticker.read() - lastEventNanos;
            long remaining = periodNanos - elapsed;
            if (remaining > 0) {
                sleeper.sleep(Duration.ofNanos(remaining));
            }
        }
        started = true;
        lastEventNanos = ticker.read();
    }

    /**
     * Change the interval for subsequent waits. A wait already in progress keeps
     * the interval it started with.
     */
    public void setRate(double rate) {
        validateRate(rate);
        this.rate = rate;
    }

    public double getRate() {
        return rate;
    }

    public Duration getPeriod() {
        return Duration.ofNanos(periodNanos(rate));
    }

    private static long periodNanos(double rate) {
        return (long) (Duration.ofSeconds(1).toNanos() / rate);
    }

    private static void validateRate(double rate) {
        if (!(rate > 0) || Double.isInfinite(rate)) {
            throw new IllegalArgumentException("Rate must be a positive number of collections per second: " + rate);
        }
    }
}
