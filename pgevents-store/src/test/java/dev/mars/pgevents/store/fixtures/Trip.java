package dev.mars.pgevents.store.fixtures;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import dev.mars.pgevents.store.aggregation.Aggregator;

/**
 * Aggregate used by the store tests.
 */
public record Trip(String driver, int kilometres, boolean ended, int changes) {

    public static final Aggregator<Trip> AGGREGATOR = Aggregator.forType(Trip.class)
        .createdBy(TripStarted.class, started -> new Trip(started.driver(), 0, false, 1))
        .apply(Travelled.class, Trip::travel)
        .apply(TripEnded.class, (trip, ended) -> trip.end())
        .build();

    public Trip travel(Travelled travelled) {
        return new Trip(driver, kilometres + travelled.kilometres(), ended, changes + 1);
    }

    public Trip end() {
        return new Trip(driver, kilometres, true, changes + 1);
    }
}
