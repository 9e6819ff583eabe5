package dev.mars.pgevents.api.projection;

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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("core")
class ShardNameTest {

    @Test
    void testIdentityJoinsProjectionAndKey() {
        ShardName shard = new ShardName("TripDistance", "3");

        assertEquals("TripDistance", shard.getProjectionName());
        assertEquals("3", shard.getShardKey());
        assertEquals("TripDistance:3", shard.getIdentity());
        assertEquals("TripDistance:3", shard.toString());
    }

    @Test
    void testAllShard() {
        ShardName shard = ShardName.all("Trip");

        assertEquals("Trip:All", shard.getIdentity());
        assertEquals(ShardName.ALL, shard.getShardKey());
    }

    @Test
    void testParseSplitsOnLastColon() {
        ShardName shard = ShardName.parse("billing:Invoice:2");

        assertEquals("billing:Invoice", shard.getProjectionName());
        assertEquals("2", shard.getShardKey());
    }

    @Test
    void testParseWithoutKeyMeansAll() {
        assertEquals(ShardName.all("Trip"), ShardName.parse("Trip"));
    }

    @Test
    void testEqualityFollowsIdentity() {
        assertEquals(new ShardName("Trip", "1"), ShardName.parse("Trip:1"));
        assertEquals(new ShardName("Trip", "1").hashCode(), ShardName.parse("Trip:1").hashCode());
        assertNotEquals(new ShardName("Trip", "1"), new ShardName("Trip", "2"));
    }

    @Test
    void testRejectsBlankParts() {
        assertThrows(IllegalArgumentException.class, () -> new ShardName(" ", "1"));
        assertThrows(IllegalArgumentException.class, () -> new ShardName("Trip", ""));
        assertThrows(IllegalArgumentException.class, () -> new ShardName(null, "1"));
    }
}
