/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.tools.utils.anonymization;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.matchesPattern;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

public class PseudonymGeneratorTests {

    @Test
    public void testShapeOfPseudonym() {
        PseudonymGenerator generator = new PseudonymGenerator(16, 3, "anon_");
        String pseudonym = generator.generate("alice@example.com", candidate -> false);

        assertThat(pseudonym, matchesPattern("anon_[0-9a-f]{16}"));
        assertEquals("anon_", generator.getPrefix());
    }

    @Test
    public void testWithoutPrefix() {
        PseudonymGenerator generator = new PseudonymGenerator(64, 0, null);
        assertThat(generator.generate(42L, candidate -> false), matchesPattern("[0-9a-f]{64}"));
    }

    @Test
    public void testSaltMakesPseudonymsUnlinkable() {
        PseudonymGenerator generator = new PseudonymGenerator(32, 0, "");
        String first = generator.generate("bob", candidate -> false);
        String second = generator.generate("bob", candidate -> false);

        assertThat(first, not(second));
    }

    @Test
    public void testSameSeedSameResult() {
        String first = new PseudonymGenerator(12, 0, "", new Random(1)).generate("carol", candidate -> false);
        String second = new PseudonymGenerator(12, 0, "", new Random(1)).generate("carol", candidate -> false);
        assertEquals(first, second);
    }

    @Test
    public void testCollisionIsRetried() {
        AtomicInteger attempts = new AtomicInteger();
        PseudonymGenerator generator = new PseudonymGenerator(8, 3, "p");
        String pseudonym = generator.generate("dave", candidate -> attempts.incrementAndGet() < 3);

        assertEquals(3, attempts.get());
        assertThat(pseudonym, startsWith("p"));
    }

    @Test
    public void testRetriesExhausted() {
        AtomicInteger attempts = new AtomicInteger();
        PseudonymGenerator generator = new PseudonymGenerator(8, 2, "");

        assertThrows(PseudonymCollisionException.class, () -> generator.generate("erin", candidate -> {
            attempts.incrementAndGet();
            return true;
        }));
        assertEquals(3, attempts.get());
    }

    @Test
    public void testInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> new PseudonymGenerator(7, 1, ""));
        assertThrows(IllegalArgumentException.class, () -> new PseudonymGenerator(65, 1, ""));
        assertThrows(IllegalArgumentException.class, () -> new PseudonymGenerator(16, -1, ""));
    }
}
