/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataxform.tools.utils.anonymization;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Random;
import java.util.function.Predicate;

import com.google.common.hash.Hashing;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;

/**
 * Generates hashed identifiers: SHA-256 of a fresh random salt and the original value, as lowercase hex cut to
 * {@code hashLength} characters and preceded by an optional prefix. A candidate that is already taken is a collision
 * and is regenerated with a new salt, at most {@code maxRetries} times.
 */
@Log4j2
public class PseudonymGenerator {
    public static final int MIN_HASH_LENGTH = 8;
    public static final int MAX_HASH_LENGTH = 64;
    private static final int SALT_BYTES = 16;

    @Getter
    private final int hashLength;
    @Getter
    private final int maxRetries;
    @Getter
    private final String prefix;
    private final Random random;

    public PseudonymGenerator(int hashLength, int maxRetries, String prefix) {
        this(hashLength, maxRetries, prefix, new SecureRandom());
    }

    public PseudonymGenerator(int hashLength, int maxRetries, String prefix, Random random) {
        if (hashLength < MIN_HASH_LENGTH || hashLength > MAX_HASH_LENGTH) {
            throw new IllegalArgumentException(
                "Hash length must be between " + MIN_HASH_LENGTH + " and " + MAX_HASH_LENGTH + ", got: " + hashLength
            );
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Max retries cannot be negative, got: " + maxRetries);
        }
        this.hashLength = hashLength;
        this.maxRetries = maxRetries;
        this.prefix = prefix == null ? "" : prefix;
        this.random = random;
    }

    /**
     * Generate a pseudonym for a value.
     *
     * @param original value to hide
     * @param taken tells whether a candidate is already used by another value
     * @return a pseudonym for which {@code taken} is false
     * @throws PseudonymCollisionException when the first attempt and all retries collide
     */
    public String generate(Object original, Predicate<String> taken) {
        String value = String.valueOf(original);
        byte[] salt = new byte[SALT_BYTES];
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            random.nextBytes(salt);
            String hash = Hashing.sha256().newHasher().putBytes(salt).putString(value, StandardCharsets.UTF_8).hash().toString();
            String candidate = prefix + hash.substring(0, hashLength);
            if (!taken.test(candidate)) {
                return candidate;
            }
            log.debug("Pseudonym collision on attempt {}, regenerating", attempt + 1);
        }
        throw new PseudonymCollisionException("Could not generate a unique pseudonym after " + (maxRetries + 1) + " attempts");
    }
}
