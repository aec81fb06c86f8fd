/*
 * Copyright 2024 Roman Khlebnov
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

package io.github.suppierk.es.user;

import de.mkammerer.argon2.Argon2;
import de.mkammerer.argon2.Argon2Factory;

/**
 * {@link PasswordHasher} using Argon2id, producing hashes in PHC format, e.g. {@code
 * $argon2id$v=19$m=65536,t=3,p=1$...}.
 */
public final class Argon2PasswordHasher implements PasswordHasher {
  private static final int SALT_LENGTH = 16;
  private static final int HASH_LENGTH = 32;

  private static final int DEFAULT_ITERATIONS = 3;
  private static final int DEFAULT_MEMORY_KIB = 65536;
  private static final int DEFAULT_PARALLELISM = 1;

  private final Argon2 argon2;
  private final int iterations;
  private final int memoryKib;
  private final int parallelism;

  /** Creates a hasher with 3 iterations, 64 MiB of memory and no parallelism. */
  public Argon2PasswordHasher() {
    this(DEFAULT_ITERATIONS, DEFAULT_MEMORY_KIB, DEFAULT_PARALLELISM);
  }

  /**
   * @param iterations time cost
   * @param memoryKib memory cost in KiB
   * @param parallelism number of lanes
   */
  public Argon2PasswordHasher(final int iterations, final int memoryKib, final int parallelism) {
    if (iterations < 1 || memoryKib < 8 * parallelism || parallelism < 1) {
      throw new IllegalArgumentException(
          "Invalid Argon2 parameters: t=%d, m=%d, p=%d"
              .formatted(iterations, memoryKib, parallelism));
    }

    this.argon2 =
        Argon2Factory.create(Argon2Factory.Argon2Types.ARGON2id, SALT_LENGTH, HASH_LENGTH);
    this.iterations = iterations;
    this.memoryKib = memoryKib;
    this.parallelism = parallelism;
  }

  /** {@inheritDoc} */
  @Override
  public String hash(final String password) {
    if (password == null || password.isEmpty()) {
      throw new IllegalArgumentException("Password cannot be empty");
    }

    final char[] chars = password.toCharArray();
    try {
      return argon2.hash(iterations, memoryKib, parallelism, chars);
    } finally {
      argon2.wipeArray(chars);
    }
  }

  /** {@inheritDoc} */
  @Override
  public boolean verify(final String passwordHash, final String password) {
    if (passwordHash == null || password == null) {
      return false;
    }

    final char[] chars = password.toCharArray();
    try {
      return argon2.verify(passwordHash, chars);
    } finally {
      argon2.wipeArray(chars);
    }
  }
}
