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

/** One-way password hashing capability, hashes are never reversible. */
public interface PasswordHasher {
  /**
   * @param password in plain text
   * @return self-describing hash of the password, including its salt and parameters
   */
  String hash(final String password);

  /**
   * @param passwordHash produced by {@link #hash(String)}
   * @param password in plain text
   * @return {@code true} if the password matches the hash
   */
  boolean verify(final String passwordHash, final String password);
}
