package io.github.suppierk.es.user;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class Argon2PasswordHasherTest {
  private final Argon2PasswordHasher hasher = new Argon2PasswordHasher(1, 1024, 1);

  @Test
  void hash_is_encoded_argon2id() {
    final String hash = hasher.hash("secret");

    assertTrue(hash.startsWith("$argon2id$"), hash);
    assertFalse(hash.contains("secret"));
  }

  @Test
  void hash_is_salted() {
    assertNotEquals(hasher.hash("secret"), hasher.hash("secret"));
  }

  @Test
  void only_original_password_verifies() {
    final String hash = hasher.hash("secret");

    assertTrue(hasher.verify(hash, "secret"));
    assertFalse(hasher.verify(hash, "Secret"));
    assertFalse(hasher.verify(null, "secret"));
    assertFalse(hasher.verify(hash, null));
  }

  @Test
  void when_password_is_empty_illegal_argument_exception_is_thrown() {
    assertThrows(IllegalArgumentException.class, () -> hasher.hash(""));
    assertThrows(IllegalArgumentException.class, () -> hasher.hash(null));
  }

  @Test
  void when_parameters_are_invalid_illegal_argument_exception_is_thrown() {
    assertThrows(IllegalArgumentException.class, () -> new Argon2PasswordHasher(0, 1024, 1));
    assertThrows(IllegalArgumentException.class, () -> new Argon2PasswordHasher(1, 4, 1));
    assertThrows(IllegalArgumentException.class, () -> new Argon2PasswordHasher(1, 1024, 0));
  }
}
