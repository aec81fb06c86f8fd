package io.github.suppierk.es.test;

import io.github.suppierk.es.cqrs.IdentityProvider;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/** Hands out {@code 00000000-0000-0000-0000-000000000001}, {@code ...002} and so on. */
public final class SequentialIdentityProvider implements IdentityProvider {
  private final AtomicLong counter = new AtomicLong();

  public static UUID id(long sequence) {
    return new UUID(0L, sequence);
  }

  @Override
  public UUID newId() {
    return id(counter.incrementAndGet());
  }
}
