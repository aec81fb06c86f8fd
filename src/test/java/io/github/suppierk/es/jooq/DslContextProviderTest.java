package io.github.suppierk.es.jooq;

import static org.junit.jupiter.api.Assertions.*;

import org.jooq.SQLDialect;
import org.jooq.impl.DSL;
import org.junit.jupiter.api.Test;

class DslContextProviderTest {
  @Test
  void when_identity_provider_is_requested_with_null_argument_it_throws_an_exception() {
    assertThrows(IllegalArgumentException.class, () -> DslContextProvider.dslContextIdentity(null));
  }

  @Test
  void when_identity_provider_is_requested_with_correct_argument_it_returns_that_argument() {
    final var dslContext = DSL.using(SQLDialect.DEFAULT);

    final var dslContextProvider =
        assertDoesNotThrow(() -> DslContextProvider.dslContextIdentity(dslContext));

    for (DslContextProvider.Access access : DslContextProvider.Access.values()) {
      final var providedDslContext = assertDoesNotThrow(() -> dslContextProvider.apply(access));

      assertNotNull(providedDslContext);
      assertEquals(dslContext, providedDslContext);
    }
  }

  @Test
  void when_split_provider_is_requested_with_null_argument_it_throws_an_exception() {
    final var dslContext = DSL.using(SQLDialect.DEFAULT);

    assertThrows(
        IllegalArgumentException.class, () -> DslContextProvider.readWriteSplit(null, dslContext));
    assertThrows(
        IllegalArgumentException.class, () -> DslContextProvider.readWriteSplit(dslContext, null));
  }

  @Test
  void when_split_provider_is_used_it_routes_by_access() {
    final var readWrite = DSL.using(SQLDialect.DEFAULT);
    final var readOnly = DSL.using(SQLDialect.DEFAULT);

    final var dslContextProvider = DslContextProvider.readWriteSplit(readWrite, readOnly);

    assertSame(readWrite, dslContextProvider.apply(DslContextProvider.Access.READ_WRITE));
    assertSame(readOnly, dslContextProvider.apply(DslContextProvider.Access.READ_ONLY));
  }
}
