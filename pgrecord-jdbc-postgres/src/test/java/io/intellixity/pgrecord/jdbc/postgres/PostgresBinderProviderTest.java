package io.intellixity.pgrecord.jdbc.postgres;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.pgrecord.jdbc.bind.DiscoveredBinderRegistry;
import io.intellixity.pgrecord.jdbc.bind.JdbcBindContext;
import io.intellixity.pgrecord.sql.Bind;
import io.intellixity.pgrecord.types.MacAddress;
import io.intellixity.pgrecord.types.WireType;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.postgresql.util.PGobject;

import java.sql.PreparedStatement;
import java.sql.Types;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

final class PostgresBinderProviderTest {

  private final PreparedStatement ps = mock(PreparedStatement.class);

  private static DiscoveredBinderRegistry discovered() {
    return new DiscoveredBinderRegistry(PostgresBinderProvider.DIALECT_ID);
  }

  private PGobject boundAt(int position) throws Exception {
    ArgumentCaptor<Object> value = ArgumentCaptor.forClass(Object.class);
    verify(ps).setObject(eq(position), value.capture());
    return assertInstanceOf(PGobject.class, value.getValue());
  }

  @Test
  void json_isBoundAsTypedPgObject() throws Exception {
    var node = new ObjectMapper().readTree("{\"a\":[1,2]}");
    discovered().bind(ps, new JdbcBindContext(1), new Bind(node, WireType.JSON));

    PGobject pg = boundAt(1);
    assertEquals("json", pg.getType());
    assertEquals("{\"a\":[1,2]}", pg.getValue());
  }

  @Test
  void macaddr_isBoundAsTypedPgObject() throws Exception {
    discovered().bind(ps, new JdbcBindContext(2), new Bind(MacAddress.parse("08002b010203"), WireType.MACADDR));

    PGobject pg = boundAt(2);
    assertEquals("macaddr", pg.getType());
    assertEquals("08:00:2b:01:02:03", pg.getValue());
  }

  @Test
  void char_isBoundAsSingleCharacter() throws Exception {
    discovered().bind(ps, new JdbcBindContext(1), new Bind((byte) 'z', WireType.CHAR));

    PGobject pg = boundAt(1);
    assertEquals("char", pg.getType());
    assertEquals("z", pg.getValue());
  }

  @Test
  void nullJson_isTypedOther() throws Exception {
    discovered().bind(ps, new JdbcBindContext(1), new Bind(null, WireType.JSON));
    verify(ps).setNull(1, Types.OTHER);
    verifyNoMoreInteractions(ps);
  }

  @Test
  void otherValues_fallBackToGlobalBinders() throws Exception {
    discovered().bind(ps, new JdbcBindContext(1), new Bind(42L, WireType.BIGINT));
    verify(ps).setObject(1, 42L);
  }
}
