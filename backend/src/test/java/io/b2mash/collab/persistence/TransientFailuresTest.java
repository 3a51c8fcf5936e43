package io.b2mash.collab.persistence;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.orm.jpa.JpaSystemException;

class TransientFailuresTest {

  @ParameterizedTest
  @ValueSource(strings = {"08000", "08001", "08003", "08004", "08006", "57P01"})
  void connectionSqlStatesAreTransient(String sqlState) {
    var failure = new SQLException("connection lost", sqlState);

    assertThat(TransientFailures.isTransient(failure)).isTrue();
  }

  @Test
  void constraintViolationIsPermanent() {
    var failure =
        new DataIntegrityViolationException(
            "fk violation", new SQLException("violates foreign key", "23503"));

    assertThat(TransientFailures.isTransient(failure)).isFalse();
  }

  @Test
  void transientStateIsFoundDeepInCauseChain() {
    var driver = new SQLException("terminating connection", "57P01");
    var failure = new JpaSystemException(new RuntimeException("wrapped", driver));

    assertThat(TransientFailures.isTransient(failure)).isTrue();
  }

  @Test
  void poolExhaustionIsTransient() {
    assertThat(TransientFailures.isTransient(new CannotGetJdbcConnectionException("pool")))
        .isTrue();
    assertThat(TransientFailures.isTransient(new SQLTransientConnectionException("timeout")))
        .isTrue();
  }

  @Test
  void plainRuntimeFailureIsPermanent() {
    assertThat(TransientFailures.isTransient(new IllegalStateException("boom"))).isFalse();
    assertThat(TransientFailures.isTransient(null)).isFalse();
  }
}
