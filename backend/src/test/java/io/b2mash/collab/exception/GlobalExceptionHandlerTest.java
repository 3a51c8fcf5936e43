package io.b2mash.collab.exception;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.SQLTransientConnectionException;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.transaction.CannotCreateTransactionException;

class GlobalExceptionHandlerTest {

  private final GlobalExceptionHandler handler = new GlobalExceptionHandler();
  private final MockHttpServletRequest request =
      new MockHttpServletRequest("POST", "/api/auth/login");

  @Test
  void connectionPoolTimeoutIsDatabaseError() {
    var failure =
        new CannotCreateTransactionException(
            "Could not open JPA EntityManager for transaction",
            new SQLTransientConnectionException("request timed out after 15000ms"));

    var response = handler.handleDataAccess(failure, request);

    assertThat(response.getStatusCode().value()).isEqualTo(500);
    assertThat(response.getBody().error().type()).isEqualTo("DATABASE_ERROR");
  }

  @Test
  void unwrappedDataAccessFailureIsDatabaseError() {
    var response =
        handler.handleDataAccess(new DataAccessResourceFailureException("db down"), request);

    assertThat(response.getStatusCode().value()).isEqualTo(500);
    assertThat(response.getBody().error().type()).isEqualTo("DATABASE_ERROR");
  }

  @Test
  void apiExceptionKeepsItsTypeAndDetails() {
    var response =
        handler.handleApiException(
            new ValidationException("Unknown participant(s)", Map.of("participantIds", 9)),
            request);

    assertThat(response.getStatusCode().value()).isEqualTo(400);
    assertThat(response.getBody().error().type()).isEqualTo("VALIDATION_ERROR");
    assertThat(response.getBody().error().details()).isEqualTo(Map.of("participantIds", 9));
  }
}
