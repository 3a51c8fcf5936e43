package io.b2mash.collab.session;

import java.time.Instant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserSessionRepository extends JpaRepository<UserSession, String> {

  @Modifying
  @Query("DELETE FROM UserSession s WHERE s.expiresAt <= :now")
  int deleteExpired(@Param("now") Instant now);
}
