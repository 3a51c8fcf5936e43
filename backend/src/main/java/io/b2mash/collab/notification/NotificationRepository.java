package io.b2mash.collab.notification;

import java.time.Instant;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface NotificationRepository extends JpaRepository<Notification, Long> {

  @Query(
      """
      SELECT n FROM Notification n
      WHERE n.userId = :userId
      ORDER BY n.createdAt DESC
      """)
  Page<Notification> findByUserId(@Param("userId") Long userId, Pageable pageable);

  @Query(
      """
      SELECT n FROM Notification n
      WHERE n.userId = :userId
        AND n.status <> io.b2mash.collab.notification.NotificationStatus.READ
      ORDER BY n.createdAt DESC
      """)
  Page<Notification> findUnreadByUserId(@Param("userId") Long userId, Pageable pageable);

  @Query(
      """
      SELECT COUNT(n) FROM Notification n
      WHERE n.userId = :userId
        AND n.status <> io.b2mash.collab.notification.NotificationStatus.READ
      """)
  long countUnreadByUserId(@Param("userId") Long userId);

  @Modifying
  @Query(
      """
      UPDATE Notification n
      SET n.status = io.b2mash.collab.notification.NotificationStatus.READ, n.readAt = :now
      WHERE n.userId = :userId
        AND n.status <> io.b2mash.collab.notification.NotificationStatus.READ
      """)
  int markAllRead(@Param("userId") Long userId, @Param("now") Instant now);

  @Modifying
  @Query(
      """
      DELETE FROM Notification n
      WHERE n.relatedEntityType = :entityType
        AND n.relatedEntityId = :entityId
      """)
  int deleteByRelatedEntity(
      @Param("entityType") String entityType, @Param("entityId") Long entityId);

  long countByRelatedEntityTypeAndRelatedEntityId(String relatedEntityType, Long relatedEntityId);
}
