package io.b2mash.collab.message;

import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PrivateMessageRepository extends JpaRepository<PrivateMessage, Long> {

  @Query(
      """
      SELECT m FROM PrivateMessage m
      WHERE (m.senderId = :userId AND m.recipientId = :otherId)
         OR (m.senderId = :otherId AND m.recipientId = :userId)
      ORDER BY m.createdAt ASC, m.id ASC
      """)
  List<PrivateMessage> findConversation(
      @Param("userId") Long userId, @Param("otherId") Long otherId);

  @Query(
      """
      SELECT m FROM PrivateMessage m
      WHERE m.senderId = :userId OR m.recipientId = :userId
      ORDER BY m.createdAt DESC, m.id DESC
      """)
  List<PrivateMessage> findAllInvolving(@Param("userId") Long userId);

  long countByRecipientIdAndReadAtIsNull(Long recipientId);

  @Modifying
  @Query(
      """
      UPDATE PrivateMessage m SET m.readAt = :now
      WHERE m.recipientId = :recipientId AND m.senderId = :senderId AND m.readAt IS NULL
      """)
  int markConversationRead(
      @Param("recipientId") Long recipientId,
      @Param("senderId") Long senderId,
      @Param("now") Instant now);
}
