package io.b2mash.collab.channel;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface GroupChannelRepository extends JpaRepository<GroupChannel, Long> {

  /** Public channels plus the private ones the user holds a membership row in. */
  @Query(
      """
      SELECT c FROM GroupChannel c
      WHERE c.isPrivate = false
         OR c.id IN (SELECT m.channelId FROM ChannelMember m WHERE m.userId = :userId)
      ORDER BY c.name ASC, c.id ASC
      """)
  List<GroupChannel> findVisibleTo(@Param("userId") Long userId);
}
