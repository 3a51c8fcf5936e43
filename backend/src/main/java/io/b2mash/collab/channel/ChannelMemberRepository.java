package io.b2mash.collab.channel;

import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ChannelMemberRepository extends JpaRepository<ChannelMember, ChannelMemberId> {

  List<ChannelMember> findByChannelIdOrderByJoinedAtAsc(Long channelId);

  Optional<ChannelMember> findByChannelIdAndUserId(Long channelId, Long userId);

  boolean existsByChannelIdAndUserId(Long channelId, Long userId);

  @Query("SELECT m.userId FROM ChannelMember m WHERE m.channelId = :channelId")
  List<Long> findUserIdsByChannelId(@Param("channelId") Long channelId);

  @Modifying
  @Query("DELETE FROM ChannelMember m WHERE m.channelId = :channelId AND m.userId = :userId")
  int deleteMembership(@Param("channelId") Long channelId, @Param("userId") Long userId);
}
