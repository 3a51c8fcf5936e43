package io.b2mash.collab.channel;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface GroupMessageRepository extends JpaRepository<GroupMessage, Long> {

  List<GroupMessage> findByChannelIdOrderByCreatedAtAscIdAsc(Long channelId);
}
