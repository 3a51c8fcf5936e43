package io.b2mash.collab.channel;

import io.b2mash.collab.exception.ForbiddenException;
import io.b2mash.collab.exception.ResourceNotFoundException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Effective channel membership. A user is a member of a channel when they hold an explicit row,
 * or when the channel is public. Callers run these checks inside their own transaction.
 */
@Component
public class ChannelMembershipResolver {

  private static final Logger log = LoggerFactory.getLogger(ChannelMembershipResolver.class);

  private final GroupChannelRepository channelRepository;
  private final ChannelMemberRepository memberRepository;

  public ChannelMembershipResolver(
      GroupChannelRepository channelRepository, ChannelMemberRepository memberRepository) {
    this.channelRepository = channelRepository;
    this.memberRepository = memberRepository;
  }

  public GroupChannel requireChannel(Long channelId) {
    return channelRepository
        .findById(channelId)
        .orElseThrow(() -> new ResourceNotFoundException("Channel", channelId));
  }

  public boolean isMember(Long channelId, Long userId) {
    return isMember(requireChannel(channelId), userId);
  }

  public boolean isMember(GroupChannel channel, Long userId) {
    return channel.isPublic()
        || memberRepository.existsByChannelIdAndUserId(channel.getId(), userId);
  }

  /** Loads the channel and rejects users without effective membership. */
  public GroupChannel requireMember(Long channelId, Long userId) {
    var channel = requireChannel(channelId);
    if (!isMember(channel, userId)) {
      throw new ForbiddenException(
          "Not a channel member", "You are not a member of channel " + channelId);
    }
    return channel;
  }

  /** Requires the actor's own explicit row with admin rights. */
  public ChannelMember requireAdmin(Long channelId, Long actorId) {
    requireChannel(channelId);
    var row =
        memberRepository
            .findByChannelIdAndUserId(channelId, actorId)
            .orElseThrow(
                () ->
                    new ForbiddenException(
                        "Not a channel member", "You are not a member of channel " + channelId));
    if (!row.isAdmin()) {
      throw new ForbiddenException(
          "Not a channel admin", "Only admins can manage members of channel " + channelId);
    }
    return row;
  }

  /**
   * Checks that the actor may remove the target. Any member may remove themself; removing
   * someone else takes admin rights. The target must hold a membership row.
   */
  public ChannelMember checkRemoval(Long channelId, Long targetUserId, Long actorId) {
    if (!targetUserId.equals(actorId)) {
      requireAdmin(channelId, actorId);
    } else {
      requireChannel(channelId);
    }
    return memberRepository
        .findByChannelIdAndUserId(channelId, targetUserId)
        .orElseThrow(
            () -> new ResourceNotFoundException("ChannelMember", channelId + "/" + targetUserId));
  }

  /**
   * Makes sure the poster holds a membership row, inserting a non-admin row when they post to a
   * public channel they never joined. Returns whether a row was inserted.
   */
  public boolean ensureMembershipForPost(GroupChannel channel, Long userId) {
    if (memberRepository.existsByChannelIdAndUserId(channel.getId(), userId)) {
      return false;
    }
    if (!channel.isPublic()) {
      throw new ForbiddenException(
          "Not a channel member", "You are not a member of channel " + channel.getId());
    }
    memberRepository.saveAndFlush(new ChannelMember(channel.getId(), userId, false));
    log.info("User {} joined public channel {} by posting", userId, channel.getId());
    return true;
  }

  public List<GroupChannel> visibleChannels(Long userId) {
    return channelRepository.findVisibleTo(userId);
  }
}
