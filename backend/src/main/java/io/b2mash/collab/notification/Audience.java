package io.b2mash.collab.notification;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/** Recipient computation for mutations. The acting user never notifies themself. */
public final class Audience {

  private Audience() {}

  /** participants ∪ {responsible} ∪ {creator} − {actor}, in that order, ignoring nulls. */
  public static Set<Long> forTask(
      Collection<Long> participantIds, Long responsibleId, Long creatorId, Long actorId) {
    var audience = new LinkedHashSet<Long>();
    if (participantIds != null) {
      participantIds.stream().filter(Objects::nonNull).forEach(audience::add);
    }
    if (responsibleId != null) {
      audience.add(responsibleId);
    }
    if (creatorId != null) {
      audience.add(creatorId);
    }
    audience.remove(actorId);
    return Collections.unmodifiableSet(audience);
  }

  public static Set<Long> excluding(Collection<Long> userIds, Long actorId) {
    var audience = new LinkedHashSet<Long>();
    userIds.stream().filter(Objects::nonNull).forEach(audience::add);
    audience.remove(actorId);
    return Collections.unmodifiableSet(audience);
  }
}
