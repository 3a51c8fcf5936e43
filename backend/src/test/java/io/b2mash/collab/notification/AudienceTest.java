package io.b2mash.collab.notification;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class AudienceTest {

  @Test
  void taskAudienceExcludesActingCreator() {
    var audience = Audience.forTask(List.of(7L), 8L, 3L, 3L);

    assertThat(audience).containsExactly(7L, 8L);
  }

  @Test
  void responsibleWhoIsAlsoParticipantAppearsOnce() {
    var audience = Audience.forTask(List.of(7L, 8L), 8L, 3L, 9L);

    assertThat(audience).containsExactly(7L, 8L, 3L);
  }

  @Test
  void nullsAreIgnored() {
    var audience = Audience.forTask(Arrays.asList(7L, null), null, 3L, null);

    assertThat(audience).containsExactly(7L, 3L);
    assertThat(Audience.forTask(null, null, 3L, 3L)).isEmpty();
  }

  @Test
  void excludingDropsOnlyTheActor() {
    assertThat(Audience.excluding(List.of(1L, 2L, 3L), 2L)).containsExactly(1L, 3L);
  }
}
