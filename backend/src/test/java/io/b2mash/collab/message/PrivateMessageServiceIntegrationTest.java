package io.b2mash.collab.message;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.collab.exception.ResourceNotFoundException;
import io.b2mash.collab.exception.ValidationException;
import io.b2mash.collab.member.User;
import io.b2mash.collab.member.UserRepository;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class PrivateMessageServiceIntegrationTest {

  @Autowired private PrivateMessageService messageService;
  @Autowired private UserRepository userRepository;
  @Autowired private JdbcTemplate jdbcTemplate;

  private Long aliceId;
  private Long bobId;

  @BeforeEach
  void setUp() {
    aliceId = createUser("alice", "alice@test.com");
    bobId = createUser("bob", "bob@test.com");
  }

  @Test
  void sentMessageIsUnreadUntilMarkedRead() {
    messageService.send(bobId, "first", aliceId);
    messageService.send(bobId, "second", aliceId);
    messageService.send(aliceId, "reply", bobId);

    assertThat(messageService.unreadCount(bobId)).isEqualTo(2);
    assertThat(messageService.conversation(bobId, aliceId))
        .extracting(PrivateMessageResponse::content)
        .containsExactly("first", "second", "reply");

    assertThat(messageService.markRead(bobId, aliceId)).isEqualTo(2);
    assertThat(messageService.unreadCount(bobId)).isZero();
    assertThat(messageService.unreadCount(aliceId)).isEqualTo(1);
  }

  @Test
  void conversationsListLatestMessagePerPartner() {
    var carolId = createUser("carol", null);
    messageService.send(bobId, "to bob", aliceId);
    messageService.send(aliceId, "from carol", carolId);

    var conversations = messageService.conversations(aliceId);

    assertThat(conversations).hasSize(2);
    var withCarol =
        conversations.stream().filter(c -> c.user().id().equals(carolId)).findFirst().get();
    assertThat(withCarol.lastMessage().content()).isEqualTo("from carol");
    assertThat(withCarol.unreadCount()).isEqualTo(1);
    var withBob =
        conversations.stream().filter(c -> c.user().id().equals(bobId)).findFirst().get();
    assertThat(withBob.unreadCount()).isZero();
  }

  @Test
  void recipientGetsPendingNotification() {
    var sent = messageService.send(bobId, "ping", aliceId);

    assertThat(sent.failedSideEffects()).isEmpty();
    var pending =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM notifications WHERE user_id = ? AND type = 'private_message'"
                + " AND related_entity_id = ? AND status = 'PENDING'",
            Integer.class,
            bobId,
            sent.result().id());
    assertThat(pending).isEqualTo(1);
  }

  @Test
  void rejectsSelfBlankAndUnknownRecipients() {
    assertThatThrownBy(() -> messageService.send(aliceId, "me", aliceId))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> messageService.send(bobId, "   ", aliceId))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> messageService.send(999_999L, "hello", aliceId))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  private Long createUser(String prefix, String email) {
    var username = prefix + "-" + UUID.randomUUID();
    return userRepository.save(new User(username, "{noop}secret", prefix, email)).getId();
  }
}
