package io.b2mash.collab.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.collab.member.User;
import io.b2mash.collab.member.UserService;
import io.b2mash.collab.member.UserSummary;
import io.b2mash.collab.notification.channel.NotificationDispatcher;
import io.b2mash.collab.persistence.PersistenceExecutor;
import io.b2mash.collab.realtime.BroadcastDispatcher;
import io.b2mash.collab.realtime.DeliveryReport;
import io.b2mash.collab.realtime.EventType;
import io.b2mash.collab.realtime.RealtimeEvent;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class NotificationFanoutTest {

  @Mock private NotificationRepository notificationRepository;
  @Mock private UserService userService;
  @Mock private PersistenceExecutor executor;
  @Mock private NotificationDispatcher notificationDispatcher;
  @Mock private BroadcastDispatcher broadcastDispatcher;

  private NotificationFanout fanout;

  private final NotificationRequest request =
      NotificationRequest.forTask(NotificationType.TASK_UPDATED, "Task updated", "status", 12L);

  @BeforeEach
  void setUp() {
    fanout =
        new NotificationFanout(
            notificationRepository,
            userService,
            executor,
            notificationDispatcher,
            broadcastDispatcher);
  }

  @Test
  void persistsOnePendingRecordPerRecipientWithEmail() {
    when(userService.findAllById(List.of(7L, 8L)))
        .thenReturn(
            Map.of(
                7L, new User("alice", "hash", "Alice", "alice@example.com"),
                8L, new User("bob", "hash", "Bob", null)));
    runTransactionsInline();
    when(notificationRepository.save(any(Notification.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));
    when(notificationDispatcher.dispatch(any(), anyString()))
        .thenReturn(new DeliveryReport(1, 1, 0));

    var outcome = fanout.notify(request, List.of(7L, 8L));

    var saved = ArgumentCaptor.forClass(Notification.class);
    verify(notificationRepository).save(saved.capture());
    assertThat(saved.getValue().getUserId()).isEqualTo(7L);
    assertThat(saved.getValue().getStatus()).isEqualTo(NotificationStatus.PENDING);
    assertThat(saved.getValue().getType()).isEqualTo("task_updated");
    assertThat(saved.getValue().getRelatedEntityId()).isEqualTo(12L);
    assertThat(outcome.persisted()).isEqualTo(1);
    assertThat(outcome.skipped()).isEqualTo(1);
    assertThat(outcome.hasFailures()).isFalse();
  }

  @Test
  void persistenceFailureForOneRecipientDoesNotStopOthers() {
    when(userService.findAllById(List.of(7L, 9L)))
        .thenReturn(
            Map.of(
                7L, new User("alice", "hash", "Alice", "alice@example.com"),
                9L, new User("carol", "hash", "Carol", "carol@example.com")));
    when(executor.executeTransactionWithRetry(any(), eq("persistNotification")))
        .thenThrow(new DataAccessResourceFailureException("connection lost"))
        .thenAnswer(invocation -> ((Supplier<?>) invocation.getArgument(0)).get());
    when(notificationRepository.save(any(Notification.class)))
        .thenAnswer(invocation -> invocation.getArgument(0));
    when(notificationDispatcher.dispatch(any(), anyString()))
        .thenReturn(new DeliveryReport(1, 1, 0));

    var outcome = fanout.notify(request, List.of(7L, 9L));

    assertThat(outcome.failedRecipients()).containsExactly(7L);
    assertThat(outcome.persisted()).isEqualTo(1);
    assertThat(outcome.hasFailures()).isTrue();
    verify(notificationDispatcher, times(1)).dispatch(any(), eq("carol@example.com"));
  }

  @Test
  void recipientLookupFailureIsReportedNotThrown() {
    when(userService.findAllById(anyCollection()))
        .thenThrow(new DataAccessResourceFailureException("db down"));

    var outcome = fanout.notify(request, List.of(7L));

    assertThat(outcome.failedRecipients()).containsExactly(7L);
    verify(notificationRepository, never()).save(any());
  }

  @Test
  void emptyAudienceDoesNothing() {
    assertThat(fanout.notify(request, List.of())).isEqualTo(FanoutOutcome.NONE);
  }

  @Test
  void chatDeliveryAddsSenderIdentity() {
    var sender = new UserSummary(3L, "carol", "Carol");
    when(userService.summarize(3L)).thenReturn(sender);
    when(broadcastDispatcher.sendToUsers(any(), eq(List.of(7L, 3L))))
        .thenReturn(new DeliveryReport(2, 2, 0));

    var report =
        fanout.deliverChat(EventType.PRIVATE_MESSAGE, Map.of("id", 1L), 3L, List.of(7L, 3L));

    var event = ArgumentCaptor.forClass(RealtimeEvent.class);
    verify(broadcastDispatcher).sendToUsers(event.capture(), eq(List.of(7L, 3L)));
    assertThat(event.getValue().type()).isEqualTo(EventType.PRIVATE_MESSAGE);
    @SuppressWarnings("unchecked")
    var data = (Map<String, Object>) event.getValue().data();
    assertThat(data).containsEntry("id", 1L).containsEntry("sender", sender);
    assertThat(report.delivered()).isEqualTo(2);
  }

  @SuppressWarnings("unchecked")
  private void runTransactionsInline() {
    when(executor.executeTransactionWithRetry(any(), anyString()))
        .thenAnswer(invocation -> ((Supplier<Object>) invocation.getArgument(0)).get());
  }
}
