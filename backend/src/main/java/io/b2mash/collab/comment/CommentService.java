package io.b2mash.collab.comment;

import io.b2mash.collab.exception.DatabaseException;
import io.b2mash.collab.exception.ForbiddenException;
import io.b2mash.collab.exception.ResourceNotFoundException;
import io.b2mash.collab.exception.ValidationException;
import io.b2mash.collab.member.User;
import io.b2mash.collab.member.UserService;
import io.b2mash.collab.member.UserSummary;
import io.b2mash.collab.notification.Audience;
import io.b2mash.collab.notification.MutationOutcome;
import io.b2mash.collab.notification.NotificationFanout;
import io.b2mash.collab.notification.NotificationRequest;
import io.b2mash.collab.notification.NotificationType;
import io.b2mash.collab.persistence.PersistenceExecutor;
import io.b2mash.collab.realtime.BroadcastDispatcher;
import io.b2mash.collab.realtime.EventType;
import io.b2mash.collab.realtime.RealtimeEvent;
import io.b2mash.collab.task.Task;
import io.b2mash.collab.task.TaskParticipantRepository;
import io.b2mash.collab.task.TaskRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/** Task comments. Only the author may edit or delete a comment. */
@Service
public class CommentService {

  private static final Logger log = LoggerFactory.getLogger(CommentService.class);
  private static final int PREVIEW_LENGTH = 120;

  private final CommentRepository commentRepository;
  private final CommentAttachmentRepository attachmentRepository;
  private final TaskRepository taskRepository;
  private final TaskParticipantRepository participantRepository;
  private final UserService userService;
  private final PersistenceExecutor executor;
  private final BroadcastDispatcher broadcastDispatcher;
  private final NotificationFanout notificationFanout;

  public CommentService(
      CommentRepository commentRepository,
      CommentAttachmentRepository attachmentRepository,
      TaskRepository taskRepository,
      TaskParticipantRepository participantRepository,
      UserService userService,
      PersistenceExecutor executor,
      BroadcastDispatcher broadcastDispatcher,
      NotificationFanout notificationFanout) {
    this.commentRepository = commentRepository;
    this.attachmentRepository = attachmentRepository;
    this.taskRepository = taskRepository;
    this.participantRepository = participantRepository;
    this.userService = userService;
    this.executor = executor;
    this.broadcastDispatcher = broadcastDispatcher;
    this.notificationFanout = notificationFanout;
  }

  public List<CommentResponse> listComments(Long taskId) {
    return read(
        () -> {
          requireTask(taskId);
          var comments = commentRepository.findByTaskIdOrderByCreatedAtAsc(taskId);
          if (comments.isEmpty()) {
            return List.<CommentResponse>of();
          }
          var attachments =
              attachmentRepository
                  .findByCommentIdIn(comments.stream().map(Comment::getId).toList())
                  .stream()
                  .collect(Collectors.groupingBy(CommentAttachment::getCommentId));
          var authors =
              userService.findAllById(comments.stream().map(Comment::getUserId).toList());
          return comments.stream()
              .map(
                  c ->
                      CommentResponse.from(
                          c,
                          author(authors, c.getUserId()),
                          attachments.getOrDefault(c.getId(), List.of())))
              .toList();
        },
        "listComments");
  }

  public MutationOutcome<CommentResponse> createComment(Long taskId, String content, Long actorId) {
    requireContent(content);
    var created =
        persist(
            () -> {
              var task = requireTask(taskId);
              var comment = commentRepository.save(new Comment(taskId, actorId, content.strip()));
              return new Created(task, comment, userService.summarize(actorId));
            },
            "createComment");

    var response = CommentResponse.from(created.comment(), created.author(), List.of());
    log.info("Comment {} added to task {} by user {}", response.id(), taskId, actorId);

    var failures = new ArrayList<String>();
    broadcast(failures, EventType.COMMENT_CREATED, response);

    var task = created.task();
    var request =
        NotificationRequest.forTask(
            NotificationType.TASK_COMMENT,
            "New comment on task: " + task.getTitle(),
            preview(created.comment().getContent()),
            task.getId());
    var outcome = notificationFanout.notify(request, audienceOf(task, actorId));
    if (outcome.hasFailures()) {
      failures.add("fanout:" + NotificationType.TASK_COMMENT.value());
    }
    return new MutationOutcome<>(response, failures);
  }

  public MutationOutcome<CommentResponse> updateComment(
      Long commentId, String content, Long actorId) {
    requireContent(content);
    var updated =
        persist(
            () -> {
              var comment = requireOwnComment(commentId, actorId);
              comment.updateContent(content.strip());
              var saved = commentRepository.save(comment);
              return CommentResponse.from(
                  saved,
                  userService.summarize(actorId),
                  attachmentRepository.findByCommentIdIn(List.of(commentId)));
            },
            "updateComment");

    var failures = new ArrayList<String>();
    broadcast(failures, EventType.COMMENT_UPDATED, updated);
    return new MutationOutcome<>(updated, failures);
  }

  /** Deletes the comment together with its attachment rows. */
  public MutationOutcome<Long> deleteComment(Long commentId, Long actorId) {
    var taskId =
        persist(
            () -> {
              var comment = requireOwnComment(commentId, actorId);
              attachmentRepository.deleteByCommentId(commentId);
              commentRepository.delete(comment);
              return comment.getTaskId();
            },
            "deleteComment");
    log.info("Comment {} on task {} deleted by user {}", commentId, taskId, actorId);

    var failures = new ArrayList<String>();
    broadcast(
        failures,
        EventType.COMMENT_DELETED,
        Map.of("commentId", commentId, "taskId", taskId, "deletedBy", actorId));
    return new MutationOutcome<>(commentId, failures);
  }

  // --- Helpers ---

  private record Created(Task task, Comment comment, UserSummary author) {}

  private Task requireTask(Long taskId) {
    return taskRepository
        .findById(taskId)
        .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
  }

  private Comment requireOwnComment(Long commentId, Long actorId) {
    var comment =
        commentRepository
            .findById(commentId)
            .orElseThrow(() -> new ResourceNotFoundException("Comment", commentId));
    if (!comment.isAuthoredBy(actorId)) {
      throw new ForbiddenException(
          "Not the author", "Only the author can modify comment " + commentId);
    }
    return comment;
  }

  private Set<Long> audienceOf(Task task, Long actorId) {
    List<Long> participants;
    try {
      participants =
          executor.executeReadOnly(
              () -> participantRepository.findUserIdsByTaskId(task.getId()),
              "findTaskParticipants");
    } catch (RuntimeException e) {
      log.warn("Could not load participants of task {}: {}", task.getId(), e.getMessage());
      participants = List.of();
    }
    return Audience.forTask(participants, task.getResponsibleId(), task.getCreatorId(), actorId);
  }

  private void broadcast(List<String> failures, EventType type, Object data) {
    try {
      var report = broadcastDispatcher.broadcast(RealtimeEvent.of(type, data));
      if (report.failed() > 0) {
        failures.add("broadcast:" + type.wireName());
      }
    } catch (RuntimeException e) {
      log.warn("Broadcast of {} failed: {}", type.wireName(), e.getMessage());
      failures.add("broadcast:" + type.wireName());
    }
  }

  private <T> T persist(Supplier<T> unit, String operationName) {
    try {
      return executor.executeTransactionWithRetry(unit, operationName);
    } catch (DataAccessException | TransactionException e) {
      throw new DatabaseException(operationName, e);
    }
  }

  private <T> T read(Supplier<T> query, String operationName) {
    try {
      return executor.executeReadOnly(query, operationName);
    } catch (DataAccessException | TransactionException e) {
      throw new DatabaseException(operationName, e);
    }
  }

  private static UserSummary author(Map<Long, User> authors, Long userId) {
    var user = authors.get(userId);
    return user != null ? UserSummary.from(user) : UserSummary.unknown(userId);
  }

  private static void requireContent(String content) {
    if (content == null || content.isBlank()) {
      throw new ValidationException("Comment content is required");
    }
  }

  private static String preview(String content) {
    return content.length() <= PREVIEW_LENGTH
        ? content
        : content.substring(0, PREVIEW_LENGTH) + "...";
  }
}
