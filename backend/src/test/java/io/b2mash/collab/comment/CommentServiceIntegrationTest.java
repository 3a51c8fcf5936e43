package io.b2mash.collab.comment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.collab.exception.ForbiddenException;
import io.b2mash.collab.exception.ResourceNotFoundException;
import io.b2mash.collab.exception.ValidationException;
import io.b2mash.collab.member.User;
import io.b2mash.collab.member.UserRepository;
import io.b2mash.collab.task.TaskDraft;
import io.b2mash.collab.task.TaskService;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class CommentServiceIntegrationTest {

  @Autowired private CommentService commentService;
  @Autowired private TaskService taskService;
  @Autowired private UserRepository userRepository;
  @Autowired private JdbcTemplate jdbcTemplate;

  private Long authorId;
  private Long otherId;
  private Long taskId;

  @BeforeAll
  void setUp() {
    authorId = createUser("author", null);
    otherId = createUser("other", "other@test.com");
    var draft =
        new TaskDraft(
            "Commented task", null, null, otherId, null, null, null, List.of(), null, null);
    taskId = taskService.create(draft, authorId).result().task().getId();
  }

  @Test
  void commentsAreListedOldestFirstWithAuthor() {
    var first = commentService.createComment(taskId, "first", authorId).result();
    commentService.createComment(taskId, "second", otherId);

    var comments = commentService.listComments(taskId);

    assertThat(comments).extracting(CommentResponse::content).contains("first", "second");
    var listed = comments.stream().filter(c -> c.id().equals(first.id())).findFirst().get();
    assertThat(listed.author().id()).isEqualTo(authorId);
    assertThat(listed.attachments()).isEmpty();
  }

  @Test
  void responsibleUserIsNotifiedOfComment() {
    var created = commentService.createComment(taskId, "please review", authorId);

    assertThat(created.failedSideEffects()).isEmpty();
    var notified =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM notifications WHERE user_id = ? AND type = 'task_comment'"
                + " AND related_entity_type = 'task' AND related_entity_id = ?",
            Integer.class,
            otherId,
            taskId);
    assertThat(notified).isPositive();
  }

  @Test
  void onlyAuthorMayEditOrDelete() {
    var comment = commentService.createComment(taskId, "mine", authorId).result();

    assertThatThrownBy(() -> commentService.updateComment(comment.id(), "hijack", otherId))
        .isInstanceOf(ForbiddenException.class);
    assertThatThrownBy(() -> commentService.deleteComment(comment.id(), otherId))
        .isInstanceOf(ForbiddenException.class);

    var edited = commentService.updateComment(comment.id(), " edited ", authorId).result();
    assertThat(edited.content()).isEqualTo("edited");

    commentService.deleteComment(comment.id(), authorId);
    assertThat(commentService.listComments(taskId))
        .extracting(CommentResponse::id)
        .doesNotContain(comment.id());
  }

  @Test
  void rejectsBlankContentAndUnknownTask() {
    assertThatThrownBy(() -> commentService.createComment(taskId, "  ", authorId))
        .isInstanceOf(ValidationException.class);
    assertThatThrownBy(() -> commentService.createComment(999_999L, "hello", authorId))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  private Long createUser(String prefix, String email) {
    var username = prefix + "-" + UUID.randomUUID();
    return userRepository.save(new User(username, "{noop}secret", prefix, email)).getId();
  }
}
