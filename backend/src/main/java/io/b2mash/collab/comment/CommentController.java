package io.b2mash.collab.comment;

import io.b2mash.collab.security.CurrentUser;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class CommentController {

  private final CommentService commentService;

  public CommentController(CommentService commentService) {
    this.commentService = commentService;
  }

  @GetMapping("/api/tasks/{taskId}/comments")
  public ResponseEntity<List<CommentResponse>> listComments(@PathVariable Long taskId) {
    return ResponseEntity.ok(commentService.listComments(taskId));
  }

  @PostMapping("/api/tasks/{taskId}/comments")
  public ResponseEntity<CommentResponse> createComment(
      @PathVariable Long taskId, @Valid @RequestBody CommentRequest request) {
    var outcome =
        commentService.createComment(taskId, request.content(), CurrentUser.requireUserId());
    return ResponseEntity.created(URI.create("/api/comments/" + outcome.result().id()))
        .body(outcome.result());
  }

  @PutMapping("/api/comments/{id}")
  public ResponseEntity<CommentResponse> updateComment(
      @PathVariable Long id, @Valid @RequestBody CommentRequest request) {
    var outcome = commentService.updateComment(id, request.content(), CurrentUser.requireUserId());
    return ResponseEntity.ok(outcome.result());
  }

  @DeleteMapping("/api/comments/{id}")
  public ResponseEntity<Void> deleteComment(@PathVariable Long id) {
    commentService.deleteComment(id, CurrentUser.requireUserId());
    return ResponseEntity.noContent().build();
  }

  public record CommentRequest(
      @NotBlank(message = "content is required")
          @Size(max = 10000, message = "content must be at most 10000 characters")
          String content) {}
}
