package io.b2mash.collab.message;

import io.b2mash.collab.security.CurrentUser;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/messages")
public class PrivateMessageController {

  private final PrivateMessageService messageService;

  public PrivateMessageController(PrivateMessageService messageService) {
    this.messageService = messageService;
  }

  @GetMapping("/conversations")
  public ResponseEntity<List<ConversationSummary>> conversations() {
    return ResponseEntity.ok(messageService.conversations(CurrentUser.requireUserId()));
  }

  @GetMapping("/unread")
  public ResponseEntity<Map<String, Long>> unreadCount() {
    return ResponseEntity.ok(
        Map.of("count", messageService.unreadCount(CurrentUser.requireUserId())));
  }

  @GetMapping("/{userId}")
  public ResponseEntity<List<PrivateMessageResponse>> conversation(@PathVariable Long userId) {
    return ResponseEntity.ok(messageService.conversation(CurrentUser.requireUserId(), userId));
  }

  @PostMapping("/{userId}")
  public ResponseEntity<PrivateMessageResponse> send(
      @PathVariable Long userId, @Valid @RequestBody SendMessageRequest request) {
    var outcome = messageService.send(userId, request.content(), CurrentUser.requireUserId());
    return ResponseEntity.status(201).body(outcome.result());
  }

  @PostMapping("/{userId}/read")
  public ResponseEntity<Map<String, Integer>> markRead(@PathVariable Long userId) {
    var updated = messageService.markRead(CurrentUser.requireUserId(), userId);
    return ResponseEntity.ok(Map.of("updated", updated));
  }

  public record SendMessageRequest(
      @NotBlank(message = "content is required")
          @Size(max = 10000, message = "content must be at most 10000 characters")
          String content) {}
}
