package io.b2mash.collab.channel;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.collab.channel.ChannelResponses.ChannelResponse;
import io.b2mash.collab.channel.ChannelResponses.GroupMessageResponse;
import io.b2mash.collab.channel.ChannelResponses.MemberResponse;
import io.b2mash.collab.security.CurrentUser;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/channels")
public class ChannelController {

  private final ChannelService channelService;

  public ChannelController(ChannelService channelService) {
    this.channelService = channelService;
  }

  @GetMapping
  public ResponseEntity<List<ChannelResponse>> listChannels() {
    return ResponseEntity.ok(channelService.listChannels(CurrentUser.requireUserId()));
  }

  @PostMapping
  public ResponseEntity<ChannelResponse> createChannel(
      @Valid @RequestBody CreateChannelRequest request) {
    var channel =
        channelService.createChannel(
            request.name(),
            request.description(),
            Boolean.TRUE.equals(request.isPrivate()),
            CurrentUser.requireUserId());
    return ResponseEntity.created(URI.create("/api/channels/" + channel.id())).body(channel);
  }

  @GetMapping("/{id}")
  public ResponseEntity<ChannelResponse> getChannel(@PathVariable Long id) {
    return ResponseEntity.ok(channelService.getChannel(id, CurrentUser.requireUserId()));
  }

  @GetMapping("/{id}/members")
  public ResponseEntity<List<MemberResponse>> listMembers(@PathVariable Long id) {
    return ResponseEntity.ok(channelService.listMembers(id, CurrentUser.requireUserId()));
  }

  @PostMapping("/{id}/members")
  public ResponseEntity<MemberResponse> addMember(
      @PathVariable Long id, @Valid @RequestBody AddMemberRequest request) {
    var outcome =
        channelService.addMember(
            id,
            request.userId(),
            Boolean.TRUE.equals(request.isAdmin()),
            CurrentUser.requireUserId());
    return ResponseEntity.status(201).body(outcome.result());
  }

  @DeleteMapping("/{id}/members/{userId}")
  public ResponseEntity<Void> removeMember(@PathVariable Long id, @PathVariable Long userId) {
    channelService.removeMember(id, userId, CurrentUser.requireUserId());
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/{id}/messages")
  public ResponseEntity<List<GroupMessageResponse>> listMessages(@PathVariable Long id) {
    return ResponseEntity.ok(channelService.listMessages(id, CurrentUser.requireUserId()));
  }

  @PostMapping("/{id}/messages")
  public ResponseEntity<GroupMessageResponse> postMessage(
      @PathVariable Long id, @Valid @RequestBody PostMessageRequest request) {
    var outcome = channelService.postMessage(id, request.content(), CurrentUser.requireUserId());
    return ResponseEntity.status(201).body(outcome.result());
  }

  // --- DTOs ---

  public record CreateChannelRequest(
      @NotBlank(message = "name is required")
          @Size(max = 200, message = "name must be at most 200 characters")
          String name,
      @Size(max = 2000, message = "description must be at most 2000 characters")
          String description,
      @JsonProperty("isPrivate") Boolean isPrivate) {}

  public record AddMemberRequest(
      @NotNull(message = "userId is required") Long userId,
      @JsonProperty("isAdmin") Boolean isAdmin) {}

  public record PostMessageRequest(
      @NotBlank(message = "content is required")
          @Size(max = 10000, message = "content must be at most 10000 characters")
          String content) {}
}
