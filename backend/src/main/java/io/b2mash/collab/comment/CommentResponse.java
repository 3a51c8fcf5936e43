package io.b2mash.collab.comment;

import io.b2mash.collab.member.UserSummary;
import java.time.Instant;
import java.util.List;

public record CommentResponse(
    Long id,
    Long taskId,
    UserSummary author,
    String content,
    Instant createdAt,
    Instant updatedAt,
    List<AttachmentResponse> attachments) {

  public record AttachmentResponse(Long id, String fileName, String filePath, Instant createdAt) {

    static AttachmentResponse from(CommentAttachment attachment) {
      return new AttachmentResponse(
          attachment.getId(),
          attachment.getFileName(),
          attachment.getFilePath(),
          attachment.getCreatedAt());
    }
  }

  public static CommentResponse from(
      Comment comment, UserSummary author, List<CommentAttachment> attachments) {
    return new CommentResponse(
        comment.getId(),
        comment.getTaskId(),
        author,
        comment.getContent(),
        comment.getCreatedAt(),
        comment.getUpdatedAt(),
        attachments.stream().map(AttachmentResponse::from).toList());
  }
}
