package io.b2mash.collab.comment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

/** File reference attached to a comment. Upload and storage are handled elsewhere. */
@Entity
@Table(name = "comment_attachments")
public class CommentAttachment {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "comment_id", nullable = false)
  private Long commentId;

  @Column(name = "file_name", nullable = false, length = 500)
  private String fileName;

  @Column(name = "file_path", nullable = false, length = 1000)
  private String filePath;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected CommentAttachment() {}

  public CommentAttachment(Long commentId, String fileName, String filePath) {
    this.commentId = commentId;
    this.fileName = fileName;
    this.filePath = filePath;
    this.createdAt = Instant.now();
  }

  public Long getId() {
    return id;
  }

  public Long getCommentId() {
    return commentId;
  }

  public String getFileName() {
    return fileName;
  }

  public String getFilePath() {
    return filePath;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
