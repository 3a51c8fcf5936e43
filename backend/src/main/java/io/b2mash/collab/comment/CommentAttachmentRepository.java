package io.b2mash.collab.comment;

import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CommentAttachmentRepository extends JpaRepository<CommentAttachment, Long> {

  List<CommentAttachment> findByCommentIdIn(Collection<Long> commentIds);

  @Query(
      """
      SELECT COUNT(a) FROM CommentAttachment a
      WHERE a.commentId IN (SELECT c.id FROM Comment c WHERE c.taskId = :taskId)
      """)
  long countByTaskId(@Param("taskId") Long taskId);

  @Modifying
  @Query("DELETE FROM CommentAttachment a WHERE a.commentId = :commentId")
  int deleteByCommentId(@Param("commentId") Long commentId);

  @Modifying
  @Query(
      """
      DELETE FROM CommentAttachment a
      WHERE a.commentId IN (SELECT c.id FROM Comment c WHERE c.taskId = :taskId)
      """)
  int deleteByTaskId(@Param("taskId") Long taskId);
}
