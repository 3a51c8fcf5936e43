package io.b2mash.collab.comment;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CommentRepository extends JpaRepository<Comment, Long> {

  List<Comment> findByTaskIdOrderByCreatedAtAsc(Long taskId);

  long countByTaskId(Long taskId);

  @Modifying
  @Query("DELETE FROM Comment c WHERE c.taskId = :taskId")
  int deleteByTaskId(@Param("taskId") Long taskId);
}
