package io.b2mash.collab.task;

import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SubtaskRepository extends JpaRepository<Subtask, Long> {

  List<Subtask> findByTaskIdOrderByIdAsc(Long taskId);

  List<Subtask> findByTaskIdInOrderByIdAsc(Collection<Long> taskIds);

  long countByTaskId(Long taskId);

  @Modifying
  @Query("DELETE FROM Subtask s WHERE s.taskId = :taskId")
  int deleteByTaskId(@Param("taskId") Long taskId);
}
