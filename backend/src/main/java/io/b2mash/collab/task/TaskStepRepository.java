package io.b2mash.collab.task;

import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskStepRepository extends JpaRepository<TaskStep, Long> {

  List<TaskStep> findByTaskIdOrderByStepOrderAsc(Long taskId);

  List<TaskStep> findByTaskIdInOrderByStepOrderAsc(Collection<Long> taskIds);

  long countByTaskId(Long taskId);

  @Modifying
  @Query("DELETE FROM TaskStep s WHERE s.taskId = :taskId")
  int deleteByTaskId(@Param("taskId") Long taskId);
}
