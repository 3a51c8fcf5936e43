package io.b2mash.collab.task;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskHistoryRepository extends JpaRepository<TaskHistoryEntry, Long> {

  List<TaskHistoryEntry> findByTaskIdOrderByCreatedAtDescIdDesc(Long taskId);

  long countByTaskId(Long taskId);

  long countByTaskIdAndAction(Long taskId, String action);

  @Modifying
  @Query("DELETE FROM TaskHistoryEntry h WHERE h.taskId = :taskId")
  int deleteByTaskId(@Param("taskId") Long taskId);
}
