package io.b2mash.collab.task;

import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskParticipantRepository
    extends JpaRepository<TaskParticipant, TaskParticipantId> {

  @Query("SELECT p.userId FROM TaskParticipant p WHERE p.taskId = :taskId ORDER BY p.userId")
  List<Long> findUserIdsByTaskId(@Param("taskId") Long taskId);

  List<TaskParticipant> findByTaskIdIn(Collection<Long> taskIds);

  long countByTaskId(Long taskId);

  @Modifying
  @Query("DELETE FROM TaskParticipant p WHERE p.taskId = :taskId")
  int deleteByTaskId(@Param("taskId") Long taskId);
}
