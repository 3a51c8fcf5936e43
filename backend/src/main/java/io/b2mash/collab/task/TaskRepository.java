package io.b2mash.collab.task;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskRepository extends JpaRepository<Task, Long> {

  List<Task> findAllByOrderByCreatedAtDesc();

  @Modifying
  @Query("DELETE FROM Task t WHERE t.id = :taskId")
  int deleteTaskRow(@Param("taskId") Long taskId);
}
