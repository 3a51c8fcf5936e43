package io.b2mash.collab.workflow;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface WorkflowRepository extends JpaRepository<Workflow, Long> {

  List<Workflow> findAllByOrderByNameAsc();

  @Modifying
  @Query("UPDATE Workflow w SET w.isDefault = false WHERE w.isDefault = true")
  int clearDefault();

  @Query("SELECT COUNT(t) > 0 FROM Task t WHERE t.workflowId = :workflowId")
  boolean isReferencedByTasks(@Param("workflowId") Long workflowId);

  @Query("SELECT COUNT(t) > 0 FROM Task t WHERE t.stageId = :stageId")
  boolean isStageReferencedByTasks(@Param("stageId") Long stageId);
}
