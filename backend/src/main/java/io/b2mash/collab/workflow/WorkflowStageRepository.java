package io.b2mash.collab.workflow;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface WorkflowStageRepository extends JpaRepository<WorkflowStage, Long> {

  List<WorkflowStage> findByWorkflowIdOrderByStageOrderAsc(Long workflowId);

  @Query("SELECT COALESCE(MAX(s.stageOrder), 0) FROM WorkflowStage s WHERE s.workflowId = :id")
  int findMaxStageOrder(@Param("id") Long workflowId);

  @Modifying
  @Query("DELETE FROM WorkflowStage s WHERE s.workflowId = :workflowId")
  int deleteByWorkflowId(@Param("workflowId") Long workflowId);
}
