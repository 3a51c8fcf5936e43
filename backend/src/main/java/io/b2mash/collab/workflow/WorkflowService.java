package io.b2mash.collab.workflow;

import io.b2mash.collab.exception.InvalidStateException;
import io.b2mash.collab.exception.ResourceNotFoundException;
import io.b2mash.collab.exception.ValidationException;
import io.b2mash.collab.persistence.PersistenceExecutor;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class WorkflowService {

  private static final Logger log = LoggerFactory.getLogger(WorkflowService.class);

  private final WorkflowRepository workflowRepository;
  private final WorkflowStageRepository stageRepository;
  private final PersistenceExecutor executor;

  public WorkflowService(
      WorkflowRepository workflowRepository,
      WorkflowStageRepository stageRepository,
      PersistenceExecutor executor) {
    this.workflowRepository = workflowRepository;
    this.stageRepository = stageRepository;
    this.executor = executor;
  }

  public record StageDraft(String name, String description, String color) {}

  public record WorkflowDetails(Workflow workflow, List<WorkflowStage> stages) {}

  /** Creates a workflow with its stages in one transaction; stages are ordered as given. */
  public WorkflowDetails createWorkflow(
      String name, String description, boolean isDefault, List<StageDraft> stages, Long creatorId) {
    if (name == null || name.isBlank()) {
      throw new ValidationException("Workflow name is required");
    }
    var details =
        executor.executeTransactionWithRetry(
            () -> {
              if (isDefault) {
                workflowRepository.clearDefault();
              }
              var workflow =
                  workflowRepository.save(new Workflow(name, description, creatorId, isDefault));
              var saved =
                  stages == null
                      ? List.<WorkflowStage>of()
                      : saveStages(workflow.getId(), stages, 1);
              return new WorkflowDetails(workflow, saved);
            },
            "createWorkflow");
    log.info(
        "Created workflow {} with {} stage(s)",
        details.workflow().getId(),
        details.stages().size());
    return details;
  }

  public List<Workflow> listWorkflows() {
    return executor.executeReadOnly(workflowRepository::findAllByOrderByNameAsc, "listWorkflows");
  }

  public WorkflowDetails getWorkflow(Long workflowId) {
    return executor.executeReadOnly(
        () -> {
          var workflow =
              workflowRepository
                  .findById(workflowId)
                  .orElseThrow(() -> new ResourceNotFoundException("Workflow", workflowId));
          return new WorkflowDetails(
              workflow, stageRepository.findByWorkflowIdOrderByStageOrderAsc(workflowId));
        },
        "getWorkflow");
  }

  public List<WorkflowStage> listStages(Long workflowId) {
    return getWorkflow(workflowId).stages();
  }

  public WorkflowStage addStage(Long workflowId, StageDraft draft) {
    if (draft.name() == null || draft.name().isBlank()) {
      throw new ValidationException("Stage name is required");
    }
    return executor.executeTransactionWithRetry(
        () -> {
          if (!workflowRepository.existsById(workflowId)) {
            throw new ResourceNotFoundException("Workflow", workflowId);
          }
          int next = stageRepository.findMaxStageOrder(workflowId) + 1;
          return saveStages(workflowId, List.of(draft), next).get(0);
        },
        "addWorkflowStage");
  }

  public Optional<WorkflowStage> findStage(Long stageId) {
    return executor.executeWithRetry(() -> stageRepository.findById(stageId), "findWorkflowStage");
  }

  /** Finds a stage, failing with not-found when it does not exist. */
  public WorkflowStage requireStage(Long stageId) {
    return findStage(stageId)
        .orElseThrow(() -> new ResourceNotFoundException("WorkflowStage", stageId));
  }

  public void deleteStage(Long workflowId, Long stageId) {
    executor.runTransactionWithRetry(
        () -> {
          var stage =
              stageRepository
                  .findById(stageId)
                  .filter(s -> s.getWorkflowId().equals(workflowId))
                  .orElseThrow(() -> new ResourceNotFoundException("WorkflowStage", stageId));
          if (workflowRepository.isStageReferencedByTasks(stageId)) {
            throw new InvalidStateException(
                "Stage in use", "Stage " + stageId + " is still assigned to tasks");
          }
          stageRepository.delete(stage);
        },
        "deleteWorkflowStage");
  }

  public void deleteWorkflow(Long workflowId) {
    executor.runTransactionWithRetry(
        () -> {
          if (!workflowRepository.existsById(workflowId)) {
            throw new ResourceNotFoundException("Workflow", workflowId);
          }
          if (workflowRepository.isReferencedByTasks(workflowId)) {
            throw new InvalidStateException(
                "Workflow in use", "Workflow " + workflowId + " is still assigned to tasks");
          }
          stageRepository.deleteByWorkflowId(workflowId);
          workflowRepository.deleteById(workflowId);
        },
        "deleteWorkflow");
    log.info("Deleted workflow {}", workflowId);
  }

  private List<WorkflowStage> saveStages(Long workflowId, List<StageDraft> drafts, int firstOrder) {
    var stages =
        IntStream.range(0, drafts.size())
            .mapToObj(
                i -> {
                  var d = drafts.get(i);
                  return new WorkflowStage(
                      workflowId, d.name(), d.description(), firstOrder + i, d.color());
                })
            .toList();
    return stageRepository.saveAll(stages);
  }
}
