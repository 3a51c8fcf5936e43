package io.b2mash.collab.workflow;

import io.b2mash.collab.security.CurrentUser;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/workflows")
public class WorkflowController {

  private final WorkflowService workflowService;

  public WorkflowController(WorkflowService workflowService) {
    this.workflowService = workflowService;
  }

  @PostMapping
  public ResponseEntity<WorkflowResponse> createWorkflow(
      @Valid @RequestBody CreateWorkflowRequest request) {
    var stages =
        request.stages() == null
            ? List.<WorkflowService.StageDraft>of()
            : request.stages().stream().map(StageRequest::toDraft).toList();
    var details =
        workflowService.createWorkflow(
            request.name(),
            request.description(),
            Boolean.TRUE.equals(request.isDefault()),
            stages,
            CurrentUser.requireUserId());
    return ResponseEntity.created(URI.create("/api/workflows/" + details.workflow().getId()))
        .body(WorkflowResponse.from(details));
  }

  @GetMapping
  public ResponseEntity<List<WorkflowSummary>> listWorkflows() {
    return ResponseEntity.ok(
        workflowService.listWorkflows().stream().map(WorkflowSummary::from).toList());
  }

  @GetMapping("/{id}")
  public ResponseEntity<WorkflowResponse> getWorkflow(@PathVariable Long id) {
    return ResponseEntity.ok(WorkflowResponse.from(workflowService.getWorkflow(id)));
  }

  @GetMapping("/{id}/stages")
  public ResponseEntity<List<StageResponse>> listStages(@PathVariable Long id) {
    return ResponseEntity.ok(
        workflowService.listStages(id).stream().map(StageResponse::from).toList());
  }

  @PostMapping("/{id}/stages")
  public ResponseEntity<StageResponse> addStage(
      @PathVariable Long id, @Valid @RequestBody StageRequest request) {
    var stage = workflowService.addStage(id, request.toDraft());
    return ResponseEntity.created(URI.create("/api/workflows/" + id + "/stages/" + stage.getId()))
        .body(StageResponse.from(stage));
  }

  @DeleteMapping("/{id}/stages/{stageId}")
  public ResponseEntity<Void> deleteStage(@PathVariable Long id, @PathVariable Long stageId) {
    workflowService.deleteStage(id, stageId);
    return ResponseEntity.noContent().build();
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteWorkflow(@PathVariable Long id) {
    workflowService.deleteWorkflow(id);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record CreateWorkflowRequest(
      @NotBlank(message = "name is required")
          @Size(max = 200, message = "name must be at most 200 characters")
          String name,
      String description,
      Boolean isDefault,
      List<@Valid StageRequest> stages) {}

  public record StageRequest(
      @NotBlank(message = "name is required")
          @Size(max = 200, message = "name must be at most 200 characters")
          String name,
      String description,
      @Size(max = 20, message = "color must be at most 20 characters") String color) {

    WorkflowService.StageDraft toDraft() {
      return new WorkflowService.StageDraft(name, description, color);
    }
  }

  public record WorkflowSummary(
      Long id, String name, String description, boolean isDefault, Instant createdAt) {

    static WorkflowSummary from(Workflow workflow) {
      return new WorkflowSummary(
          workflow.getId(),
          workflow.getName(),
          workflow.getDescription(),
          workflow.isDefault(),
          workflow.getCreatedAt());
    }
  }

  public record StageResponse(
      Long id, Long workflowId, String name, String description, int order, String color) {

    static StageResponse from(WorkflowStage stage) {
      return new StageResponse(
          stage.getId(),
          stage.getWorkflowId(),
          stage.getName(),
          stage.getDescription(),
          stage.getStageOrder(),
          stage.getColor());
    }
  }

  public record WorkflowResponse(WorkflowSummary workflow, List<StageResponse> stages) {

    static WorkflowResponse from(WorkflowService.WorkflowDetails details) {
      return new WorkflowResponse(
          WorkflowSummary.from(details.workflow()),
          details.stages().stream().map(StageResponse::from).toList());
    }
  }
}
