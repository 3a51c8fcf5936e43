package io.b2mash.collab.task;

import io.b2mash.collab.notification.MutationOutcome;
import io.b2mash.collab.security.CurrentUser;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/tasks")
public class TaskController {

  private final TaskService taskService;

  public TaskController(TaskService taskService) {
    this.taskService = taskService;
  }

  @PostMapping
  public ResponseEntity<MutationResponse<TaskResponse>> createTask(
      @Valid @RequestBody CreateTaskRequest request) {
    var outcome = taskService.create(request.toDraft(), CurrentUser.requireUserId());
    return ResponseEntity.created(URI.create("/api/tasks/" + outcome.result().task().getId()))
        .body(MutationResponse.from(outcome, TaskResponse.from(outcome.result())));
  }

  @GetMapping
  public ResponseEntity<List<TaskResponse>> listTasks() {
    return ResponseEntity.ok(taskService.listTasks().stream().map(TaskResponse::from).toList());
  }

  @GetMapping("/{id}")
  public ResponseEntity<TaskResponse> getTask(@PathVariable Long id) {
    return ResponseEntity.ok(TaskResponse.from(taskService.getTask(id)));
  }

  @PutMapping("/{id}")
  public ResponseEntity<MutationResponse<TaskResponse>> updateTask(
      @PathVariable Long id, @Valid @RequestBody UpdateTaskRequest request) {
    var outcome = taskService.update(id, request.toPatch(), CurrentUser.requireUserId());
    return ResponseEntity.ok(MutationResponse.from(outcome, TaskResponse.from(outcome.result())));
  }

  @PatchMapping("/{id}/status")
  public ResponseEntity<MutationResponse<TaskResponse>> updateStatus(
      @PathVariable Long id, @Valid @RequestBody StatusRequest request) {
    var outcome = taskService.updateStatus(id, request.status(), CurrentUser.requireUserId());
    return ResponseEntity.ok(
        MutationResponse.from(outcome, TaskResponse.summary(outcome.result())));
  }

  @PatchMapping("/{id}/due-date")
  public ResponseEntity<MutationResponse<TaskResponse>> updateDueDate(
      @PathVariable Long id, @RequestBody DueDateRequest request) {
    var outcome = taskService.updateDueDate(id, request.dueDate(), CurrentUser.requireUserId());
    return ResponseEntity.ok(
        MutationResponse.from(outcome, TaskResponse.summary(outcome.result())));
  }

  @PatchMapping("/{id}/stage")
  public ResponseEntity<MutationResponse<TaskResponse>> updateStage(
      @PathVariable Long id, @Valid @RequestBody StageRequest request) {
    var outcome = taskService.updateStage(id, request.stageId(), CurrentUser.requireUserId());
    return ResponseEntity.ok(
        MutationResponse.from(outcome, TaskResponse.summary(outcome.result())));
  }

  @PatchMapping("/{id}/subtasks/{subtaskId}")
  public ResponseEntity<MutationResponse<TaskResponse>> setSubtaskCompleted(
      @PathVariable Long id,
      @PathVariable Long subtaskId,
      @Valid @RequestBody CompletionRequest request) {
    var outcome =
        taskService.setSubtaskCompleted(
            id, subtaskId, request.completed(), CurrentUser.requireUserId());
    return ResponseEntity.ok(MutationResponse.from(outcome, TaskResponse.from(outcome.result())));
  }

  @PatchMapping("/{id}/steps/{stepId}")
  public ResponseEntity<MutationResponse<TaskResponse>> setStepCompleted(
      @PathVariable Long id,
      @PathVariable Long stepId,
      @Valid @RequestBody CompletionRequest request) {
    var outcome =
        taskService.setStepCompleted(id, stepId, request.completed(), CurrentUser.requireUserId());
    return ResponseEntity.ok(MutationResponse.from(outcome, TaskResponse.from(outcome.result())));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteTask(@PathVariable Long id) {
    taskService.delete(id, CurrentUser.requireUserId());
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/{id}/history")
  public ResponseEntity<List<HistoryResponse>> getHistory(@PathVariable Long id) {
    return ResponseEntity.ok(
        taskService.getHistory(id).stream().map(HistoryResponse::from).toList());
  }

  // --- DTOs ---

  /** Mutation result plus the side effects that did not complete, if any. */
  public record MutationResponse<T>(T data, List<String> failedSideEffects) {

    static <T> MutationResponse<T> from(MutationOutcome<?> outcome, T data) {
      return new MutationResponse<>(data, outcome.failedSideEffects());
    }
  }

  public record SubtaskRequest(
      @NotBlank(message = "subtask title is required") String title, boolean completed) {

    TaskDraft.SubtaskDraft toDraft() {
      return new TaskDraft.SubtaskDraft(title, completed);
    }
  }

  public record StepRequest(
      @NotBlank(message = "step title is required") String title,
      String description,
      boolean completed) {

    TaskDraft.StepDraft toDraft() {
      return new TaskDraft.StepDraft(title, description, completed);
    }
  }

  public record CreateTaskRequest(
      @NotBlank(message = "title is required")
          @Size(max = 500, message = "title must be at most 500 characters")
          String title,
      String description,
      @Size(max = 20, message = "priority must be at most 20 characters") String priority,
      Long responsibleId,
      Long workflowId,
      Long stageId,
      LocalDate dueDate,
      List<Long> participantIds,
      List<@Valid SubtaskRequest> subtasks,
      List<@Valid StepRequest> steps) {

    TaskDraft toDraft() {
      return new TaskDraft(
          title,
          description,
          priority,
          responsibleId,
          workflowId,
          stageId,
          dueDate,
          participantIds,
          subtasks == null ? null : subtasks.stream().map(SubtaskRequest::toDraft).toList(),
          steps == null ? null : steps.stream().map(StepRequest::toDraft).toList());
    }
  }

  public record UpdateTaskRequest(
      @Size(max = 500, message = "title must be at most 500 characters") String title,
      String description,
      @Size(max = 20, message = "priority must be at most 20 characters") String priority,
      @Size(max = 50, message = "status must be at most 50 characters") String status,
      Long responsibleId,
      List<Long> participantIds,
      List<@Valid SubtaskRequest> subtasks,
      List<@Valid StepRequest> steps) {

    TaskPatch toPatch() {
      return new TaskPatch(
          title,
          description,
          priority,
          status,
          responsibleId,
          participantIds,
          subtasks == null ? null : subtasks.stream().map(SubtaskRequest::toDraft).toList(),
          steps == null ? null : steps.stream().map(StepRequest::toDraft).toList());
    }
  }

  public record StatusRequest(
      @NotBlank(message = "status is required")
          @Size(max = 50, message = "status must be at most 50 characters")
          String status) {}

  public record DueDateRequest(LocalDate dueDate) {}

  public record StageRequest(@NotNull(message = "stageId is required") Long stageId) {}

  public record CompletionRequest(@NotNull(message = "completed is required") Boolean completed) {}

  public record HistoryResponse(
      Long id,
      Long taskId,
      Long userId,
      String action,
      String oldValue,
      String newValue,
      Instant createdAt) {

    static HistoryResponse from(TaskHistoryEntry entry) {
      return new HistoryResponse(
          entry.getId(),
          entry.getTaskId(),
          entry.getUserId(),
          entry.getAction(),
          entry.getOldValue(),
          entry.getNewValue(),
          entry.getCreatedAt());
    }
  }
}
