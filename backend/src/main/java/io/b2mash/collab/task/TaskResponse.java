package io.b2mash.collab.task;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/** Task representation shared by the REST responses and realtime task events. */
public record TaskResponse(
    Long id,
    String title,
    String description,
    String status,
    String priority,
    Long creatorId,
    Long responsibleId,
    Long workflowId,
    Long stageId,
    LocalDate dueDate,
    Instant createdAt,
    Instant updatedAt,
    List<Long> participantIds,
    List<SubtaskResponse> subtasks,
    List<StepResponse> steps) {

  public record SubtaskResponse(Long id, String title, boolean completed) {}

  public record StepResponse(
      Long id, String title, String description, int order, boolean completed) {}

  public static TaskResponse from(TaskDetails details) {
    var task = details.task();
    return new TaskResponse(
        task.getId(),
        task.getTitle(),
        task.getDescription(),
        task.getStatus(),
        task.getPriority(),
        task.getCreatorId(),
        task.getResponsibleId(),
        task.getWorkflowId(),
        task.getStageId(),
        task.getDueDate(),
        task.getCreatedAt(),
        task.getUpdatedAt(),
        details.participantIds(),
        details.subtasks().stream()
            .map(s -> new SubtaskResponse(s.getId(), s.getTitle(), s.isCompleted()))
            .toList(),
        details.steps().stream()
            .map(
                s ->
                    new StepResponse(
                        s.getId(),
                        s.getTitle(),
                        s.getDescription(),
                        s.getStepOrder(),
                        s.isCompleted()))
            .toList());
  }

  /** Scalar view of a task without child rows. */
  public static TaskResponse summary(Task task) {
    return from(new TaskDetails(task, List.of(), List.of(), List.of()));
  }
}
