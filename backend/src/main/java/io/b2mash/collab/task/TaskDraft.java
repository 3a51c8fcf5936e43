package io.b2mash.collab.task;

import java.time.LocalDate;
import java.util.List;

/** Input for creating a task. Null collections mean none. */
public record TaskDraft(
    String title,
    String description,
    String priority,
    Long responsibleId,
    Long workflowId,
    Long stageId,
    LocalDate dueDate,
    List<Long> participantIds,
    List<SubtaskDraft> subtasks,
    List<StepDraft> steps) {

  public record SubtaskDraft(String title, boolean completed) {}

  public record StepDraft(String title, String description, boolean completed) {}
}
