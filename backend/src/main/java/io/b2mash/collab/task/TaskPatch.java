package io.b2mash.collab.task;

import java.util.List;

/**
 * Partial update of a task. Null fields are left unchanged; a non-null collection replaces the
 * current rows wholesale.
 */
public record TaskPatch(
    String title,
    String description,
    String priority,
    String status,
    Long responsibleId,
    List<Long> participantIds,
    List<TaskDraft.SubtaskDraft> subtasks,
    List<TaskDraft.StepDraft> steps) {}
