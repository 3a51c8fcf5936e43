package io.b2mash.collab.task;

import java.util.List;

/** A task with its child rows, as read back after a mutation or for listing. */
public record TaskDetails(
    Task task, List<Long> participantIds, List<Subtask> subtasks, List<TaskStep> steps) {}
