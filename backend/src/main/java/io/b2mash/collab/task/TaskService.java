package io.b2mash.collab.task;

import io.b2mash.collab.calendar.CalendarService;
import io.b2mash.collab.comment.CommentAttachmentRepository;
import io.b2mash.collab.comment.CommentRepository;
import io.b2mash.collab.exception.DatabaseException;
import io.b2mash.collab.exception.ResourceNotFoundException;
import io.b2mash.collab.exception.ValidationException;
import io.b2mash.collab.member.UserService;
import io.b2mash.collab.notification.Audience;
import io.b2mash.collab.notification.MutationOutcome;
import io.b2mash.collab.notification.NotificationFanout;
import io.b2mash.collab.notification.NotificationRepository;
import io.b2mash.collab.notification.NotificationRequest;
import io.b2mash.collab.notification.NotificationType;
import io.b2mash.collab.persistence.PersistenceExecutor;
import io.b2mash.collab.realtime.BroadcastDispatcher;
import io.b2mash.collab.realtime.DeliveryReport;
import io.b2mash.collab.realtime.EventType;
import io.b2mash.collab.realtime.RealtimeEvent;
import io.b2mash.collab.workflow.WorkflowService;
import io.b2mash.collab.workflow.WorkflowStage;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * Owns task mutations. Each mutation commits as one retry-wrapped transaction that also appends
 * exactly one history entry per observable change. Broadcasts and notification fanout run after
 * commit and never undo it; their failures are reported in the returned {@link MutationOutcome}.
 *
 * <p>Status is free-form: there is no transition table.
 */
@Service
public class TaskService {

  private static final Logger log = LoggerFactory.getLogger(TaskService.class);

  static final String ENTITY_TYPE = "task";

  private final TaskRepository taskRepository;
  private final TaskParticipantRepository participantRepository;
  private final SubtaskRepository subtaskRepository;
  private final TaskStepRepository stepRepository;
  private final TaskHistoryRepository historyRepository;
  private final CommentRepository commentRepository;
  private final CommentAttachmentRepository attachmentRepository;
  private final NotificationRepository notificationRepository;
  private final CalendarService calendarService;
  private final WorkflowService workflowService;
  private final UserService userService;
  private final PersistenceExecutor executor;
  private final BroadcastDispatcher broadcastDispatcher;
  private final NotificationFanout notificationFanout;

  public TaskService(
      TaskRepository taskRepository,
      TaskParticipantRepository participantRepository,
      SubtaskRepository subtaskRepository,
      TaskStepRepository stepRepository,
      TaskHistoryRepository historyRepository,
      CommentRepository commentRepository,
      CommentAttachmentRepository attachmentRepository,
      NotificationRepository notificationRepository,
      CalendarService calendarService,
      WorkflowService workflowService,
      UserService userService,
      PersistenceExecutor executor,
      BroadcastDispatcher broadcastDispatcher,
      NotificationFanout notificationFanout) {
    this.taskRepository = taskRepository;
    this.participantRepository = participantRepository;
    this.subtaskRepository = subtaskRepository;
    this.stepRepository = stepRepository;
    this.historyRepository = historyRepository;
    this.commentRepository = commentRepository;
    this.attachmentRepository = attachmentRepository;
    this.notificationRepository = notificationRepository;
    this.calendarService = calendarService;
    this.workflowService = workflowService;
    this.userService = userService;
    this.executor = executor;
    this.broadcastDispatcher = broadcastDispatcher;
    this.notificationFanout = notificationFanout;
  }

  /** Change captured inside a transaction and acted on after commit. */
  private record Change<T>(T value, boolean changed, String oldValue, String newValue) {

    static <T> Change<T> none(T value) {
      return new Change<>(value, false, null, null);
    }
  }

  // --- Create ---

  /**
   * Creates the task, its subtasks, steps, calendar row and "created" history entry in one unit.
   * Participant rows follow in their own transactions: a participant that cannot be added is
   * logged and reported, and the task is kept.
   */
  public MutationOutcome<TaskDetails> create(TaskDraft draft, Long creatorId) {
    requireText(draft.title(), "title");

    var core =
        persist(
            () -> {
              Long workflowId = resolveWorkflow(draft.workflowId(), draft.stageId());
              var task =
                  taskRepository.save(
                      new Task(
                          draft.title(),
                          draft.description(),
                          draft.priority(),
                          creatorId,
                          draft.responsibleId(),
                          workflowId,
                          draft.stageId(),
                          draft.dueDate()));
              var subtasks = insertSubtasks(task.getId(), draft.subtasks());
              var steps = insertSteps(task.getId(), draft.steps());
              appendHistory(task, creatorId, TaskHistoryAction.CREATED, null, task.getTitle());
              syncCalendar(task);
              return new TaskDetails(task, List.of(), subtasks, steps);
            },
            "createTask");

    var task = core.task();
    var failures = new ArrayList<String>();
    var participants = new ArrayList<Long>();
    for (Long userId : distinct(draft.participantIds())) {
      try {
        executor.runTransactionWithRetry(
            () -> participantRepository.saveAndFlush(new TaskParticipant(task.getId(), userId)),
            "addTaskParticipant");
        participants.add(userId);
      } catch (RuntimeException e) {
        log.warn(
            "Task {} kept without participant {}: {}", task.getId(), userId, e.getMessage());
        failures.add("participant:" + userId);
      }
    }
    var details = new TaskDetails(task, List.copyOf(participants), core.subtasks(), core.steps());
    log.info(
        "Created task {} by user {} with {}/{} participant(s)",
        task.getId(),
        creatorId,
        participants.size(),
        participants.size() + failures.size());

    broadcast(failures, EventType.TASK_CREATED, TaskResponse.from(details));
    fanout(
        failures,
        NotificationRequest.forTask(
            NotificationType.TASK_ASSIGNMENT,
            "New task assigned: " + task.getTitle(),
            task.getDescription(),
            task.getId()),
        Audience.forTask(participants, task.getResponsibleId(), creatorId, creatorId));
    return new MutationOutcome<>(details, failures);
  }

  // --- Status ---

  /** Sets any status. A history entry is appended only when the value actually changes. */
  public MutationOutcome<Task> updateStatus(Long taskId, String newStatus, Long actorId) {
    requireText(newStatus, "status");

    Change<Task> change =
        persist(
            () -> {
              var task = requireTask(taskId);
              var oldStatus = task.getStatus();
              if (oldStatus.equals(newStatus)) {
                return Change.none(task);
              }
              task.changeStatus(newStatus);
              taskRepository.save(task);
              appendHistory(task, actorId, TaskHistoryAction.STATUS_CHANGED, oldStatus, newStatus);
              return new Change<>(task, true, oldStatus, newStatus);
            },
            "updateTaskStatus");

    var task = change.value();
    if (!change.changed()) {
      log.debug("Task {} already has status {}", taskId, newStatus);
      return MutationOutcome.of(task);
    }
    log.info("Task {} status {} -> {} by user {}", taskId, change.oldValue(), newStatus, actorId);

    var failures = new ArrayList<String>();
    var payload = new LinkedHashMap<String, Object>();
    payload.put("taskId", taskId);
    payload.put("oldStatus", change.oldValue());
    payload.put("newStatus", newStatus);
    payload.put("updatedBy", actorId);
    broadcast(failures, EventType.TASK_STATUS_CHANGED, payload);
    fanout(
        failures,
        NotificationRequest.forTask(
            NotificationType.TASK_UPDATED,
            "Task status changed: " + task.getTitle(),
            "Status changed from " + change.oldValue() + " to " + newStatus,
            taskId),
        audienceOf(task, actorId));
    return new MutationOutcome<>(task, failures);
  }

  // --- General update ---

  /**
   * Patches scalar fields and replaces the child collections that are provided. All changed
   * fields are recorded in a single "updated" history entry as {@code field: value; ...}.
   */
  public MutationOutcome<TaskDetails> update(Long taskId, TaskPatch patch, Long actorId) {
    if (patch.title() != null) {
      requireText(patch.title(), "title");
    }
    if (patch.status() != null) {
      requireText(patch.status(), "status");
    }
    var desiredParticipants =
        patch.participantIds() == null ? null : requireKnownUsers(patch.participantIds());

    Change<TaskDetails> change =
        persist(
            () -> {
              var task = requireTask(taskId);
              var diff = new FieldDiff();

              if (patch.title() != null) {
                diff.compare("title", task.getTitle(), patch.title());
                task.rename(patch.title());
              }
              if (patch.description() != null) {
                diff.compare("description", task.getDescription(), patch.description());
                task.describe(patch.description());
              }
              if (patch.priority() != null) {
                diff.compare("priority", task.getPriority(), patch.priority());
                task.prioritize(patch.priority());
              }
              if (patch.status() != null) {
                diff.compare("status", task.getStatus(), patch.status());
                task.changeStatus(patch.status());
              }
              if (patch.responsibleId() != null) {
                diff.compare("responsible", task.getResponsibleId(), patch.responsibleId());
                task.assignResponsible(patch.responsibleId());
              }

              var participants = participantRepository.findUserIdsByTaskId(taskId);
              if (desiredParticipants != null
                  && !new HashSet<>(participants).equals(new HashSet<>(desiredParticipants))) {
                diff.compare("participants", joinIds(participants), joinIds(desiredParticipants));
                participantRepository.deleteByTaskId(taskId);
                participantRepository.saveAll(
                    desiredParticipants.stream()
                        .map(userId -> new TaskParticipant(taskId, userId))
                        .toList());
                participants = desiredParticipants;
              }

              var subtasks = subtaskRepository.findByTaskIdOrderByIdAsc(taskId);
              if (patch.subtasks() != null) {
                var before = describeSubtasks(subtasks);
                var after = describeSubtaskDrafts(patch.subtasks());
                if (!before.equals(after)) {
                  diff.compare("subtasks", before, after);
                  subtaskRepository.deleteByTaskId(taskId);
                  subtasks = insertSubtasks(taskId, patch.subtasks());
                }
              }

              var steps = stepRepository.findByTaskIdOrderByStepOrderAsc(taskId);
              if (patch.steps() != null) {
                var before = describeSteps(steps);
                var after = describeStepDrafts(patch.steps());
                if (!before.equals(after)) {
                  diff.compare("steps", before, after);
                  stepRepository.deleteByTaskId(taskId);
                  steps = insertSteps(taskId, patch.steps());
                }
              }

              var details = new TaskDetails(task, List.copyOf(participants), subtasks, steps);
              if (diff.isEmpty()) {
                return Change.none(details);
              }
              task.touch();
              taskRepository.save(task);
              syncCalendar(task);
              appendHistory(
                  task, actorId, TaskHistoryAction.UPDATED, diff.oldValues(), diff.newValues());
              return new Change<>(details, true, diff.oldValues(), diff.newValues());
            },
            "updateTask");

    var details = change.value();
    if (!change.changed()) {
      log.debug("Update of task {} changed nothing", taskId);
      return MutationOutcome.of(details);
    }
    log.info("Updated task {} by user {}: {}", taskId, actorId, change.newValue());

    var failures = new ArrayList<String>();
    broadcast(failures, EventType.TASK_UPDATED, TaskResponse.from(details));
    var task = details.task();
    fanout(
        failures,
        NotificationRequest.forTask(
            NotificationType.TASK_UPDATED,
            "Task updated: " + task.getTitle(),
            change.newValue(),
            taskId),
        Audience.forTask(
            details.participantIds(), task.getResponsibleId(), task.getCreatorId(), actorId));
    return new MutationOutcome<>(details, failures);
  }

  // --- Due date ---

  public MutationOutcome<Task> updateDueDate(Long taskId, LocalDate dueDate, Long actorId) {
    Change<Task> change =
        persist(
            () -> {
              var task = requireTask(taskId);
              var oldDueDate = task.getDueDate();
              if (Objects.equals(oldDueDate, dueDate)) {
                return Change.none(task);
              }
              task.reschedule(dueDate);
              taskRepository.save(task);
              syncCalendar(task);
              appendHistory(
                  task,
                  actorId,
                  TaskHistoryAction.DUE_DATE_CHANGED,
                  dateText(oldDueDate),
                  dateText(dueDate));
              return new Change<>(task, true, dateText(oldDueDate), dateText(dueDate));
            },
            "updateTaskDueDate");

    var task = change.value();
    if (!change.changed()) {
      return MutationOutcome.of(task);
    }
    log.info("Task {} due date {} -> {} by user {}", taskId, change.oldValue(), dueDate, actorId);

    var failures = new ArrayList<String>();
    var audience = audienceOf(task, actorId);
    var recipients = new LinkedHashSet<>(audience);
    recipients.add(actorId);
    var payload = new LinkedHashMap<String, Object>();
    payload.put("taskId", taskId);
    payload.put("title", task.getTitle());
    payload.put("oldDueDate", change.oldValue());
    payload.put("newDueDate", change.newValue());
    payload.put("updatedBy", actorId);
    send(failures, EventType.TASK_DUE_DATE_UPDATED, payload, recipients);
    fanout(
        failures,
        NotificationRequest.forTask(
            NotificationType.TASK_DUE_DATE,
            "Due date changed: " + task.getTitle(),
            dueDate == null ? "Due date removed" : "Task is now due on " + dueDate,
            taskId),
        audience);
    return new MutationOutcome<>(task, failures);
  }

  // --- Workflow stage ---

  /**
   * Moves the task to {@code stageId}. The stage must exist and, when the task already follows a
   * workflow, belong to it. A task without a workflow adopts the stage's workflow.
   */
  public MutationOutcome<Task> updateStage(Long taskId, Long stageId, Long actorId) {
    if (stageId == null) {
      throw new ValidationException("stageId is required");
    }

    Change<Task> change =
        persist(
            () -> {
              var task = requireTask(taskId);
              var stage = workflowService.requireStage(stageId);
              if (task.getWorkflowId() != null
                  && !task.getWorkflowId().equals(stage.getWorkflowId())) {
                throw new ValidationException(
                    "Stage " + stageId + " does not belong to workflow " + task.getWorkflowId());
              }
              if (stageId.equals(task.getStageId())) {
                return Change.none(task);
              }
              var oldStageName =
                  task.getStageId() == null
                      ? null
                      : workflowService
                          .findStage(task.getStageId())
                          .map(WorkflowStage::getName)
                          .orElse(null);
              task.moveToStage(stage.getWorkflowId(), stageId);
              taskRepository.save(task);
              appendHistory(
                  task, actorId, TaskHistoryAction.STAGE_CHANGED, oldStageName, stage.getName());
              return new Change<>(task, true, oldStageName, stage.getName());
            },
            "updateTaskStage");

    var task = change.value();
    if (!change.changed()) {
      return MutationOutcome.of(task);
    }
    log.info("Task {} moved to stage {} by user {}", taskId, stageId, actorId);

    var failures = new ArrayList<String>();
    var payload = new LinkedHashMap<String, Object>();
    payload.put("taskId", taskId);
    payload.put("workflowId", task.getWorkflowId());
    payload.put("stageId", stageId);
    payload.put("oldStageName", change.oldValue());
    payload.put("newStageName", change.newValue());
    payload.put("updatedBy", actorId);
    broadcast(failures, EventType.TASK_STAGE_CHANGED, payload);
    return new MutationOutcome<>(task, failures);
  }

  // --- Subtasks and steps ---

  public MutationOutcome<TaskDetails> setSubtaskCompleted(
      Long taskId, Long subtaskId, boolean completed, Long actorId) {
    Change<TaskDetails> change =
        persist(
            () -> {
              var task = requireTask(taskId);
              var subtask =
                  subtaskRepository
                      .findById(subtaskId)
                      .filter(s -> s.getTaskId().equals(taskId))
                      .orElseThrow(() -> new ResourceNotFoundException("Subtask", subtaskId));
              if (subtask.isCompleted() == completed) {
                return Change.none(loadDetails(task));
              }
              var before = subtask.getTitle() + ": " + completionText(subtask.isCompleted());
              subtask.setCompleted(completed);
              subtaskRepository.save(subtask);
              task.touch();
              taskRepository.save(task);
              var after = subtask.getTitle() + ": " + completionText(completed);
              appendHistory(task, actorId, TaskHistoryAction.SUBTASK_STATUS_CHANGED, before, after);
              return new Change<>(loadDetails(task), true, before, after);
            },
            "setSubtaskCompleted");
    return afterChildChange(change);
  }

  public MutationOutcome<TaskDetails> setStepCompleted(
      Long taskId, Long stepId, boolean completed, Long actorId) {
    Change<TaskDetails> change =
        persist(
            () -> {
              var task = requireTask(taskId);
              var step =
                  stepRepository
                      .findById(stepId)
                      .filter(s -> s.getTaskId().equals(taskId))
                      .orElseThrow(() -> new ResourceNotFoundException("TaskStep", stepId));
              if (step.isCompleted() == completed) {
                return Change.none(loadDetails(task));
              }
              var before = step.getTitle() + ": " + completionText(step.isCompleted());
              step.setCompleted(completed);
              stepRepository.save(step);
              task.touch();
              taskRepository.save(task);
              var after = step.getTitle() + ": " + completionText(completed);
              appendHistory(task, actorId, TaskHistoryAction.STEP_STATUS_CHANGED, before, after);
              return new Change<>(loadDetails(task), true, before, after);
            },
            "setStepCompleted");
    return afterChildChange(change);
  }

  private MutationOutcome<TaskDetails> afterChildChange(Change<TaskDetails> change) {
    if (!change.changed()) {
      return MutationOutcome.of(change.value());
    }
    var failures = new ArrayList<String>();
    broadcast(failures, EventType.TASK_UPDATED, TaskResponse.from(change.value()));
    return new MutationOutcome<>(change.value(), failures);
  }

  // --- Delete ---

  /**
   * Removes the task and everything derived from it in dependency order, in one transaction:
   * comment attachments, comments, participants, subtasks, steps, history, calendar rows,
   * notifications, then the task row.
   */
  public MutationOutcome<Long> delete(Long taskId, Long actorId) {
    persist(
        () -> {
          if (!taskRepository.existsById(taskId)) {
            throw new ResourceNotFoundException("Task", taskId);
          }
          int attachments = attachmentRepository.deleteByTaskId(taskId);
          int comments = commentRepository.deleteByTaskId(taskId);
          int participants = participantRepository.deleteByTaskId(taskId);
          int subtasks = subtaskRepository.deleteByTaskId(taskId);
          int steps = stepRepository.deleteByTaskId(taskId);
          int history = historyRepository.deleteByTaskId(taskId);
          int calendar = calendarService.deleteForTask(taskId);
          int notifications = notificationRepository.deleteByRelatedEntity(ENTITY_TYPE, taskId);
          taskRepository.deleteTaskRow(taskId);
          log.debug(
              "Task {} cascade: attachments={}, comments={}, participants={}, subtasks={},"
                  + " steps={}, history={}, calendar={}, notifications={}",
              taskId,
              attachments,
              comments,
              participants,
              subtasks,
              steps,
              history,
              calendar,
              notifications);
          return taskId;
        },
        "deleteTask");
    log.info("Deleted task {} by user {}", taskId, actorId);

    var failures = new ArrayList<String>();
    broadcast(failures, EventType.TASK_DELETED, Map.of("taskId", taskId, "deletedBy", actorId));
    return new MutationOutcome<>(taskId, failures);
  }

  // --- Reads ---

  public List<TaskDetails> listTasks() {
    return read(
        () -> {
          var tasks = taskRepository.findAllByOrderByCreatedAtDesc();
          if (tasks.isEmpty()) {
            return List.<TaskDetails>of();
          }
          var ids = tasks.stream().map(Task::getId).toList();
          var participants =
              participantRepository.findByTaskIdIn(ids).stream()
                  .collect(
                      Collectors.groupingBy(
                          TaskParticipant::getTaskId,
                          Collectors.mapping(TaskParticipant::getUserId, Collectors.toList())));
          var subtasks =
              subtaskRepository.findByTaskIdInOrderByIdAsc(ids).stream()
                  .collect(Collectors.groupingBy(Subtask::getTaskId));
          var steps =
              stepRepository.findByTaskIdInOrderByStepOrderAsc(ids).stream()
                  .collect(Collectors.groupingBy(TaskStep::getTaskId));
          return tasks.stream()
              .map(
                  task ->
                      new TaskDetails(
                          task,
                          participants.getOrDefault(task.getId(), List.of()),
                          subtasks.getOrDefault(task.getId(), List.of()),
                          steps.getOrDefault(task.getId(), List.of())))
              .toList();
        },
        "listTasks");
  }

  public TaskDetails getTask(Long taskId) {
    return read(() -> loadDetails(requireTask(taskId)), "getTask");
  }

  /** History of a task, newest first. */
  public List<TaskHistoryEntry> getHistory(Long taskId) {
    return read(
        () -> {
          if (!taskRepository.existsById(taskId)) {
            throw new ResourceNotFoundException("Task", taskId);
          }
          return historyRepository.findByTaskIdOrderByCreatedAtDescIdDesc(taskId);
        },
        "getTaskHistory");
  }

  // --- Helpers ---

  private <T> T persist(Supplier<T> unit, String operationName) {
    try {
      return executor.executeTransactionWithRetry(unit, operationName);
    } catch (DataAccessException | TransactionException e) {
      throw new DatabaseException(operationName, e);
    }
  }

  private <T> T read(Supplier<T> query, String operationName) {
    try {
      return executor.executeReadOnly(query, operationName);
    } catch (DataAccessException | TransactionException e) {
      throw new DatabaseException(operationName, e);
    }
  }

  private Task requireTask(Long taskId) {
    return taskRepository
        .findById(taskId)
        .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
  }

  private TaskDetails loadDetails(Task task) {
    return new TaskDetails(
        task,
        participantRepository.findUserIdsByTaskId(task.getId()),
        subtaskRepository.findByTaskIdOrderByIdAsc(task.getId()),
        stepRepository.findByTaskIdOrderByStepOrderAsc(task.getId()));
  }

  private Long resolveWorkflow(Long workflowId, Long stageId) {
    if (stageId == null) {
      return workflowId;
    }
    var stage = workflowService.requireStage(stageId);
    if (workflowId != null && !workflowId.equals(stage.getWorkflowId())) {
      throw new ValidationException(
          "Stage " + stageId + " does not belong to workflow " + workflowId);
    }
    return stage.getWorkflowId();
  }

  private List<Subtask> insertSubtasks(Long taskId, List<TaskDraft.SubtaskDraft> drafts) {
    if (drafts == null || drafts.isEmpty()) {
      return List.of();
    }
    drafts.forEach(d -> requireText(d.title(), "subtask title"));
    return subtaskRepository.saveAll(
        drafts.stream().map(d -> new Subtask(taskId, d.title(), d.completed())).toList());
  }

  private List<TaskStep> insertSteps(Long taskId, List<TaskDraft.StepDraft> drafts) {
    if (drafts == null || drafts.isEmpty()) {
      return List.of();
    }
    drafts.forEach(d -> requireText(d.title(), "step title"));
    var steps = new ArrayList<TaskStep>();
    for (int i = 0; i < drafts.size(); i++) {
      var d = drafts.get(i);
      steps.add(new TaskStep(taskId, d.title(), d.description(), i + 1, d.completed()));
    }
    return stepRepository.saveAll(steps);
  }

  private void appendHistory(
      Task task, Long actorId, TaskHistoryAction action, String oldValue, String newValue) {
    historyRepository.save(new TaskHistoryEntry(task.getId(), actorId, action, oldValue, newValue));
  }

  private void syncCalendar(Task task) {
    Long owner = task.getResponsibleId() != null ? task.getResponsibleId() : task.getCreatorId();
    calendarService.syncTaskDueDate(task.getId(), owner, task.getTitle(), task.getDueDate());
  }

  private List<Long> requireKnownUsers(List<Long> userIds) {
    var ids = distinct(userIds);
    var known = userService.findAllById(ids).keySet();
    var unknown = ids.stream().filter(id -> !known.contains(id)).toList();
    if (!unknown.isEmpty()) {
      throw new ValidationException("Unknown participant(s)", Map.of("participantIds", unknown));
    }
    return ids;
  }

  private Set<Long> audienceOf(Task task, Long actorId) {
    List<Long> participants;
    try {
      participants =
          executor.executeReadOnly(
              () -> participantRepository.findUserIdsByTaskId(task.getId()),
              "findTaskParticipants");
    } catch (RuntimeException e) {
      log.warn("Could not load participants of task {}: {}", task.getId(), e.getMessage());
      participants = List.of();
    }
    return Audience.forTask(participants, task.getResponsibleId(), task.getCreatorId(), actorId);
  }

  private void broadcast(List<String> failures, EventType type, Object data) {
    try {
      noteFailures(failures, type, broadcastDispatcher.broadcast(RealtimeEvent.of(type, data)));
    } catch (RuntimeException e) {
      log.warn("Broadcast of {} failed: {}", type.wireName(), e.getMessage());
      failures.add("broadcast:" + type.wireName());
    }
  }

  private void send(
      List<String> failures, EventType type, Object data, Collection<Long> recipients) {
    try {
      var report = broadcastDispatcher.sendToUsers(RealtimeEvent.of(type, data), recipients);
      noteFailures(failures, type, report);
    } catch (RuntimeException e) {
      log.warn("Targeted send of {} failed: {}", type.wireName(), e.getMessage());
      failures.add("broadcast:" + type.wireName());
    }
  }

  private static void noteFailures(List<String> failures, EventType type, DeliveryReport report) {
    if (report.failed() > 0) {
      failures.add("broadcast:" + type.wireName());
    }
  }

  private void fanout(
      List<String> failures, NotificationRequest request, Collection<Long> audience) {
    var outcome = notificationFanout.notify(request, audience);
    if (outcome.hasFailures()) {
      failures.add("fanout:" + request.type().value());
    }
  }

  private static void requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new ValidationException(field + " is required");
    }
  }

  private static List<Long> distinct(List<Long> ids) {
    if (ids == null) {
      return List.of();
    }
    return ids.stream().filter(Objects::nonNull).distinct().toList();
  }

  private static String joinIds(List<Long> ids) {
    return ids.stream().sorted().map(String::valueOf).collect(Collectors.joining(", "));
  }

  private static String dateText(LocalDate date) {
    return date == null ? null : date.toString();
  }

  private static String completionText(boolean completed) {
    return completed ? "completed" : "pending";
  }

  private static String describeSubtasks(List<Subtask> subtasks) {
    return subtasks.stream()
        .map(s -> s.getTitle() + (s.isCompleted() ? " [x]" : " [ ]"))
        .collect(Collectors.joining(", "));
  }

  private static String describeSubtaskDrafts(List<TaskDraft.SubtaskDraft> drafts) {
    return drafts.stream()
        .map(s -> s.title() + (s.completed() ? " [x]" : " [ ]"))
        .collect(Collectors.joining(", "));
  }

  private static String describeSteps(List<TaskStep> steps) {
    return steps.stream()
        .map(s -> s.getTitle() + (s.isCompleted() ? " [x]" : " [ ]"))
        .collect(Collectors.joining(", "));
  }

  private static String describeStepDrafts(List<TaskDraft.StepDraft> drafts) {
    return drafts.stream()
        .map(s -> s.title() + (s.completed() ? " [x]" : " [ ]"))
        .collect(Collectors.joining(", "));
  }

  /** Collects {@code field: value} pairs for the fields whose value changed. */
  static final class FieldDiff {

    private final List<String> oldValues = new ArrayList<>();
    private final List<String> newValues = new ArrayList<>();

    void compare(String field, Object oldValue, Object newValue) {
      if (!Objects.equals(oldValue, newValue)) {
        oldValues.add(field + ": " + (oldValue == null ? "" : oldValue));
        newValues.add(field + ": " + (newValue == null ? "" : newValue));
      }
    }

    boolean isEmpty() {
      return newValues.isEmpty();
    }

    String oldValues() {
      return String.join("; ", oldValues);
    }

    String newValues() {
      return String.join("; ", newValues);
    }
  }
}
