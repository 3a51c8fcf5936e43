package io.b2mash.collab.calendar;

import io.b2mash.collab.exception.ValidationException;
import io.b2mash.collab.persistence.PersistenceExecutor;
import java.time.LocalDate;
import java.util.List;
import org.springframework.stereotype.Service;

@Service
public class CalendarService {

  private final CalendarEventRepository repository;
  private final PersistenceExecutor executor;

  public CalendarService(CalendarEventRepository repository, PersistenceExecutor executor) {
    this.repository = repository;
    this.executor = executor;
  }

  /**
   * Keeps the task's calendar row in line with its due date: created or moved when a date is set,
   * removed when it is cleared. Joins the caller's transaction when there is one.
   */
  public void syncTaskDueDate(Long taskId, Long ownerId, String title, LocalDate dueDate) {
    executor.runTransactionWithRetry(
        () -> {
          if (dueDate == null) {
            repository.deleteByTaskId(taskId);
            return;
          }
          var event =
              repository
                  .findByTaskId(taskId)
                  .map(
                      existing -> {
                        existing.reschedule(ownerId, title, dueDate);
                        return existing;
                      })
                  .orElseGet(() -> new CalendarEvent(taskId, ownerId, title, dueDate));
          repository.save(event);
        },
        "syncCalendarEvent");
  }

  public int deleteForTask(Long taskId) {
    return executor.executeTransactionWithRetry(
        () -> repository.deleteByTaskId(taskId), "deleteCalendarEvents");
  }

  public List<CalendarEvent> listForUser(Long userId, LocalDate from, LocalDate to) {
    if (from.isAfter(to)) {
      throw new ValidationException("from must not be after to");
    }
    return executor.executeReadOnly(
        () -> repository.findByUserIdAndEventDateBetweenOrderByEventDateAsc(userId, from, to),
        "listCalendarEvents");
  }
}
