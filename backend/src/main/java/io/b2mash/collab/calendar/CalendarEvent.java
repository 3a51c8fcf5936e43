package io.b2mash.collab.calendar;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;

/** Due-date entry derived from a task. One row per task that has a due date. */
@Entity
@Table(name = "calendar_events")
public class CalendarEvent {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "task_id", nullable = false)
  private Long taskId;

  @Column(name = "user_id", nullable = false)
  private Long userId;

  @Column(name = "title", nullable = false, length = 500)
  private String title;

  @Column(name = "event_date", nullable = false)
  private LocalDate eventDate;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected CalendarEvent() {}

  public CalendarEvent(Long taskId, Long userId, String title, LocalDate eventDate) {
    this.taskId = taskId;
    this.userId = userId;
    this.title = title;
    this.eventDate = eventDate;
    this.createdAt = Instant.now();
  }

  public void reschedule(Long userId, String title, LocalDate eventDate) {
    this.userId = userId;
    this.title = title;
    this.eventDate = eventDate;
  }

  public Long getId() {
    return id;
  }

  public Long getTaskId() {
    return taskId;
  }

  public Long getUserId() {
    return userId;
  }

  public String getTitle() {
    return title;
  }

  public LocalDate getEventDate() {
    return eventDate;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
