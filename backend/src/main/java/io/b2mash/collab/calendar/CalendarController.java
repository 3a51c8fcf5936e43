package io.b2mash.collab.calendar;

import io.b2mash.collab.security.CurrentUser;
import java.time.LocalDate;
import java.util.List;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class CalendarController {

  private final CalendarService calendarService;

  public CalendarController(CalendarService calendarService) {
    this.calendarService = calendarService;
  }

  @GetMapping("/api/calendar")
  public ResponseEntity<List<CalendarEventResponse>> listEvents(
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
    var events = calendarService.listForUser(CurrentUser.requireUserId(), from, to);
    return ResponseEntity.ok(events.stream().map(CalendarEventResponse::from).toList());
  }

  public record CalendarEventResponse(Long id, Long taskId, String title, LocalDate date) {

    static CalendarEventResponse from(CalendarEvent event) {
      return new CalendarEventResponse(
          event.getId(), event.getTaskId(), event.getTitle(), event.getEventDate());
    }
  }
}
