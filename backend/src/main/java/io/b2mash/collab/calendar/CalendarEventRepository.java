package io.b2mash.collab.calendar;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CalendarEventRepository extends JpaRepository<CalendarEvent, Long> {

  Optional<CalendarEvent> findByTaskId(Long taskId);

  List<CalendarEvent> findByUserIdAndEventDateBetweenOrderByEventDateAsc(
      Long userId, LocalDate from, LocalDate to);

  long countByTaskId(Long taskId);

  @Modifying
  @Query("DELETE FROM CalendarEvent e WHERE e.taskId = :taskId")
  int deleteByTaskId(@Param("taskId") Long taskId);
}
