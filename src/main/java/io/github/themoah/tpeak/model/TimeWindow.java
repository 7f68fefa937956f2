package io.github.themoah.tpeak.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Half-open time range {@code [start, end)}.
 *
 * @param start inclusive lower bound
 * @param end exclusive upper bound, strictly after start
 */
public record TimeWindow(Instant start, Instant end) {

  public TimeWindow {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    if (!end.isAfter(start)) {
      throw new IllegalArgumentException("Invalid time interval " + start + " - " + end);
    }
  }

  public static TimeWindow of(LocalDate start, LocalDate end) {
    return new TimeWindow(startOfDay(start), startOfDay(end));
  }

  /**
   * Resolves the analysis window from either explicit dates or a trailing range.
   *
   * <p>When both dates are given they are used as-is (end must be after start). Otherwise the
   * window covers {@code deltaDays} whole UTC days ending {@code delayDays} before today.
   */
  public static TimeWindow resolve(
      LocalDate startDate,
      LocalDate endDate,
      int deltaDays,
      int delayDays,
      Clock clock
  ) {
    if (startDate != null && endDate != null) {
      return of(startDate, endDate);
    }
    if (deltaDays < 1) {
      throw new IllegalArgumentException("Window length must be at least one day, got " + deltaDays);
    }
    LocalDate end = LocalDate.now(clock.withZone(ZoneOffset.UTC)).minusDays(delayDays);
    return of(end.minusDays(deltaDays), end);
  }

  public boolean contains(Instant instant) {
    return !instant.isBefore(start) && instant.isBefore(end);
  }

  public Duration duration() {
    return Duration.between(start, end);
  }

  /**
   * Splits the window into consecutive slices of at most {@code step}.
   */
  public List<TimeWindow> split(Duration step) {
    if (step.isZero() || step.isNegative()) {
      throw new IllegalArgumentException("Step must be positive: " + step);
    }
    List<TimeWindow> slices = new ArrayList<>();
    Instant cursor = start;
    while (cursor.isBefore(end)) {
      Instant next = cursor.plus(step);
      if (next.isAfter(end)) {
        next = end;
      }
      slices.add(new TimeWindow(cursor, next));
      cursor = next;
    }
    return slices;
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + ")";
  }

  private static Instant startOfDay(LocalDate date) {
    return date.atStartOfDay(ZoneOffset.UTC).toInstant();
  }
}
