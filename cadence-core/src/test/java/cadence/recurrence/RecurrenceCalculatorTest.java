package cadence.recurrence;

import cadence.ValidationException;
import cadence.model.IntervalKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecurrenceCalculatorTest {

  private final RecurrenceCalculator calculator = RecurrenceCalculator.UTC;

  private static Instant at(String date) {
    return Instant.parse(date + "T00:00:00Z");
  }

  @Test
  void everyIntervalMovesStrictlyForward() {
    Instant[] samples = {
        at("2024-01-31"), at("2024-02-29"), at("2023-12-31"), at("2024-06-15"),
        Instant.parse("2024-03-10T23:59:59Z")
    };
    for (IntervalKind interval : IntervalKind.values()) {
      for (Instant from : samples) {
        assertTrue(calculator.next(from, interval).isAfter(from), interval + " from " + from);
      }
    }
  }

  @Test
  void dayBasedIntervals() {
    assertEquals(at("2024-03-01"), calculator.next(at("2024-02-29"), IntervalKind.DAILY));
    assertEquals(at("2024-01-07"), calculator.next(at("2023-12-31"), IntervalKind.WEEKLY));
    assertEquals(at("2024-03-14"), calculator.next(at("2024-02-29"), IntervalKind.BIWEEKLY));
  }

  @Test
  void monthlyClampsToLeapFebruary() {
    assertEquals(at("2024-02-29"), calculator.next(at("2024-01-31"), IntervalKind.MONTHLY));
  }

  @Test
  void monthlyClampsToCommonFebruary() {
    assertEquals(at("2023-02-28"), calculator.next(at("2023-01-31"), IntervalKind.MONTHLY));
  }

  @Test
  void monthlyCrossesYearEnd() {
    assertEquals(at("2025-01-15"), calculator.next(at("2024-12-15"), IntervalKind.MONTHLY));
  }

  @Test
  void yearlyFromLeapDayFallsBackToTwentyEighth() {
    assertEquals(at("2025-02-28"), calculator.next(at("2024-02-29"), IntervalKind.YEARLY));
  }

  @Test
  void quarterlyCompoundsMonthlyClamping() {
    // Nov 30 -> Dec 30 -> Jan 30 -> Feb 28
    assertEquals(at("2023-02-28"), calculator.next(at("2022-11-30"), IntervalKind.QUARTERLY));
    // Jan 31 -> Feb 29 -> Mar 29 -> Apr 29
    assertEquals(at("2024-04-29"), calculator.next(at("2024-01-31"), IntervalKind.QUARTERLY));
  }

  @Test
  void timeOfDayIsPreserved() {
    Instant from = Instant.parse("2024-01-31T09:30:00Z");

    assertEquals(Instant.parse("2024-02-29T09:30:00Z"), calculator.next(from, IntervalKind.MONTHLY));
  }

  @Test
  void anchoredMonthlyReturnsToAnchorAfterShortMonth() {
    Instant feb = calculator.next(at("2024-01-31"), IntervalKind.MONTHLY, 31);
    Instant mar = calculator.next(feb, IntervalKind.MONTHLY, 31);
    Instant apr = calculator.next(mar, IntervalKind.MONTHLY, 31);

    assertEquals(at("2024-02-29"), feb);
    assertEquals(at("2024-03-31"), mar);
    assertEquals(at("2024-04-30"), apr);
    assertEquals(at("2024-05-31"), calculator.next(apr, IntervalKind.MONTHLY, 31));
  }

  @Test
  void anchoredYearlyReturnsToLeapDay() {
    Instant y2025 = calculator.next(at("2024-02-29"), IntervalKind.YEARLY, 29);
    Instant y2026 = calculator.next(y2025, IntervalKind.YEARLY, 29);
    Instant y2027 = calculator.next(y2026, IntervalKind.YEARLY, 29);

    assertEquals(at("2025-02-28"), y2025);
    assertEquals(at("2028-02-29"), calculator.next(y2027, IntervalKind.YEARLY, 29));
  }

  @Test
  void anchorOutsideMonthRangeIsRejected() {
    assertThrows(RecurrenceException.class,
        () -> calculator.next(at("2024-01-01"), IntervalKind.MONTHLY, 0));
    assertThrows(RecurrenceException.class,
        () -> calculator.next(at("2024-01-01"), IntervalKind.MONTHLY, 32));
  }

  @Test
  void overflowRaisesRecurrenceException() {
    RecurrenceException e = assertThrows(RecurrenceException.class,
        () -> calculator.next(Instant.MAX, IntervalKind.DAILY));

    assertInstanceOf(ValidationException.class, e);
  }

  @Test
  void unrepresentableStartRaisesRecurrenceException() {
    assertThrows(RecurrenceException.class, () -> calculator.anchorDayOf(Instant.MIN));
    assertThrows(RecurrenceException.class,
        () -> calculator.firstAfter(Instant.MAX, IntervalKind.MONTHLY, at("2024-01-01")));
  }

  @Test
  void firstOnOrAfterReturnsStartWhenAlreadyReached() {
    assertEquals(at("2024-01-31"),
        calculator.firstOnOrAfter(at("2024-01-31"), IntervalKind.MONTHLY, at("2024-01-15")));
  }

  @Test
  void firstOnOrAfterWalksTheAnchoredSchedule() {
    assertEquals(at("2024-03-31"),
        calculator.firstOnOrAfter(at("2024-01-31"), IntervalKind.MONTHLY, at("2024-03-01")));
    assertEquals(at("2024-03-31"),
        calculator.firstOnOrAfter(at("2024-01-31"), IntervalKind.MONTHLY, at("2024-03-31")));
  }

  @Test
  void firstAfterIsStrict() {
    assertEquals(at("2024-04-30"),
        calculator.firstAfter(at("2024-01-31"), IntervalKind.MONTHLY, at("2024-03-31")));
    assertEquals(at("2024-01-15"),
        calculator.firstAfter(at("2024-01-01"), IntervalKind.WEEKLY, at("2024-01-08")));
  }

  @Test
  void calendarRulesFollowTheConfiguredZone() {
    RecurrenceCalculator tokyo = new RecurrenceCalculator(ZoneId.of("Asia/Tokyo"));
    // 2024-01-31T00:00 in Tokyo
    Instant from = Instant.parse("2024-01-30T15:00:00Z");

    assertEquals(31, tokyo.anchorDayOf(from));
    assertEquals(30, calculator.anchorDayOf(from));
    assertEquals(Instant.parse("2024-02-28T15:00:00Z"), tokyo.next(from, IntervalKind.MONTHLY));
  }
}
