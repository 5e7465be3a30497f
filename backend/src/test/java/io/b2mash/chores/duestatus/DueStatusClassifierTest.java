package io.b2mash.chores.duestatus;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class DueStatusClassifierTest {

  private static final LocalDate TODAY = LocalDate.of(2024, 1, 10);

  @Test
  void pastDueDateIsOverdue() {
    var status = DueStatusClassifier.classify(TODAY.minusDays(2), TODAY.minusDays(9), TODAY);
    assertThat(status).isEqualTo(DueStatus.OVERDUE);
  }

  @Test
  void dueTodayWhenNotCompletedToday() {
    var status = DueStatusClassifier.classify(TODAY, TODAY.minusDays(7), TODAY);
    assertThat(status).isEqualTo(DueStatus.DUE_TODAY);
  }

  @Test
  void neverCompletedChoreDueTodayIsDueToday() {
    assertThat(DueStatusClassifier.classify(TODAY, null, TODAY)).isEqualTo(DueStatus.DUE_TODAY);
  }

  @Test
  void futureDueDateIsUpcoming() {
    var status = DueStatusClassifier.classify(TODAY.plusDays(3), TODAY.minusDays(4), TODAY);
    assertThat(status).isEqualTo(DueStatus.UPCOMING);
  }

  @Test
  void completionTodaySuppressesOverdue() {
    var status = DueStatusClassifier.classify(TODAY.minusDays(1), TODAY, TODAY);
    assertThat(status).isEqualTo(DueStatus.UPCOMING);
  }

  @Test
  void completionTodaySuppressesDueToday() {
    assertThat(DueStatusClassifier.classify(TODAY, TODAY, TODAY)).isEqualTo(DueStatus.UPCOMING);
  }

  @Test
  void daysUntilDueIsNegativeWhenOverdue() {
    assertThat(DueStatusClassifier.daysUntilDue(TODAY.plusDays(5), TODAY)).isEqualTo(5);
    assertThat(DueStatusClassifier.daysUntilDue(TODAY.minusDays(3), TODAY)).isEqualTo(-3);
    assertThat(DueStatusClassifier.daysUntilDue(TODAY, TODAY)).isZero();
  }

  @Test
  void onlyOverdueAndDueTodayAreActionable() {
    assertThat(DueStatusClassifier.isActionable(DueStatus.OVERDUE)).isTrue();
    assertThat(DueStatusClassifier.isActionable(DueStatus.DUE_TODAY)).isTrue();
    assertThat(DueStatusClassifier.isActionable(DueStatus.UPCOMING)).isFalse();
  }
}
