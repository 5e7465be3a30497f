package io.b2mash.chores.assignment;

import static io.b2mash.chores.TestChores.alternatingChore;
import static io.b2mash.chores.TestChores.chore;
import static io.b2mash.chores.TestChores.done;
import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.chores.chore.Assignees;
import io.b2mash.chores.recurrence.RecurrenceRules;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class AssignmentRotatorTest {

  private final AssignmentRotator rotator = new AssignmentRotator();

  @Test
  void withoutAlternationStaticAssigneeIsResponsible() {
    var chore = chore("dishes", RecurrenceRules.weekly(0));
    var completions = List.of(done("dishes", "bob", "2024-01-01T10:00"));
    assertThat(rotator.currentAssignee(chore, completions)).isEqualTo("alice");
  }

  @Test
  void alternationFlipsAfterEveryCompletion() {
    var chore = alternatingChore("trash", "alice", "bob");
    var history =
        List.of(
            done("trash", "alice", "2024-01-01T08:00"),
            done("trash", "bob", "2024-01-02T08:00"),
            done("trash", "alice", "2024-01-03T08:00"),
            done("trash", "bob", "2024-01-04T08:00"));

    var designated = new ArrayList<String>();
    for (int i = 0; i <= history.size(); i++) {
      designated.add(rotator.currentAssignee(chore, history.subList(0, i)));
    }
    assertThat(designated).containsExactly("alice", "bob", "alice", "bob", "alice");
  }

  @Test
  void thirdPartyCompletionHoldsDesignatedAssignee() {
    var chore = alternatingChore("trash", "alice", "bob");
    var history =
        List.of(
            done("trash", "alice", "2024-01-01T08:00"), done("trash", "carol", "2024-01-02T08:00"));
    assertThat(rotator.currentAssignee(chore, history)).isEqualTo("bob");
  }

  @Test
  void singleCompletionStepsFromPreviousDesignation() {
    var chore = alternatingChore("trash", "alice", "bob");
    assertThat(rotator.currentAssignee(chore, "bob", done("trash", "bob", "2024-01-02T08:00")))
        .isEqualTo("alice");
    assertThat(rotator.currentAssignee(chore, "bob", done("trash", "alice", "2024-01-02T08:00")))
        .isEqualTo("bob");
    assertThat(rotator.currentAssignee(chore, "bob", null)).isEqualTo("bob");
  }

  @Test
  void singleThirdPartyCompletionHoldsPreviousDesignation() {
    var chore = alternatingChore("trash", "alice", "bob");
    assertThat(rotator.currentAssignee(chore, "bob", done("trash", "carol", "2024-01-02T08:00")))
        .isEqualTo("bob");
  }

  @Test
  void historyIsFoldedInChronologicalOrder() {
    var chore = alternatingChore("trash", "alice", "bob");
    var history =
        List.of(
            done("trash", "bob", "2024-01-02T08:00"), done("trash", "alice", "2024-01-01T08:00"));
    assertThat(rotator.currentAssignee(chore, history)).isEqualTo("alice");
  }

  @Test
  void alternationOnAnyoneIsIgnored() {
    var chore = alternatingChore("trash", Assignees.ANYONE, "bob");
    var history = List.of(done("trash", "bob", "2024-01-01T08:00"));
    assertThat(rotator.currentAssignee(chore, history)).isEqualTo(Assignees.ANYONE);
  }
}
