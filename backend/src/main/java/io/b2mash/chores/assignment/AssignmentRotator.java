package io.b2mash.chores.assignment;

import io.b2mash.chores.chore.Chore;
import io.b2mash.chores.chore.CompletionRecord;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves who is responsible for a chore right now. Without an alternation that is always the
 * static assignee. With one, responsibility flips after every completion by either partner; a
 * completion by somebody else leaves the designated assignee unchanged.
 */
@Component
public class AssignmentRotator {

  private static final Logger log = LoggerFactory.getLogger(AssignmentRotator.class);

  /**
   * Resolves the assignee after one completion, given who was designated before it. A completion
   * by the primary hands the chore to the alternate and vice versa; anybody else leaves {@code
   * designatedBefore} in place.
   *
   * @param chore the chore
   * @param designatedBefore the assignee responsible before {@code lastCompletion}
   * @param lastCompletion the latest chore-level completion, or null if there is none
   * @return the assignee id responsible now
   */
  public String currentAssignee(
      Chore chore, String designatedBefore, CompletionRecord lastCompletion) {
    if (!chore.alternates()) {
      return chore.assignedTo();
    }
    if (lastCompletion == null) {
      return designatedBefore;
    }
    String primary = chore.assignedTo();
    String alternate = chore.alternation().alternateWith();
    if (lastCompletion.completedBy().equals(primary)) {
      return alternate;
    }
    if (lastCompletion.completedBy().equals(alternate)) {
      return primary;
    }
    log.debug(
        "Chore {} completed by {}, outside its alternation; holding {}",
        chore.choreId(),
        lastCompletion.completedBy(),
        designatedBefore);
    return designatedBefore;
  }

  /**
   * Resolves the current assignee by folding over the chore-level completions.
   *
   * @param chore the chore
   * @param completions chore-level completions of this chore, in any order
   * @return the assignee id responsible now
   */
  public String currentAssignee(Chore chore, List<CompletionRecord> completions) {
    String designated = chore.assignedTo();
    if (!chore.alternates()) {
      return designated;
    }
    var ordered =
        completions.stream()
            .filter(r -> r.choreId().equals(chore.choreId()))
            .sorted(Comparator.comparing(CompletionRecord::completedAt))
            .toList();
    for (CompletionRecord record : ordered) {
      designated = currentAssignee(chore, designated, record);
    }
    return designated;
  }
}
