package io.b2mash.chores.engine;

import io.b2mash.chores.chore.ChoreCompletionService;
import io.b2mash.chores.chore.CompletionRecord;
import io.b2mash.chores.engine.dto.ChoreStateResponse;
import io.b2mash.chores.engine.dto.CompleteChoreRequest;
import io.b2mash.chores.engine.dto.EvaluateChoreRequest;
import io.b2mash.chores.recurrence.LegacyRuleMigrator;
import io.b2mash.chores.recurrence.dto.MigratedRuleResponse;
import io.b2mash.chores.recurrence.dto.RecurrenceRuleDto;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ChoreEngineController {

  private final ChoreEngine choreEngine;
  private final ChoreCompletionService choreCompletionService;
  private final LegacyRuleMigrator legacyRuleMigrator;
  private final Clock clock;

  public ChoreEngineController(
      ChoreEngine choreEngine,
      ChoreCompletionService choreCompletionService,
      LegacyRuleMigrator legacyRuleMigrator,
      Clock clock) {
    this.choreEngine = choreEngine;
    this.choreCompletionService = choreCompletionService;
    this.legacyRuleMigrator = legacyRuleMigrator;
    this.clock = clock;
  }

  @PostMapping("/api/chores/evaluate")
  public ResponseEntity<ChoreStateResponse> evaluate(
      @Valid @RequestBody EvaluateChoreRequest request) {
    LocalDate today = request.today() != null ? request.today() : LocalDate.now(clock);
    List<CompletionRecord> completions =
        request.completions() != null ? request.completions() : List.of();

    var state = choreEngine.evaluate(request.chore().toChore(), completions, today);
    return ResponseEntity.ok(ChoreStateResponse.from(state));
  }

  @PostMapping("/api/chores/complete")
  public ResponseEntity<List<CompletionRecord>> complete(
      @Valid @RequestBody CompleteChoreRequest request) {
    var chore = request.chore().toChore();
    LocalDateTime completedAt =
        request.completedAt() != null ? request.completedAt() : LocalDateTime.now(clock);

    if (request.subtaskIds() == null || request.subtaskIds().isEmpty()) {
      var record = choreCompletionService.completeChore(chore, request.completedBy(), completedAt);
      return ResponseEntity.ok(List.of(record));
    }
    var records =
        choreCompletionService.completeSubtasks(
            chore, request.subtaskIds(), request.completedBy(), completedAt);
    return ResponseEntity.ok(records);
  }

  @PostMapping("/api/chores/migrate")
  public ResponseEntity<MigratedRuleResponse> migrate(@RequestBody Map<String, Object> legacyRow) {
    var rule = legacyRuleMigrator.migrateRule(legacyRow);
    var policy = legacyRuleMigrator.migratePolicy(legacyRow);
    return ResponseEntity.ok(new MigratedRuleResponse(RecurrenceRuleDto.from(rule), policy));
  }
}
