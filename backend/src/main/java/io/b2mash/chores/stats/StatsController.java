package io.b2mash.chores.stats;

import io.b2mash.chores.engine.dto.ChoreSnapshotRequest;
import io.b2mash.chores.stats.dto.StatsRequest;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.LocalDate;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatsController {

  private final StatsAggregator statsAggregator;
  private final Clock clock;

  public StatsController(StatsAggregator statsAggregator, Clock clock) {
    this.statsAggregator = statsAggregator;
    this.clock = clock;
  }

  @PostMapping("/api/stats/daily")
  public ResponseEntity<DailyStats> daily(@Valid @RequestBody StatsRequest request) {
    var snapshots = request.chores().stream().map(ChoreSnapshotRequest::toSnapshot).toList();
    return ResponseEntity.ok(
        statsAggregator.dailyStats(request.assigneeId(), snapshots, asOf(request)));
  }

  @PostMapping("/api/stats/monthly")
  public ResponseEntity<MonthlyStats> monthly(@Valid @RequestBody StatsRequest request) {
    var snapshots = request.chores().stream().map(ChoreSnapshotRequest::toSnapshot).toList();
    return ResponseEntity.ok(
        statsAggregator.monthlyStats(request.assigneeId(), snapshots, asOf(request)));
  }

  private LocalDate asOf(StatsRequest request) {
    return request.asOf() != null ? request.asOf() : LocalDate.now(clock);
  }
}
