package io.b2mash.chores.stats;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class StatsControllerTest {

  private static final String HOUSEHOLD =
      """
      {"assigneeId": "alice", "asOf": "2024-01-10",
       "chores": [
         {"chore": {"choreId": "dishes", "name": "Dishes", "durationMinutes": 20,
                    "recurrenceRule": {"kind": "DAILY"}, "assignedTo": "alice"},
          "completions": [
            {"choreId": "dishes", "completedAt": "2024-01-09T20:00:00", "completedBy": "alice"},
            {"choreId": "dishes", "completedAt": "2024-01-10T20:00:00", "completedBy": "alice"}]},
         {"chore": {"choreId": "trash", "name": "Trash", "durationMinutes": 5,
                    "recurrenceRule": {"kind": "WEEKLY", "weekday": 2}, "assignedTo": "alice"},
          "completions": [
            {"choreId": "trash", "completedAt": "2024-01-03T07:00:00", "completedBy": "bob"}]}
       ]}
      """;

  @Autowired private MockMvc mockMvc;

  @Test
  void dailyStatsForAssignee() throws Exception {
    mockMvc
        .perform(
            post("/api/stats/daily").contentType(MediaType.APPLICATION_JSON).content(HOUSEHOLD))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.completed").value(1))
        .andExpect(jsonPath("$.total").value(2))
        .andExpect(jsonPath("$.minutesCompleted").value(20))
        .andExpect(jsonPath("$.minutesTotal").value(25))
        .andExpect(jsonPath("$.streak").value(2));
  }

  @Test
  void monthlyStatsForAssignee() throws Exception {
    mockMvc
        .perform(
            post("/api/stats/monthly").contentType(MediaType.APPLICATION_JSON).content(HOUSEHOLD))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.completed").value(2))
        .andExpect(jsonPath("$.total").value(3))
        .andExpect(jsonPath("$.percentage").value(67));
  }

  @Test
  void missingAssigneeIsBadRequest() throws Exception {
    mockMvc
        .perform(
            post("/api/stats/daily")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"chores": []}
                    """))
        .andExpect(status().isBadRequest());
  }
}
