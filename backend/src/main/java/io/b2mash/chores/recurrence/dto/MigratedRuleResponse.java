package io.b2mash.chores.recurrence.dto;

import io.b2mash.chores.subtask.SubtaskPolicy;

public record MigratedRuleResponse(RecurrenceRuleDto recurrenceRule, SubtaskPolicy subtaskPolicy) {}
