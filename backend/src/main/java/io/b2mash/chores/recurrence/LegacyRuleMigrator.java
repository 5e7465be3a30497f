package io.b2mash.chores.recurrence;

import io.b2mash.chores.exception.InvalidRuleException;
import io.b2mash.chores.subtask.CompletionType;
import io.b2mash.chores.subtask.StreakType;
import io.b2mash.chores.subtask.SubtaskPolicy;
import java.time.DayOfWeek;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * Converts chore rows of the first-generation chores database into typed rules. Those rows carry a
 * Dutch {@code frequency_type} label, use {@code -1} for "no weekday/monthday" and store active
 * days as JSON objects ({@code {"mon": true}} or {@code {"1": true}}).
 */
@Component
public class LegacyRuleMigrator {

  private static final Logger log = LoggerFactory.getLogger(LegacyRuleMigrator.class);

  private static final Map<String, RecurrenceKind> LABELS =
      Map.of(
          "dagelijks", RecurrenceKind.DAILY,
          "wekelijks", RecurrenceKind.WEEKLY,
          "meerdere keren per week", RecurrenceKind.MULTI_WEEKLY,
          "maandelijks", RecurrenceKind.MONTHLY,
          "meerdere keren per maand", RecurrenceKind.MULTI_MONTHLY,
          "per kwartaal", RecurrenceKind.QUARTERLY,
          "halfjaarlijks", RecurrenceKind.SEMI_ANNUAL,
          "jaarlijks", RecurrenceKind.YEARLY,
          "flexibel", RecurrenceKind.FLEXIBLE);

  private static final List<String> DAY_KEYS =
      List.of("mon", "tue", "wed", "thu", "fri", "sat", "sun");

  private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public LegacyRuleMigrator(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /** Resolves a stored discriminant, accepting both the Dutch labels and the enum names. */
  public static RecurrenceKind kindOf(String label) {
    if (label == null || label.isBlank()) {
      return RecurrenceKind.WEEKLY;
    }
    var kind = LABELS.get(label.trim().toLowerCase(Locale.ROOT));
    if (kind != null) {
      return kind;
    }
    try {
      return RecurrenceKind.valueOf(label.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new InvalidRuleException("Unknown frequency type: " + label);
    }
  }

  public RecurrenceRule migrateRule(Map<String, Object> row) {
    RecurrenceKind kind = kindOf(stringValue(row.get("frequency_type")));
    RecurrenceRule rule =
        switch (kind) {
          case DAILY -> new RecurrenceRule.Daily(activeWeekdays(row.get("active_days")));
          case WEEKLY -> RecurrenceRules.weekly(optionalPosition(row.get("weekday"), 0));
          case MULTI_WEEKLY ->
              new RecurrenceRule.MultiWeekly(
                  activeWeekdays(row.get("active_days")), intValue(row.get("frequency_times"), 3));
          case MONTHLY -> RecurrenceRules.monthly(optionalPosition(row.get("monthday"), 1));
          case MULTI_MONTHLY ->
              new RecurrenceRule.MultiMonthly(
                  activeMonthdays(row.get("active_monthdays")),
                  intValue(row.get("frequency_times"), 4));
          case QUARTERLY -> new RecurrenceRule.Quarterly(anchor(row, "startMonth", "startDay"));
          case SEMI_ANNUAL -> new RecurrenceRule.SemiAnnual(anchor(row, "startMonth", "startDay"));
          case YEARLY -> {
            var anchor = anchor(row, "startMonth", "startDay");
            yield new RecurrenceRule.Yearly(
                anchor != null ? anchor : anchor(row, "yearMonth", "yearDay"));
          }
          case FLEXIBLE ->
              new RecurrenceRule.Flexible(
                  intValue(row.get("frequency_times"), 1), period(row.get("subtasks_period")));
        };
    log.debug("Migrated legacy chore {} to {}", row.get("chore_id"), rule);
    return rule;
  }

  public SubtaskPolicy migratePolicy(Map<String, Object> row) {
    var completion = stringValue(row.get("subtasks_completion_type"));
    var streak = stringValue(row.get("subtasks_streak_type"));
    return new SubtaskPolicy(
        completion != null ? enumValue(CompletionType.class, completion) : null,
        streak != null ? enumValue(StreakType.class, streak) : null,
        period(row.get("subtasks_period")));
  }

  /** Weekdays missing from the legacy object count as active. */
  private Set<DayOfWeek> activeWeekdays(Object raw) {
    Map<String, Object> flags = jsonObject(raw, "active_days");
    if (flags.isEmpty()) {
      return Set.of();
    }
    var days = EnumSet.noneOf(DayOfWeek.class);
    for (int i = 0; i < DAY_KEYS.size(); i++) {
      if (!Boolean.FALSE.equals(booleanValue(flags.get(DAY_KEYS.get(i))))) {
        days.add(RecurrenceRules.weekday(i));
      }
    }
    return days;
  }

  /** Monthdays missing from the legacy object count as inactive. */
  private Set<Integer> activeMonthdays(Object raw) {
    Map<String, Object> flags = jsonObject(raw, "active_monthdays");
    var days = new LinkedHashSet<Integer>();
    flags.forEach(
        (key, value) -> {
          if (Boolean.TRUE.equals(booleanValue(value))) {
            days.add(RecurrenceRules.checkMonthday(intValue(key, 0)));
          }
        });
    return days;
  }

  @SuppressWarnings("unchecked")
  private Map<String, Object> jsonObject(Object raw, String field) {
    if (raw == null) {
      return Map.of();
    }
    if (raw instanceof Map<?, ?> map) {
      return (Map<String, Object>) map;
    }
    var text = raw.toString();
    if (text.isBlank()) {
      return Map.of();
    }
    try {
      return objectMapper.readValue(text, JSON_OBJECT);
    } catch (JacksonException e) {
      throw new InvalidRuleException("Unreadable " + field + " JSON: " + text);
    }
  }

  /**
   * Reads a weekday or monthday that used a negative number (or 0 for monthdays) as "unset".
   *
   * @param lowest the smallest valid value of the position
   */
  private static Integer optionalPosition(Object raw, int lowest) {
    if (raw == null) {
      return null;
    }
    int value = intValue(raw, lowest - 1);
    return value < lowest ? null : value;
  }

  private static Anchor anchor(Map<String, Object> row, String monthKey, String dayKey) {
    Object month = row.get(monthKey);
    Object day = row.get(dayKey);
    if (month == null || day == null) {
      return null;
    }
    return RecurrenceRules.anchor(intValue(month, 0), intValue(day, 1));
  }

  private static PeriodUnit period(Object raw) {
    var text = stringValue(raw);
    if (text == null) {
      return PeriodUnit.WEEK;
    }
    return switch (text.trim().toLowerCase(Locale.ROOT)) {
      case "day" -> PeriodUnit.DAY;
      case "week" -> PeriodUnit.WEEK;
      case "month" -> PeriodUnit.MONTH;
      default -> throw new InvalidRuleException("Unknown subtasks period: " + text);
    };
  }

  private static <E extends Enum<E>> E enumValue(Class<E> type, String text) {
    try {
      return Enum.valueOf(type, text.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new InvalidRuleException(
          "Unknown " + type.getSimpleName() + " value: " + text);
    }
  }

  private static int intValue(Object raw, int fallback) {
    if (raw == null) {
      return fallback;
    }
    if (raw instanceof Number number) {
      return number.intValue();
    }
    var text = raw.toString().trim();
    if (text.isEmpty()) {
      return fallback;
    }
    try {
      return Integer.parseInt(text);
    } catch (NumberFormatException e) {
      throw new InvalidRuleException("Not a number: " + text);
    }
  }

  private static Boolean booleanValue(Object raw) {
    if (raw == null) {
      return null;
    }
    if (raw instanceof Boolean flag) {
      return flag;
    }
    if (raw instanceof Number number) {
      return number.intValue() != 0;
    }
    return Boolean.parseBoolean(raw.toString().trim());
  }

  private static String stringValue(Object raw) {
    return raw == null ? null : raw.toString();
  }
}
