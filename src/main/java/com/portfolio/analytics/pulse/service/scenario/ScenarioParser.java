package com.portfolio.analytics.pulse.service.scenario;

import com.portfolio.analytics.pulse.dto.scenario.ActionType;
import com.portfolio.analytics.pulse.dto.scenario.ScenarioAction;
import com.portfolio.analytics.pulse.exception.ScenarioParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses natural-language what-if instructions into {@link ScenarioAction}s.
 *
 * Supported forms:
 * <pre>
 *   remove Project Delta [from portfolio]
 *   increase Project Beta budget by 20%      decrease the budget for Alpha by £50,000
 *   cut Project Beta scope by 30%            trim the scope of Beta by 10%
 *   delay Project Gamma by 1 quarter         push back Gamma 3 months
 * </pre>
 * Matching runs on a lowercased copy; the project name is sliced from the original
 * text so its case is preserved.
 */
@Service
@Slf4j
public class ScenarioParser {

    static final Map<String, Integer> WEEKS_PER_UNIT = Map.of(
            "week", 1,
            "fortnight", 2,
            "month", 4,
            "quarter", 13,
            "year", 52
    );

    private static final Set<String> DECREASE_VERBS = Set.of("decrease", "reduce", "lower");

    private static final String BUDGET_VERBS = "(increase|decrease|reduce|raise|boost|lower)";
    private static final String SCOPE_VERBS = "(?:cut|reduce|trim|shrink)";
    private static final String DELAY_VERBS = "(?:delay|push\\s+back|postpone|defer|extend)";
    private static final String PROJECT_PREFIX = "(?:project\\s+)?";
    private static final String PERCENT = "(\\d+(?:\\.\\d+)?)\\s*%";
    private static final String MONEY = "[£$€]?\\s*(\\d[\\d,]*(?:\\.\\d+)?)";
    private static final String UNIT = "(weeks?|fortnights?|months?|quarters?|years?)";

    private static final Pattern REMOVE = Pattern.compile(
            "(?:remove|cancel|drop|kill|delete)\\s+" + PROJECT_PREFIX + "(.+?)(?:\\s+from\\s+(?:the\\s+)?portfolio)?");

    private static final List<Pattern> BUDGET_PERCENT = List.of(
            Pattern.compile(BUDGET_VERBS + "\\s+" + PROJECT_PREFIX + "(.+?)\\s+budget\\s+by\\s+" + PERCENT),
            Pattern.compile(BUDGET_VERBS + "\\s+(?:the\\s+)?budget\\s+(?:for|of|on)\\s+" + PROJECT_PREFIX
                    + "(.+?)\\s+by\\s+" + PERCENT)
    );

    private static final List<Pattern> BUDGET_ABSOLUTE = List.of(
            Pattern.compile(BUDGET_VERBS + "\\s+" + PROJECT_PREFIX + "(.+?)\\s+budget\\s+by\\s+" + MONEY),
            Pattern.compile(BUDGET_VERBS + "\\s+(?:the\\s+)?budget\\s+(?:for|of|on)\\s+" + PROJECT_PREFIX
                    + "(.+?)\\s+by\\s+" + MONEY)
    );

    private static final List<Pattern> SCOPE_CUT = List.of(
            Pattern.compile(SCOPE_VERBS + "\\s+" + PROJECT_PREFIX + "(.+?)\\s+scope\\s+by\\s+" + PERCENT),
            Pattern.compile(SCOPE_VERBS + "\\s+(?:the\\s+)?scope\\s+(?:for|of|on)\\s+" + PROJECT_PREFIX
                    + "(.+?)\\s+by\\s+" + PERCENT)
    );

    private static final List<Pattern> DELAY = List.of(
            Pattern.compile(DELAY_VERBS + "\\s+" + PROJECT_PREFIX + "(.+?)\\s+by\\s+(\\d+)\\s+" + UNIT),
            Pattern.compile(DELAY_VERBS + "\\s+" + PROJECT_PREFIX + "(.+?)\\s+(\\d+)\\s+" + UNIT)
    );

    /**
     * @throws ScenarioParseException when the text is blank or matches no supported pattern
     */
    public ScenarioAction parse(String text) {
        String original = text == null ? "" : text.strip();
        if (original.isEmpty()) {
            throw new ScenarioParseException("Empty scenario input.", text);
        }
        String normalised = original.toLowerCase(Locale.ROOT);

        ScenarioAction action = parseRemove(normalised, original);
        if (action == null) {
            action = parseBudgetChange(normalised, original);
        }
        if (action == null) {
            action = parseScopeCut(normalised, original);
        }
        if (action == null) {
            action = parseDelay(normalised, original);
        }
        if (action == null) {
            throw new ScenarioParseException("Could not parse scenario: '" + original + "'. "
                    + "Supported patterns: budget increase/decrease, scope cut, delay, remove.", text);
        }

        log.info("Parsed scenario '{}' as {} on {}", original, action.getActionType(), action.getProject());
        return action;
    }

    private ScenarioAction parseRemove(String normalised, String original) {
        Matcher m = REMOVE.matcher(normalised);
        if (!m.matches()) {
            return null;
        }
        return ScenarioAction.builder()
                .actionType(ActionType.REMOVE)
                .project(projectName(m, 1, original))
                .description(original)
                .build();
    }

    private ScenarioAction parseBudgetChange(String normalised, String original) {
        for (Pattern pattern : BUDGET_PERCENT) {
            Matcher m = pattern.matcher(normalised);
            if (m.lookingAt()) {
                return ScenarioAction.builder()
                        .actionType(budgetDirection(m.group(1)))
                        .project(projectName(m, 2, original))
                        .amount(Double.parseDouble(m.group(3)) / 100.0)
                        .description(original)
                        .build();
            }
        }
        for (Pattern pattern : BUDGET_ABSOLUTE) {
            Matcher m = pattern.matcher(normalised);
            if (m.lookingAt()) {
                return ScenarioAction.builder()
                        .actionType(budgetDirection(m.group(1)))
                        .project(projectName(m, 2, original))
                        .amountAbsolute(Double.parseDouble(m.group(3).replace(",", "")))
                        .description(original)
                        .build();
            }
        }
        return null;
    }

    private ScenarioAction parseScopeCut(String normalised, String original) {
        for (Pattern pattern : SCOPE_CUT) {
            Matcher m = pattern.matcher(normalised);
            if (m.lookingAt()) {
                double percent = Double.parseDouble(m.group(2));
                if (percent > 100.0) {
                    throw new ScenarioParseException("Scope cut must be between 0% and 100%, got "
                            + m.group(2) + "%.", original);
                }
                return ScenarioAction.builder()
                        .actionType(ActionType.SCOPE_CUT)
                        .project(projectName(m, 1, original))
                        .amount(percent / 100.0)
                        .description(original)
                        .build();
            }
        }
        return null;
    }

    private ScenarioAction parseDelay(String normalised, String original) {
        for (Pattern pattern : DELAY) {
            Matcher m = pattern.matcher(normalised);
            if (m.lookingAt()) {
                return ScenarioAction.builder()
                        .actionType(ActionType.DELAY)
                        .project(projectName(m, 1, original))
                        .durationWeeks(delayWeeks(m.group(2), m.group(3), original))
                        .description(original)
                        .build();
            }
        }
        return null;
    }

    /**
     * Converts a count of units to weeks. Counts that do not fit an {@code int} week total are
     * rejected rather than wrapped.
     */
    static int delayWeeks(String count, String unit, String original) {
        try {
            return Math.multiplyExact(Integer.parseInt(count), weeksPerUnit(unit));
        } catch (NumberFormatException | ArithmeticException e) {
            throw new ScenarioParseException("Delay of " + count + " " + unit + " is too large.", original, e);
        }
    }

    private static ActionType budgetDirection(String verb) {
        return DECREASE_VERBS.contains(verb) ? ActionType.BUDGET_DECREASE : ActionType.BUDGET_INCREASE;
    }

    static int weeksPerUnit(String unit) {
        String singular = unit.endsWith("s") ? unit.substring(0, unit.length() - 1) : unit;
        return WEEKS_PER_UNIT.getOrDefault(singular, 1);
    }

    /**
     * Slices the matched group out of the original text to keep its case. Falls back to a
     * substring search when lowercasing changed the text length.
     */
    static String projectName(Matcher m, int group, String original) {
        String matched = m.group(group);
        String name;
        if (original.toLowerCase(Locale.ROOT).length() == original.length()) {
            name = original.substring(m.start(group), m.end(group));
        } else {
            int pos = original.toLowerCase(Locale.ROOT).indexOf(matched);
            name = pos != -1 ? original.substring(pos, pos + matched.length()) : matched;
        }
        return stripQuotes(name.strip());
    }

    private static String stripQuotes(String name) {
        int start = 0;
        int end = name.length();
        while (start < end && isQuote(name.charAt(start))) {
            start++;
        }
        while (end > start && isQuote(name.charAt(end - 1))) {
            end--;
        }
        return name.substring(start, end).strip();
    }

    private static boolean isQuote(char c) {
        return c == '\'' || c == '"';
    }
}
