package com.phasegate.core.execution;

import com.phasegate.core.model.TaskResult.CriterionResult;
import com.phasegate.core.model.TaskResult.FileChanges;
import com.phasegate.core.model.TaskResult.KeyDecision;
import com.phasegate.core.model.TaskResult.TestCounts;
import com.phasegate.core.model.TaskResult.Usage;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the structured completion report from raw agent output.
 * Pure functions, no Spring dependencies.
 */
public final class TaskOutputParser {

    /** A markdown heading reading "Task Complete" (or just "Complete"). */
    static final Pattern COMPLETION_MARKER = Pattern.compile(
            "(?im)^\\s*#{1,6}\\s*(?:task\\s+)?complete(?:d)?\\s*$");

    /**
     * Numbered criterion line, e.g. {@code 2. [FAIL] Handles empty input - throws NPE}.
     * The reason is separated by a spaced hyphen so hyphenated words survive.
     */
    static final Pattern CRITERION_LINE = Pattern.compile(
            "(?im)^\\s*\\d+\\.\\s*\\[(PASS|FAIL)]\\s*(.+?)(?:\\s+-\\s+(.+?))?\\s*$");

    /** Check-mark criterion line, e.g. {@code ✓ Builds cleanly}. */
    static final Pattern CHECK_LINE = Pattern.compile("(?m)^\\s*(?:[-*]\\s*)?([✓✗])\\s*(.+?)\\s*$");

    private static final Pattern HEADING = Pattern.compile("^\\s*#{1,6}\\s*(.+?)\\s*:?\\s*$");
    private static final Pattern BULLET = Pattern.compile("^\\s*[-*]\\s+(.+?)\\s*$");
    private static final Pattern STATUS_LINE = Pattern.compile("(?i)Status:\\s*\\[?(PASS|FAIL)]?");
    private static final Pattern TESTS_ADDED = Pattern.compile("(?i)added:\\s*(\\d+)");
    private static final Pattern TESTS_PASSING = Pattern.compile("(?i)passing:\\s*(\\d+)");
    private static final Pattern TESTS_FAILING = Pattern.compile("(?i)failing:\\s*(\\d+)");
    private static final Pattern TESTS_PASSED_PROSE = Pattern.compile("(?i)(\\d+)\\s+tests?\\s+pass(?:ed|ing)?");
    private static final Pattern TOKENS = Pattern.compile("(?i)tokens(?:\\s+used)?:\\s*([\\d,]+)");
    private static final Pattern COST = Pattern.compile("(?i)cost(?:\\s*\\(usd\\))?:\\s*\\$?([\\d.]+)");
    private static final Pattern COMPLETED_SENTENCE = Pattern.compile(
            "(?i)(?:task|implementation)\\s+(?:is\\s+)?(?:complete|completed|done)[.!]?[^\\n]*");

    private static final int MAX_FALLBACK_SUMMARY = 500;

    private TaskOutputParser() {}

    public static ParsedOutput parse(String output) {
        String text = output == null ? "" : output;
        return new ParsedOutput(
                COMPLETION_MARKER.matcher(text).find(),
                extractSummary(text),
                new FileChanges(
                        paths(bulletSection(text, "files created", "created files")),
                        paths(bulletSection(text, "files modified", "modified files")),
                        paths(bulletSection(text, "files deleted", "deleted files"))),
                extractDecisions(text),
                bulletSection(text, "assumptions"),
                extractTests(text),
                extractCriteria(text),
                extractUsage(text));
    }

    public static ValidationVerdict parseValidation(String output) {
        String text = output == null ? "" : output;
        List<CriterionResult> criteria = extractCriteria(text);
        Matcher status = STATUS_LINE.matcher(text);
        boolean passed;
        if (status.find()) {
            passed = "PASS".equalsIgnoreCase(status.group(1));
        } else {
            passed = !criteria.isEmpty() && criteria.stream().allMatch(CriterionResult::met);
        }
        return new ValidationVerdict(passed, criteria, sectionText(text, "summary"));
    }

    static List<CriterionResult> extractCriteria(String text) {
        List<CriterionResult> criteria = new ArrayList<>();
        Matcher m = CRITERION_LINE.matcher(text);
        while (m.find()) {
            criteria.add(new CriterionResult(m.group(2).strip(), "PASS".equalsIgnoreCase(m.group(1)),
                    m.group(3) == null ? null : m.group(3).strip()));
        }
        Matcher check = CHECK_LINE.matcher(text);
        while (check.find()) {
            String description = check.group(2).strip();
            boolean known = criteria.stream().anyMatch(c -> c.criterion().contains(description));
            if (!known) {
                criteria.add(new CriterionResult(description, "✓".equals(check.group(1)), null));
            }
        }
        return criteria;
    }

    private static String extractSummary(String text) {
        String section = sectionText(text, "summary");
        if (!section.isEmpty()) {
            return section;
        }
        Matcher completed = COMPLETED_SENTENCE.matcher(text);
        if (completed.find()) {
            return completed.group().strip();
        }
        String[] paragraphs = text.strip().split("\\n\\s*\\n");
        String last = paragraphs[paragraphs.length - 1].strip();
        return last.length() < MAX_FALLBACK_SUMMARY ? last : "";
    }

    private static List<KeyDecision> extractDecisions(String text) {
        List<KeyDecision> decisions = new ArrayList<>();
        for (String item : bulletSection(text, "key decisions", "decisions")) {
            int colon = item.indexOf(": ");
            if (colon > 0) {
                decisions.add(new KeyDecision(item.substring(0, colon).strip(), item.substring(colon + 2).strip()));
            } else {
                decisions.add(new KeyDecision(item, ""));
            }
        }
        return decisions;
    }

    private static TestCounts extractTests(String text) {
        String section = sectionText(text, "tests");
        if (!section.isEmpty()) {
            return new TestCounts(intOf(TESTS_ADDED, section), intOf(TESTS_PASSING, section),
                    intOf(TESTS_FAILING, section));
        }
        return new TestCounts(0, intOf(TESTS_PASSED_PROSE, text), 0);
    }

    private static Usage extractUsage(String text) {
        long tokens = 0;
        Matcher t = TOKENS.matcher(text);
        if (t.find()) {
            try {
                tokens = Long.parseLong(t.group(1).replace(",", ""));
            } catch (NumberFormatException e) {
                tokens = 0;
            }
        }
        double cost = 0.0;
        Matcher c = COST.matcher(text);
        if (c.find()) {
            try {
                cost = Double.parseDouble(c.group(1));
            } catch (NumberFormatException e) {
                cost = 0.0;
            }
        }
        return new Usage(tokens, cost);
    }

    private static int intOf(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        if (!m.find()) {
            return 0;
        }
        try {
            return Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            // out of int range
            return 0;
        }
    }

    private static List<String> paths(List<String> items) {
        List<String> paths = new ArrayList<>();
        for (String item : items) {
            int colon = item.indexOf(": ");
            String path = colon > 0 ? item.substring(0, colon) : item;
            paths.add(path.replace("`", "").strip());
        }
        return paths;
    }

    /**
     * Bullet items under the first heading matching one of the names, up to the next heading.
     */
    static List<String> bulletSection(String text, String... names) {
        List<String> items = new ArrayList<>();
        List<String> lines = sectionLines(text, names);
        for (String line : lines) {
            Matcher bullet = BULLET.matcher(line);
            if (bullet.matches()) {
                items.add(bullet.group(1));
            }
        }
        return items;
    }

    /**
     * Plain text under the first heading matching the name, up to the next heading or fence.
     */
    static String sectionText(String text, String name) {
        return String.join("\n", sectionLines(text, name)).strip();
    }

    private static List<String> sectionLines(String text, String... names) {
        String[] lines = text.split("\\R");
        int start = -1;
        for (int i = 0; i < lines.length && start < 0; i++) {
            Matcher heading = HEADING.matcher(lines[i]);
            if (heading.matches()) {
                String title = heading.group(1).toLowerCase();
                for (String name : names) {
                    if (title.equals(name)) {
                        start = i + 1;
                        break;
                    }
                }
            }
        }
        List<String> section = new ArrayList<>();
        if (start < 0) {
            return section;
        }
        for (int i = start; i < lines.length; i++) {
            String line = lines[i];
            if (HEADING.matcher(line).matches() || line.strip().startsWith("```")) {
                break;
            }
            section.add(line);
        }
        return section;
    }
}
