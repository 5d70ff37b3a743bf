package org.boxworld.pddl.plan;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A classified line of plan text.
 */
public final class PlanLine {

    /** What a line of plan text contains. */
    public enum Kind {
        BLANK,
        COMMENT,
        ACTION,
        UNRECOGNIZED
    }

    private static final Pattern COST = Pattern.compile("cost\\s*=\\s*(\\d+)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int number;
    private final Kind kind;
    private final String text;

    private PlanLine(int number, Kind kind, String text) {
        this.number = number;
        this.kind = kind;
        this.text = text;
    }

    /**
     * Classifies one line. Comments start with {@code ;}; a line that starts with {@code (} or
     * ends with {@code )} is taken as an action atom, even when its parentheses turn out to be
     * unbalanced.
     *
     * @param number the 1-based line number
     * @param raw    the line without its terminator
     */
    public static PlanLine classify(int number, String raw) {
        String text = raw.trim();
        Kind kind;
        if (text.isEmpty()) {
            kind = Kind.BLANK;
        } else if (text.startsWith(";")) {
            kind = Kind.COMMENT;
        } else if (text.startsWith("(") || text.endsWith(")")) {
            kind = Kind.ACTION;
        } else {
            kind = Kind.UNRECOGNIZED;
        }
        return new PlanLine(number, kind, text);
    }

    public int getNumber() {
        return number;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the trimmed line
     */
    public String getText() {
        return text;
    }

    /**
     * Reads the {@code cost = N} annotation of a comment line.
     *
     * @throws PlanFormatException if the cost does not fit a {@code long}
     */
    public Optional<Long> cost() {
        if (kind != Kind.COMMENT) {
            return Optional.empty();
        }
        Matcher matcher = COST.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(matcher.group(1)));
        } catch (NumberFormatException e) {
            throw new PlanFormatException(number, "cost out of range: " + matcher.group(1));
        }
    }

    /**
     * Splits an action line into a step.
     *
     * @throws PlanFormatException if the parentheses do not wrap the whole line exactly once, or
     *                             if there is no action name
     */
    public PlanStep toStep() {
        if (kind != Kind.ACTION) {
            throw new IllegalStateException("Line " + number + " is not an action: " + kind);
        }
        if (!text.startsWith("(") || !text.endsWith(")") || text.length() < 2) {
            throw new PlanFormatException(number, "unbalanced parentheses in \"" + text + '"');
        }
        String inner = text.substring(1, text.length() - 1).trim();
        if (inner.indexOf('(') >= 0 || inner.indexOf(')') >= 0) {
            throw new PlanFormatException(number, "unbalanced parentheses in \"" + text + '"');
        }
        if (inner.isEmpty()) {
            throw new PlanFormatException(number, "action atom without a name: \"" + text + '"');
        }
        List<String> tokens = Arrays.asList(WHITESPACE.split(inner));
        List<String> arguments = tokens.size() > 1 ? tokens.subList(1, tokens.size()) : Collections.emptyList();
        return new PlanStep(tokens.get(0), arguments);
    }
}
