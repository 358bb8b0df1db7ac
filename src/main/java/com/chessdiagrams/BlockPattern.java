package com.chessdiagrams;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A compiled regular expression plus the capture roles it provides.
 * Swapping books means swapping these values, not code.
 * <p>
 * Roles come from named groups when the expression declares all of them
 * (e.g. {@code (?<year>\d{4})}), otherwise from groups 1..n in role order.
 */
public final class BlockPattern {

    public static final List<String> HEADER_ROLES =
            Collections.unmodifiableList(Arrays.asList("diagramNumber", "player1", "player2", "year"));
    public static final List<String> SOLUTION_ROLES =
            Collections.unmodifiableList(Arrays.asList("moveNumber", "dots", "moveBody"));

    private static final Pattern NAMED_GROUP = Pattern.compile("\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>");

    private final String name;
    private final Pattern pattern;
    private final List<String> roles;
    private final boolean named;

    private BlockPattern(String name, String regex, List<String> roles) {
        if (regex == null || regex.trim().isEmpty()) {
            throw new ConfigurationException("The " + name + " pattern is empty");
        }
        try {
            this.pattern = Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Cannot parse the " + name + " pattern: " + e.getDescription(), e);
        }
        this.name = name;
        this.roles = roles;
        this.named = declaredGroupNames(regex).containsAll(roles);

        int groups = pattern.matcher("").groupCount();
        if (!named && groups < roles.size()) {
            throw new ConfigurationException("The " + name + " pattern needs " + roles.size()
                    + " capture groups " + roles + " but declares " + groups);
        }
    }

    public static BlockPattern header(String regex) {
        return new BlockPattern("header", regex, HEADER_ROLES);
    }

    public static BlockPattern solution(String regex) {
        return new BlockPattern("solution", regex, SOLUTION_ROLES);
    }

    public String getRegex() {
        return pattern.pattern();
    }

    public boolean matches(String text) {
        return text != null && pattern.matcher(text.trim()).find();
    }

    /**
     * Matches the trimmed text and returns the captured roles, or null when the text does not match.
     */
    public Match match(String text) {
        if (text == null) {
            return null;
        }
        Matcher m = pattern.matcher(text.trim());
        if (!m.find()) {
            return null;
        }
        Map<String, String> captured = new LinkedHashMap<>();
        for (int i = 0; i < roles.size(); i++) {
            String role = roles.get(i);
            captured.put(role, named ? m.group(role) : m.group(i + 1));
        }
        return new Match(captured);
    }

    private static Set<String> declaredGroupNames(String regex) {
        Set<String> names = new HashSet<>();
        Matcher m = NAMED_GROUP.matcher(regex);
        while (m.find()) {
            names.add(m.group(1));
        }
        return names;
    }

    @Override
    public String toString() {
        return name + " pattern /" + pattern.pattern() + "/";
    }

    /**
     * Captured roles of one successful match.
     */
    public static final class Match {
        private final Map<String, String> roles;

        Match(Map<String, String> roles) {
            this.roles = roles;
        }

        /** The captured text of a role, or null when its group did not take part in the match. */
        public String get(String role) {
            return roles.get(role);
        }
    }
}
