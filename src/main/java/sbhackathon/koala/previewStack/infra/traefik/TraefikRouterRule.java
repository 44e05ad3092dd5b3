package sbhackathon.koala.previewStack.infra.traefik;

import sbhackathon.koala.previewStack.exception.TraefikRuleParseException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Traefik <a href="https://doc.traefik.io/traefik/routing/routers/#rule">router rule</a>.
 * <p>
 * 지원하는 matcher는 {@code Host}, {@code Path}, {@code PathPrefix}이며 {@code &&}로만 결합됩니다.
 * 예: {@code Host(`example.com`) && PathPrefix(`/master/db/`)}
 */
public final class TraefikRouterRule {

    private static final Pattern MATCHER = Pattern.compile("^\\s*([A-Za-z]+)\\((.*)\\)\\s*$");
    private static final Pattern ARGUMENT = Pattern.compile("\\s*`([^`]*)`\\s*(,|$)");

    private final List<RuleMatcher> matchers;

    private TraefikRouterRule(List<RuleMatcher> matchers) {
        this.matchers = List.copyOf(matchers);
    }

    /**
     * 경로 조각들로 {@code PathPrefix(`/a/b/`)} 규칙을 만듭니다.
     */
    public static TraefikRouterRule pathPrefixRule(String... segments) {
        String path = Arrays.stream(segments)
                .map(segment -> segment.replaceAll("^/+|/+$", ""))
                .filter(segment -> !segment.isEmpty())
                .collect(Collectors.joining("/", "/", "/"));
        return new TraefikRouterRule(List.of(new RuleMatcher(MatcherKind.PATH_PREFIX, List.of(path))));
    }

    public static TraefikRouterRule hostRule(String... hosts) {
        return new TraefikRouterRule(List.of(new RuleMatcher(MatcherKind.HOST, List.of(hosts))));
    }

    public static TraefikRouterRule parse(String rule) throws TraefikRuleParseException {
        if (rule == null || rule.isBlank()) {
            throw new TraefikRuleParseException("Empty router rule");
        }

        List<RuleMatcher> matchers = new ArrayList<>();
        for (String part : splitConjunction(rule)) {
            matchers.add(parseMatcher(part, rule));
        }
        return new TraefikRouterRule(matchers);
    }

    /**
     * 백틱 인자 밖에 있는 {@code &&}에서만 규칙을 나눕니다. 인자 안의 {@code &&}는 값의 일부입니다.
     */
    private static List<String> splitConjunction(String rule) throws TraefikRuleParseException {
        List<String> parts = new ArrayList<>();
        boolean inArgument = false;
        int start = 0;
        for (int i = 0; i < rule.length(); i++) {
            char c = rule.charAt(i);
            if (c == '`') {
                inArgument = !inArgument;
            } else if (!inArgument && c == '&' && i + 1 < rule.length() && rule.charAt(i + 1) == '&') {
                parts.add(rule.substring(start, i));
                start = i + 2;
                i++;
            }
        }
        if (inArgument) {
            throw new TraefikRuleParseException("Unterminated argument in router rule: " + rule);
        }
        parts.add(rule.substring(start));
        return parts;
    }

    private static RuleMatcher parseMatcher(String part, String rule) throws TraefikRuleParseException {
        Matcher matcher = MATCHER.matcher(part);
        if (!matcher.matches()) {
            throw new TraefikRuleParseException("Cannot parse router rule: " + rule);
        }

        MatcherKind kind = MatcherKind.fromName(matcher.group(1));
        if (kind == null) {
            throw new TraefikRuleParseException(
                    "Unsupported matcher '" + matcher.group(1) + "' in router rule: " + rule);
        }

        String arguments = matcher.group(2);
        List<String> values = new ArrayList<>();
        Matcher argument = ARGUMENT.matcher(arguments);
        int position = 0;
        while (position < arguments.length()) {
            if (!argument.find(position) || argument.start() != position) {
                throw new TraefikRuleParseException("Invalid arguments in router rule: " + rule);
            }
            values.add(argument.group(1));
            position = argument.end();
        }

        if (values.isEmpty()) {
            throw new TraefikRuleParseException("Matcher without arguments in router rule: " + rule);
        }
        return new RuleMatcher(kind, values);
    }

    /**
     * 두 규칙을 {@code &&}로 결합합니다. 이미 포함된 matcher는 중복으로 추가하지 않습니다.
     */
    public TraefikRouterRule merge(TraefikRouterRule other) {
        Set<RuleMatcher> merged = new LinkedHashSet<>(matchers);
        merged.addAll(other.matchers);
        return new TraefikRouterRule(new ArrayList<>(merged));
    }

    /**
     * {@code PathPrefix} matcher에 포함된 경로 목록.
     */
    public List<String> pathPrefixes() {
        return matchers.stream()
                .filter(matcher -> matcher.kind == MatcherKind.PATH_PREFIX)
                .flatMap(matcher -> matcher.values.stream())
                .collect(Collectors.toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TraefikRouterRule)) {
            return false;
        }
        return matchers.equals(((TraefikRouterRule) o).matchers);
    }

    @Override
    public int hashCode() {
        return matchers.hashCode();
    }

    @Override
    public String toString() {
        return matchers.stream()
                .map(RuleMatcher::toString)
                .collect(Collectors.joining(" && "));
    }

    private enum MatcherKind {
        HOST("Host"),
        PATH("Path"),
        PATH_PREFIX("PathPrefix");

        private final String ruleName;

        MatcherKind(String ruleName) {
            this.ruleName = ruleName;
        }

        static MatcherKind fromName(String name) {
            for (MatcherKind kind : values()) {
                if (kind.ruleName.equals(name)) {
                    return kind;
                }
            }
            return null;
        }
    }

    private static final class RuleMatcher {
        private final MatcherKind kind;
        private final List<String> values;

        RuleMatcher(MatcherKind kind, List<String> values) {
            this.kind = kind;
            this.values = List.copyOf(values);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof RuleMatcher)) {
                return false;
            }
            RuleMatcher that = (RuleMatcher) o;
            return kind == that.kind && values.equals(that.values);
        }

        @Override
        public int hashCode() {
            return Objects.hash(kind, values);
        }

        @Override
        public String toString() {
            return values.stream()
                    .map(value -> "`" + value + "`")
                    .collect(Collectors.joining(", ", kind.ruleName + "(", ")"));
        }
    }
}
