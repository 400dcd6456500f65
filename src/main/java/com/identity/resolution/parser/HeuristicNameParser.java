package com.identity.resolution.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static com.identity.resolution.parser.RawNameParse.CORPORATION_NAME;
import static com.identity.resolution.parser.RawNameParse.FIRST_INITIAL;
import static com.identity.resolution.parser.RawNameParse.GIVEN_NAME;
import static com.identity.resolution.parser.RawNameParse.LAST_INITIAL;
import static com.identity.resolution.parser.RawNameParse.MIDDLE_INITIAL;
import static com.identity.resolution.parser.RawNameParse.MIDDLE_NAME;
import static com.identity.resolution.parser.RawNameParse.NICKNAME;
import static com.identity.resolution.parser.RawNameParse.PREFIX_MARITAL;
import static com.identity.resolution.parser.RawNameParse.PREFIX_OTHER;
import static com.identity.resolution.parser.RawNameParse.SECOND_GIVEN_NAME;
import static com.identity.resolution.parser.RawNameParse.SECOND_SURNAME;
import static com.identity.resolution.parser.RawNameParse.SUFFIX_GENERATIONAL;
import static com.identity.resolution.parser.RawNameParse.SUFFIX_OTHER;
import static com.identity.resolution.parser.RawNameParse.SURNAME;

/**
 * Rule-based name tagger bundled with the library.
 *
 * <p>Recognizes inverted ({@code "Last, First Middle"}) and natural ({@code "First Middle Last"})
 * person names, honorifics, generational and professional suffixes, surname particles,
 * quoted or parenthesised nicknames, corporate designators, and joined multi-person strings.
 * Joined strings are tagged {@code Household} and are never split into separate people.</p>
 *
 * <p>Stateless and thread-safe.</p>
 */
public class HeuristicNameParser implements NameParser {

    static final Set<String> PLACEHOLDER_TOKENS = Set.of(
            "?", "unknown", "unk", "n/a", "na", "none", "null", "illegible", "unidentified", "tbd");

    private static final Set<String> MARITAL_PREFIXES = Set.of("mr", "mrs", "ms", "miss", "mx");
    private static final Set<String> OTHER_PREFIXES = Set.of(
            "dr", "prof", "professor", "sir", "dame", "lady", "lord", "rev", "hon",
            "capt", "col", "gen", "sen", "amb", "judge");
    private static final Set<String> GENERATIONAL_SUFFIXES = Set.of(
            "jr", "junior", "sr", "senior", "ii", "iii", "iv");
    private static final Set<String> OTHER_SUFFIXES = Set.of(
            "phd", "md", "esq", "dds", "cpa", "qc", "kc", "obe", "mbe");
    private static final Set<String> CORPORATE_DESIGNATORS = Set.of(
            "inc", "incorporated", "ltd", "limited", "llc", "llp", "corp", "corporation", "company",
            "plc", "gmbh", "foundation", "trust", "holdings", "group", "partners", "associates",
            "bank", "university", "institute", "fund", "capital", "ventures", "airlines", "aviation",
            "enterprises", "international", "services", "club", "hotel", "museum", "society", "agency");
    // Short designators that are only trusted at the end of the string.
    private static final Set<String> TRAILING_CORPORATE_DESIGNATORS = Set.of("co", "sa", "ag", "nv", "bv", "lp");
    private static final Set<String> SURNAME_PARTICLES = Set.of(
            "van", "von", "de", "der", "den", "del", "della", "di", "da", "du", "la", "le", "st", "bin", "al");

    private static final Pattern NICKNAME_PATTERN = Pattern.compile("\"([^\"]*)\"|\\(([^)]*)\\)|“([^”]*)”");
    private static final Pattern CONJUNCTION = Pattern.compile("\\s*&\\s*|\\s+and\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern INITIALS = Pattern.compile("^(\\p{L}\\.)+\\p{L}?$|^\\p{L}\\.?$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    @Override
    public RawNameParse parse(String rawName) throws NameParseException {
        if (rawName == null || !hasLetter(rawName)) {
            throw new NameParseException(rawName, "No alphabetic content");
        }

        Map<String, String> labels = new LinkedHashMap<>();
        String text = extractNickname(rawName.trim(), labels);
        List<String> tokens = tokenize(text);

        if (isPlaceholderOnly(tokens)) {
            if (labels.containsKey(NICKNAME) && tokens.stream().noneMatch(HeuristicNameParser::hasLetter)) {
                return new RawNameParse(labels, RawNameParse.TYPE_PERSON);
            }
            throw new NameParseException(rawName, "Only placeholder tokens");
        }

        if (isCorporate(tokens)) {
            labels.put(CORPORATION_NAME, String.join(" ", tokens));
            return new RawNameParse(labels, RawNameParse.TYPE_CORPORATION);
        }

        Matcher conjunction = CONJUNCTION.matcher(text);
        if (conjunction.find()) {
            parseHousehold(text, conjunction, labels);
            return new RawNameParse(labels, RawNameParse.TYPE_HOUSEHOLD);
        }

        parsePerson(text, labels);
        if (!labels.containsKey(GIVEN_NAME) && !labels.containsKey(FIRST_INITIAL)
                && !labels.containsKey(SURNAME) && !labels.containsKey(LAST_INITIAL)
                && !labels.containsKey(NICKNAME)) {
            throw new NameParseException(rawName, "Only honorifics or suffixes");
        }
        return new RawNameParse(labels, RawNameParse.TYPE_PERSON);
    }

    private String extractNickname(String text, Map<String, String> labels) {
        Matcher matcher = NICKNAME_PATTERN.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String content = firstNonNull(matcher.group(1), matcher.group(2), matcher.group(3)).trim();
            if (hasLetter(content) && !labels.containsKey(NICKNAME)) {
                labels.put(NICKNAME, content);
            }
            matcher.appendReplacement(sb, " ");
        }
        matcher.appendTail(sb);
        return WHITESPACE.matcher(sb.toString()).replaceAll(" ").trim();
    }

    private void parseHousehold(String text, Matcher conjunction, Map<String, String> labels) {
        String left = text.substring(0, conjunction.start());
        String right = text.substring(conjunction.end());

        // "Smith, John & Jane"
        String sharedSurname = null;
        int comma = left.indexOf(',');
        if (comma >= 0) {
            sharedSurname = clean(left.substring(0, comma));
            left = left.substring(comma + 1);
        }

        List<String> prefixes = new ArrayList<>();
        List<String> leftTokens = stripPrefixes(tokenize(left.replace(',', ' ')), prefixes);
        List<String> rightTokens = stripPrefixes(tokenize(right.replace(',', ' ')), prefixes);
        if (!prefixes.isEmpty()) {
            labels.put(PREFIX_MARITAL, String.join(" & ", prefixes));
        }

        // "Mr & Mrs John Smith": the conjunction only joined the honorifics
        if (leftTokens.isEmpty()) {
            parseNatural(rightTokens, labels);
            if (sharedSurname != null && !sharedSurname.isEmpty()) {
                labels.put(SURNAME, sharedSurname);
            }
            return;
        }

        labels.put(GIVEN_NAME, leftTokens.get(0));
        if (!rightTokens.isEmpty()) {
            labels.put(SECOND_GIVEN_NAME, rightTokens.get(0));
        }
        if (sharedSurname != null && !sharedSurname.isEmpty()) {
            labels.put(SURNAME, sharedSurname);
        }
        if (leftTokens.size() >= 2) {
            labels.putIfAbsent(SURNAME, surnameFrom(leftTokens, 1));
        }
        if (rightTokens.size() >= 2) {
            labels.put(labels.containsKey(SURNAME) ? SECOND_SURNAME : SURNAME, surnameFrom(rightTokens, 1));
        }
    }

    private void parsePerson(String text, Map<String, String> labels) {
        int comma = text.indexOf(',');
        if (comma >= 0) {
            List<String> before = tokenize(text.substring(0, comma));
            List<String> after = tokenize(text.substring(comma + 1).replace(',', ' '));
            boolean suffixOnly = !after.isEmpty() && after.stream().allMatch(HeuristicNameParser::isSuffix);
            if (!before.isEmpty() && !after.isEmpty() && !suffixOnly) {
                parseInverted(before, after, labels);
                return;
            }
        }
        parseNatural(tokenize(text.replace(',', ' ')), labels);
    }

    private void parseInverted(List<String> surnameTokens, List<String> restTokens, Map<String, String> labels) {
        List<String> prefixes = new ArrayList<>();
        List<String> suffixes = new ArrayList<>();
        List<String> family = stripSuffixes(stripPrefixes(surnameTokens, prefixes), suffixes);
        List<String> rest = stripSuffixes(stripPrefixes(restTokens, prefixes), suffixes);
        putAffixes(prefixes, suffixes, labels);

        if (!family.isEmpty()) {
            String surname = String.join(" ", family);
            labels.put(family.size() == 1 && isInitial(surname) ? LAST_INITIAL : SURNAME, surname);
        }
        if (!rest.isEmpty()) {
            putGiven(rest.get(0), labels);
            putMiddle(rest.subList(1, rest.size()), labels);
        }
    }

    private void parseNatural(List<String> rawTokens, Map<String, String> labels) {
        List<String> prefixes = new ArrayList<>();
        List<String> suffixes = new ArrayList<>();
        List<String> tokens = stripSuffixes(stripPrefixes(rawTokens, prefixes), suffixes);
        putAffixes(prefixes, suffixes, labels);

        if (tokens.isEmpty()) {
            return;
        }
        if (tokens.size() == 1) {
            String only = tokens.get(0);
            labels.put(isInitial(only) ? LAST_INITIAL : SURNAME, only);
            return;
        }

        int surnameStart = tokens.size() - 1;
        while (surnameStart > 1 && SURNAME_PARTICLES.contains(key(tokens.get(surnameStart - 1)))) {
            surnameStart--;
        }
        putGiven(tokens.get(0), labels);
        putMiddle(tokens.subList(1, surnameStart), labels);
        String surname = surnameFrom(tokens, surnameStart);
        labels.put(surnameStart == tokens.size() - 1 && isInitial(surname) ? LAST_INITIAL : SURNAME, surname);
    }

    private static String surnameFrom(List<String> tokens, int defaultStart) {
        int start = tokens.size() - 1;
        while (start > defaultStart && SURNAME_PARTICLES.contains(key(tokens.get(start - 1)))) {
            start--;
        }
        return String.join(" ", tokens.subList(Math.max(start, defaultStart), tokens.size()));
    }

    private static void putGiven(String token, Map<String, String> labels) {
        labels.put(isInitial(token) ? FIRST_INITIAL : GIVEN_NAME, token);
    }

    private static void putMiddle(List<String> tokens, Map<String, String> labels) {
        if (tokens.isEmpty()) {
            return;
        }
        boolean allInitials = tokens.stream().allMatch(HeuristicNameParser::isInitial);
        labels.put(allInitials ? MIDDLE_INITIAL : MIDDLE_NAME, String.join(" ", tokens));
    }

    private static void putAffixes(List<String> prefixes, List<String> suffixes, Map<String, String> labels) {
        List<String> marital = prefixes.stream().filter(p -> MARITAL_PREFIXES.contains(key(p))).collect(Collectors.toList());
        List<String> other = prefixes.stream().filter(p -> !MARITAL_PREFIXES.contains(key(p))).collect(Collectors.toList());
        if (!marital.isEmpty()) labels.put(PREFIX_MARITAL, String.join(" ", marital));
        if (!other.isEmpty()) labels.put(PREFIX_OTHER, String.join(" ", other));

        List<String> generational = suffixes.stream().filter(s -> GENERATIONAL_SUFFIXES.contains(key(s))).collect(Collectors.toList());
        List<String> otherSuffixes = suffixes.stream().filter(s -> !GENERATIONAL_SUFFIXES.contains(key(s))).collect(Collectors.toList());
        if (!generational.isEmpty()) labels.put(SUFFIX_GENERATIONAL, String.join(" ", generational));
        if (!otherSuffixes.isEmpty()) labels.put(SUFFIX_OTHER, String.join(" ", otherSuffixes));
    }

    private static List<String> stripPrefixes(List<String> tokens, List<String> prefixes) {
        int i = 0;
        // Keep at least one token so "Dr Who" style single names survive.
        while (i < tokens.size() - 1 && isPrefix(tokens.get(i))) {
            prefixes.add(tokens.get(i));
            i++;
        }
        if (tokens.size() == 1 && isPrefix(tokens.get(0))) {
            prefixes.add(tokens.get(0));
            return List.of();
        }
        return new ArrayList<>(tokens.subList(i, tokens.size()));
    }

    private static List<String> stripSuffixes(List<String> tokens, List<String> suffixes) {
        int end = tokens.size();
        while (end > 1 && isSuffix(tokens.get(end - 1))) {
            end--;
        }
        List<String> found = tokens.subList(end, tokens.size());
        suffixes.addAll(found);
        return new ArrayList<>(tokens.subList(0, end));
    }

    private static boolean isCorporate(List<String> tokens) {
        if (tokens.isEmpty()) {
            return false;
        }
        for (String token : tokens) {
            if (CORPORATE_DESIGNATORS.contains(key(token))) {
                return true;
            }
        }
        return tokens.size() > 1 && TRAILING_CORPORATE_DESIGNATORS.contains(key(tokens.get(tokens.size() - 1)));
    }

    private static boolean isPlaceholderOnly(List<String> tokens) {
        return tokens.stream()
                .filter(t -> hasLetter(t) || PLACEHOLDER_TOKENS.contains(key(t)))
                .allMatch(t -> PLACEHOLDER_TOKENS.contains(key(t)));
    }

    private static boolean isPrefix(String token) {
        String k = key(token);
        return MARITAL_PREFIXES.contains(k) || OTHER_PREFIXES.contains(k);
    }

    private static boolean isSuffix(String token) {
        String k = key(token);
        return GENERATIONAL_SUFFIXES.contains(k) || OTHER_SUFFIXES.contains(k);
    }

    static boolean isInitial(String token) {
        return INITIALS.matcher(token).matches();
    }

    private static List<String> tokenize(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return new ArrayList<>();
        }
        return Arrays.stream(WHITESPACE.split(trimmed))
                .map(HeuristicNameParser::clean)
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toCollection(ArrayList::new));
    }

    /**
     * Trims separators from both ends of a token while keeping inner punctuation
     * ({@code O'Brien}, {@code Smith-Jones}) and the trailing period of an initial.
     */
    private static String clean(String token) {
        String t = token.trim();
        while (!t.isEmpty() && ",;:".indexOf(t.charAt(t.length() - 1)) >= 0) {
            t = t.substring(0, t.length() - 1);
        }
        while (!t.isEmpty() && ",;:.".indexOf(t.charAt(0)) >= 0) {
            t = t.substring(1);
        }
        if (t.length() > 2 && t.endsWith(".") && !isInitial(t)) {
            t = t.substring(0, t.length() - 1);
        }
        return t;
    }

    private static String key(String token) {
        String k = token.toLowerCase(Locale.ROOT);
        if (PLACEHOLDER_TOKENS.contains(k)) {
            return k;
        }
        return k.replace(".", "");
    }

    private static boolean hasLetter(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (Character.isLetter(s.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    private static String firstNonNull(String... values) {
        for (String v : values) {
            if (v != null) {
                return v;
            }
        }
        return "";
    }
}
