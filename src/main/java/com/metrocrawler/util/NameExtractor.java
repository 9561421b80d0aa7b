package com.metrocrawler.util;

import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns Wikidata captions into display names ("Baker Street station" becomes
 * "Baker Street", "Circle line" becomes "Circle") and display names into ASCII
 * identifiers.
 */
public final class NameExtractor {

    private static final String EN_SYSTEM_TYPE = "[Mm]etro|London [Uu]nderground|[Uu]nderground|[Tt]ube|[Ss]ubway|[Rr]ailway";
    private static final String EN_CAPTION = "(?<name>((?!([Ss]tation|" + EN_SYSTEM_TYPE + ")).)*)";

    private static final Map<String, List<Pattern>> STATION_PATTERNS = Map.ofEntries(
            Map.entry("be", compile("^Станцыя метро (?<name>.*)$")),
            Map.entry("de", compile("^Bahnhof (?<name>.*)$", "^U-Bahnhof (?<name>.*)$", "^S-Bahnhof (?<name>.*)$")),
            Map.entry("en", compile(
                    "^" + EN_CAPTION + "( \\(?(" + EN_SYSTEM_TYPE + ")( )?[Ss]tation(s)?\\)?)$",
                    "^" + EN_CAPTION + " \\((?<line>.*)[ _][Ll]ine\\)$",
                    "^" + EN_CAPTION + "( [Ss]tation(s)?)?$",
                    "^" + EN_CAPTION + "(#.*(" + EN_SYSTEM_TYPE + "))?( stations)?$",
                    "^" + EN_CAPTION + " (" + EN_SYSTEM_TYPE + ")$",
                    "^" + EN_CAPTION + "( \\(.* (" + EN_SYSTEM_TYPE + ")\\))?$",
                    "^(?<name>.* Railway Station) metro station$")),
            Map.entry("fi", compile("^(?<name>.*) metroasema$")),
            Map.entry("ja", compile("^(?<name>.*)駅( \\(.*\\))?$")),
            Map.entry("nl", compile("^(?<name>.*) \\(metrostation\\)$")),
            Map.entry("pl", compile("^Stacja (?<name>.*)$")),
            Map.entry("pt", compile("^Estação (?<name>.*)$")),
            Map.entry("ru", compile(
                    "^(?<name>.*) \\(станция метро\\)$",
                    "^(?<name>.*) \\(станция метро, .* линия\\)$",
                    "^(?<name>.*) \\(станция метро, .*\\)$")),
            Map.entry("uk", compile("^(?<name>.*) \\(станція метро\\)$", "^(?<name>.*) \\(станція метро, (?<city>.*)\\)$")),
            Map.entry("zh", compile("^(?<name>.*)站$")));

    private static final Map<String, List<Pattern>> LINE_PATTERNS = Map.of(
            "be", compile("^(?<name>.*) лінія$"),
            "en", compile(
                    "^(?<name>.*) \\(.*\\)$",
                    "^(?<name>.*) [Ll]ine$",
                    "^[Ll]ine (?<name>.*)$",
                    "^.* [Mm]etro [Ll]ine (?<name>.*)$",
                    "^(?<name>.*) [Rr]ailway$"),
            "ru", compile("^(?<name>.*) линия$"),
            "uk", compile("^(?<name>.*) лінія$"));

    private static final String SEPARATORS = " :-+=\\/–—()'\"«»ʻ,.*!@#$%^º’";
    private static final String CYRILLIC = "абвгдеёжзийклмнопрстуфхцчшщъыьэюяіў";
    private static final String[] CYRILLIC_LATIN = {
            "a", "b", "v", "g", "d", "ye", "yo", "zh", "z", "i", "y", "k", "l", "m", "n", "o", "p", "r", "s",
            "t", "u", "f", "kh", "ts", "ch", "sh", "sch", "", "y", "", "e", "yu", "ya", "i", "u" };
    private static final Map<Character, String> LIGATURES = Map.of(
            '№', "n", '&', "and", 'æ', "ae", 'œ', "oe", 'ß', "ss", 'ø', "o", 'ı', "i", 'đ', "d", 'ə', "c");

    private NameExtractor() {
    }

    public static String extractStationName(String caption, String language) {
        return extract(caption.replace("&", "and"), STATION_PATTERNS.get(language));
    }

    public static String extractLineName(String caption, String language) {
        return extract(caption, LINE_PATTERNS.get(language));
    }

    /**
     * Lowercase ASCII identifier: runs of separators collapse into a single
     * {@code _}, Cyrillic is transliterated and accents are dropped. Returns an
     * empty string when nothing usable is left.
     */
    public static String slugify(String name) {
        StringBuilder escaped = new StringBuilder();
        boolean separator = false;
        for (char c : name.toLowerCase().toCharArray()) {
            if (SEPARATORS.indexOf(c) >= 0 || Character.isWhitespace(c)) {
                if (!separator) {
                    escaped.append('_');
                }
                separator = true;
                continue;
            }
            separator = false;
            int cyrillic = CYRILLIC.indexOf(c);
            if (cyrillic >= 0) {
                escaped.append(CYRILLIC_LATIN[cyrillic]);
            } else if (LIGATURES.containsKey(c)) {
                escaped.append(LIGATURES.get(c));
            } else {
                escaped.append(c);
            }
        }
        String ascii = StringUtils.stripAccents(escaped.toString()).replaceAll("[^a-z0-9_]", "");
        return StringUtils.strip(ascii.replaceAll("_+", "_"), "_");
    }

    private static String extract(String caption, List<Pattern> patterns) {
        if (patterns == null) {
            return caption;
        }
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(caption);
            if (matcher.lookingAt() && !matcher.group("name").isBlank()) {
                return matcher.group("name");
            }
        }
        return caption;
    }

    private static List<Pattern> compile(String... patterns) {
        return List.of(patterns).stream().map(Pattern::compile).collect(Collectors.toList());
    }
}
