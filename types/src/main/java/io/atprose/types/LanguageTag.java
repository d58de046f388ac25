package io.atprose.types;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * A BCP-47 language tag such as {@code en}, {@code pt-BR} or {@code zh-Hant-TW}.
 *
 * <p>
 * Grammar accepted:
 *
 * <pre>
 * tag       = language ["-" script] ["-" region] *("-" variant) *("-" extension) ["-" privateuse]
 *           / privateuse
 * language  = 2*3ALPHA *3("-" 3ALPHA)
 * script    = 4ALPHA
 * region    = 2ALPHA / 3DIGIT
 * variant   = 5*8alphanum / (DIGIT 3alphanum)
 * extension = singleton 1*("-" 2*8alphanum)
 * privateuse= "x" 1*("-" 1*8alphanum)
 * </pre>
 *
 * <p>
 * Primary language subtags of 4 to 8 letters are grammatical but have no
 * registered values, so they are rejected. Canonical form lowercases every
 * subtag except the script (title case) and region (upper case).
 */
public final class LanguageTag {

    private final String canonical;
    private final String language;
    private final String script;
    private final String region;

    private LanguageTag(String canonical, String language, String script, String region) {
        this.canonical = canonical;
        this.language = language;
        this.script = script;
        this.region = region;
    }

    /**
     * Parses and canonicalizes a language tag.
     *
     * @throws InvalidFormatException if the tag is invalid
     */
    public static LanguageTag parse(String raw) {
        if (raw == null || raw.isEmpty()) {
            throw new InvalidFormatException(FormatError.LANGUAGE_MALFORMED, raw);
        }
        String[] subtags = raw.split("-", -1);
        for (String subtag : subtags) {
            if (subtag.isEmpty() || subtag.length() > 8 || !isAlphanumeric(subtag)) {
                throw new InvalidFormatException(FormatError.LANGUAGE_MALFORMED, raw);
            }
        }
        List<String> out = new ArrayList<>(subtags.length);
        int i = 0;

        String first = subtags[0].toLowerCase(Locale.ROOT);
        if (first.equals("x")) {
            parsePrivateUse(subtags, 0, out, raw);
            return new LanguageTag(String.join("-", out), null, null, null);
        }
        if (!isAlpha(first) || first.length() < 2 || first.length() > 3) {
            throw new InvalidFormatException(FormatError.LANGUAGE_BAD_PRIMARY_SUBTAG, raw);
        }
        out.add(first);
        i++;

        int extlangs = 0;
        while (i < subtags.length && subtags[i].length() == 3 && isAlpha(subtags[i]) && extlangs < 3) {
            out.add(subtags[i].toLowerCase(Locale.ROOT));
            extlangs++;
            i++;
        }

        String script = null;
        if (i < subtags.length && subtags[i].length() == 4 && isAlpha(subtags[i])) {
            String lower = subtags[i].toLowerCase(Locale.ROOT);
            script = Character.toUpperCase(lower.charAt(0)) + lower.substring(1);
            out.add(script);
            i++;
        }

        String region = null;
        if (i < subtags.length && isRegion(subtags[i])) {
            region = subtags[i].toUpperCase(Locale.ROOT);
            out.add(region);
            i++;
        }

        Set<String> seen = new HashSet<>();
        while (i < subtags.length && isVariant(subtags[i])) {
            String variant = subtags[i].toLowerCase(Locale.ROOT);
            if (!seen.add(variant)) {
                throw new InvalidFormatException(FormatError.LANGUAGE_DUPLICATE_SUBTAG, raw);
            }
            out.add(variant);
            i++;
        }

        Set<String> singletons = new HashSet<>();
        while (i < subtags.length && subtags[i].length() == 1 && !subtags[i].equalsIgnoreCase("x")) {
            String singleton = subtags[i].toLowerCase(Locale.ROOT);
            if (!singletons.add(singleton)) {
                throw new InvalidFormatException(FormatError.LANGUAGE_DUPLICATE_SUBTAG, raw);
            }
            out.add(singleton);
            i++;
            int start = i;
            while (i < subtags.length && subtags[i].length() >= 2) {
                out.add(subtags[i].toLowerCase(Locale.ROOT));
                i++;
            }
            if (i == start) {
                throw new InvalidFormatException(FormatError.LANGUAGE_MALFORMED, raw);
            }
        }

        if (i < subtags.length) {
            if (!subtags[i].equalsIgnoreCase("x")) {
                throw new InvalidFormatException(FormatError.LANGUAGE_MALFORMED, raw);
            }
            parsePrivateUse(subtags, i, out, raw);
        }
        return new LanguageTag(String.join("-", out), first, script, region);
    }

    /** Returns {@code true} if {@code raw} parses. */
    public static boolean isValid(String raw) {
        try {
            parse(raw);
            return true;
        } catch (InvalidFormatException e) {
            return false;
        }
    }

    private static void parsePrivateUse(String[] subtags, int start, List<String> out, String raw) {
        if (start + 1 >= subtags.length) {
            throw new InvalidFormatException(FormatError.LANGUAGE_MALFORMED, raw);
        }
        for (int i = start; i < subtags.length; i++) {
            out.add(subtags[i].toLowerCase(Locale.ROOT));
        }
    }

    private static boolean isRegion(String subtag) {
        return (subtag.length() == 2 && isAlpha(subtag))
                || (subtag.length() == 3 && subtag.chars().allMatch(c -> c >= '0' && c <= '9'));
    }

    private static boolean isVariant(String subtag) {
        return subtag.length() >= 5 || (subtag.length() == 4 && Character.isDigit(subtag.charAt(0)));
    }

    private static boolean isAlpha(String s) {
        return s.chars().allMatch(c -> (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z'));
    }

    private static boolean isAlphanumeric(String s) {
        return s.chars().allMatch(c -> (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9'));
    }

    /** The primary language subtag, or empty for a private-use-only tag. */
    public Optional<String> language() {
        return Optional.ofNullable(language);
    }

    /** The script subtag in title case, if present. */
    public Optional<String> script() {
        return Optional.ofNullable(script);
    }

    /** The region subtag in upper case, if present. */
    public Optional<String> region() {
        return Optional.ofNullable(region);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LanguageTag other && canonical.equals(other.canonical);
    }

    @Override
    public int hashCode() {
        return canonical.hashCode();
    }

    @Override
    public String toString() {
        return canonical;
    }
}
