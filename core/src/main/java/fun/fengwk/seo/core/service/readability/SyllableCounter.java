package fun.fengwk.seo.core.service.readability;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Vowel-group syllable heuristic.
 *
 * @author fengwk
 */
public class SyllableCounter {

    private static final Pattern NON_LETTER = Pattern.compile("[^a-z]");
    private static final Pattern NON_LETTER_UNICODE = Pattern.compile("[^\\p{L}]");
    private static final Pattern ENGLISH_VOWEL_GROUP = Pattern.compile("[aeiouy]{1,3}");
    private static final Pattern VOWEL = Pattern.compile("[aeiouyàáâäãåèéêëìíîïòóôöõùúûüæœ]");

    public int count(String word, String language) {
        if (word == null) {
            return 0;
        }
        if ("en".equals(language)) {
            return countEnglish(word);
        }
        String letters = NON_LETTER_UNICODE.matcher(word.toLowerCase(Locale.ROOT)).replaceAll("");
        if (letters.isEmpty()) {
            return 0;
        }
        return Math.max(1, countMatches(VOWEL.matcher(letters)));
    }

    private int countEnglish(String word) {
        String letters = NON_LETTER.matcher(word.toLowerCase(Locale.ROOT)).replaceAll("");
        if (letters.isEmpty()) {
            return 0;
        }
        if (letters.length() <= 3) {
            return 1;
        }
        String stem = letters;
        if (stem.endsWith("es") || stem.endsWith("ed")) {
            stem = stem.substring(0, stem.length() - 2);
        } else if (stem.endsWith("e")) {
            stem = stem.substring(0, stem.length() - 1);
        }
        return Math.max(1, countMatches(ENGLISH_VOWEL_GROUP.matcher(stem)));
    }

    private int countMatches(Matcher matcher) {
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

}
