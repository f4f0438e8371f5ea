package co.fanki.codemap.analysis.domain;

import co.fanki.codemap.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives search keywords from a free-text question about a project.
 *
 * <p>Keeps the identifier-shaped words of the question that are longer
 * than two characters and are not common English filler words. When every
 * word is filtered out, the first three words are used instead so that a
 * short question still searches for something.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class KeywordExtractor {

    /**
     * Matches identifier-shaped words: an ASCII letter or underscore, then
     * any Unicode word characters, so {@code naïve} stays one word.
     */
    private static final Pattern WORD_PATTERN = Pattern.compile(
            "[a-zA-Z_]\\w*", Pattern.UNICODE_CHARACTER_CLASS);

    private static final int MIN_LENGTH = 3;

    private static final int FALLBACK_COUNT = 3;

    private static final Set<String> STOP_WORDS = Set.of(
            "how", "does", "do", "the", "what", "is", "a", "an", "in",
            "of", "to", "and", "or", "if", "this", "that", "work",
            "works", "about", "can", "i", "it", "when", "where", "why",
            "which", "are", "was", "be", "has", "have", "will", "would",
            "could", "should", "my", "me", "for", "with", "on", "at",
            "from", "by", "not", "but", "all", "any", "each", "every");

    private KeywordExtractor() {
    }

    /**
     * Extracts the keywords of a question.
     *
     * @param question the question text
     * @return the keywords in question order, possibly with repeats
     */
    public static List<String> extract(final String question) {
        Preconditions.requireNonNull(question, "Question is required");

        final List<String> words = new ArrayList<>();
        final Matcher matcher = WORD_PATTERN.matcher(
                question.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            words.add(matcher.group());
        }

        final List<String> keywords = new ArrayList<>();
        for (final String word : words) {
            if (!STOP_WORDS.contains(word)
                    && word.codePointCount(0, word.length()) >= MIN_LENGTH) {
                keywords.add(word);
            }
        }

        if (keywords.isEmpty()) {
            return List.copyOf(words.subList(0,
                    Math.min(FALLBACK_COUNT, words.size())));
        }
        return List.copyOf(keywords);
    }

}
