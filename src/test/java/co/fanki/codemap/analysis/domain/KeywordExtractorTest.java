package co.fanki.codemap.analysis.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for KeywordExtractor.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class KeywordExtractorTest {

    @Test
    void whenExtracting_givenQuestion_shouldDropStopWordsAndShortWords() {
        assertEquals(List.of("order", "validation", "api"),
                KeywordExtractor.extract(
                        "How does the Order validation work in the API?"));
    }

    @Test
    void whenExtracting_givenIdentifiers_shouldKeepUnderscoresAndDigits() {
        assertEquals(List.of("charge_card", "v2_client"),
                KeywordExtractor.extract("where is charge_card in v2_client"));
    }

    @Test
    void whenExtracting_givenAccentedWords_shouldKeepThemWhole() {
        assertEquals(List.of("naïve", "bayes", "here", "función"),
                KeywordExtractor.extract("is naïve bayes here in función?"));
    }

    @Test
    void whenExtracting_givenOnlyStopWords_shouldFallBackToFirstThreeWords() {
        assertEquals(List.of("what", "is", "it"),
                KeywordExtractor.extract("What is it about?"));
    }

    @Test
    void whenExtracting_givenRepeatedWord_shouldKeepRepeats() {
        assertEquals(List.of("cache", "cache"),
                KeywordExtractor.extract("cache and cache"));
    }

    @Test
    void whenExtracting_givenNoWords_shouldReturnEmpty() {
        assertTrue(KeywordExtractor.extract("?? 42 !!").isEmpty());
    }

}
