package ru.tigran.churnpredictor.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import ru.tigran.churnpredictor.dto.ChurnScore;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit-тесты для ChurnScoringEngine.
 * Проверяет порядок правил и границы диапазонов NLS score.
 */
@DisplayName("ChurnScoringEngine unit тесты")
class ChurnScoringEngineTest {

    private final ChurnScoringEngine engine = new ChurnScoringEngine();

    @Test
    @DisplayName("score - низкий NLS и негативное ключевое слово дают высокий риск")
    void lowRatingWithNegativeKeywordIsHighChurn() {
        ChurnScore score = engine.score(2, "This is really bad", SentimentAnalyzer.NEUTRAL);

        assertEquals(ChurnScoringEngine.HIGH_CHURN_PROBABILITY, score.probability());
        assertEquals("Low NLS score and/or negative feedback/sentiment.", score.reason());
    }

    @Test
    @DisplayName("score - NLS < 3 и негативная тональность без ключевых слов дают высокий риск")
    void veryLowRatingWithNegativeSentimentIsHighChurn() {
        ChurnScore score = engine.score(2, "This is fine, whatever.", SentimentAnalyzer.NEGATIVE);

        assertEquals(0.8, score.probability());
    }

    @Test
    @DisplayName("score - высокий NLS дает низкий риск")
    void highRatingIsLowChurn() {
        ChurnScore score = engine.score(9, "Great service!", SentimentAnalyzer.POSITIVE);

        assertEquals(0.1, score.probability());
        assertEquals("High NLS score.", score.reason());
    }

    @Test
    @DisplayName("score - NLS 5 с негативной тональностью остается умеренным риском")
    void boundaryRatingFiveIsModerate() {
        ChurnScore score = engine.score(5, "It was bad", SentimentAnalyzer.NEGATIVE);

        assertEquals(0.4, score.probability());
        assertEquals("Moderate NLS score or neutral feedback/sentiment.", score.reason());
    }

    @Test
    @DisplayName("score - NLS 4 без ключевых слов и с нейтральной тональностью дает умеренный риск")
    void lowRatingWithoutSignalsIsModerate() {
        assertEquals(0.4, engine.score(4, "It's just okay.", SentimentAnalyzer.NEUTRAL).probability());
    }

    @Test
    @DisplayName("score - NLS < 3 без сигналов и с тональностью UNKNOWN дает умеренный риск")
    void degradedSentimentDoesNotRaiseRisk() {
        assertEquals(0.4, engine.score(1, "Meh.", SentimentAnalyzer.UNKNOWN).probability());
    }

    @Test
    @DisplayName("score - правило высокого риска проверяется раньше правила высокого NLS")
    void highChurnRuleIsCheckedFirst() {
        // NLS 8 не подходит под правило высокого риска, поэтому срабатывает правило низкого
        assertEquals(0.1, engine.score(8, "terrible", SentimentAnalyzer.NEGATIVE).probability());
        assertEquals(0.8, engine.score(4, "terrible", SentimentAnalyzer.POSITIVE).probability());
    }

    @Test
    @DisplayName("score - тональность сравнивается без учета регистра")
    void sentimentComparisonIgnoresCase() {
        assertEquals(0.8, engine.score(0, "", "negative").probability());
    }

    @ParameterizedTest(name = "NLS {0}, \"{1}\" -> {3}")
    @CsvSource({
            "9, 'Excellent product, very happy!', POSITIVE, 0.1, High NLS score.",
            "2, terrible unhappy service, NEGATIVE, 0.8, Low NLS score and/or negative feedback/sentiment.",
            "6, The service was okay., NEUTRAL, 0.4, Moderate NLS score or neutral feedback/sentiment."
    })
    @DisplayName("score - типовые сценарии")
    void typicalScenarios(int rating, String text, String sentiment, double probability, String reason) {
        ChurnScore score = engine.score(rating, text, sentiment);

        assertEquals(probability, score.probability());
        assertEquals(reason, score.reason());
    }

    @Test
    @DisplayName("score - для всех NLS 0..10 результат совпадает с таблицей правил")
    void everyRatingMatchesRuleTable() {
        List<String> texts = List.of("", "fine", "bad", "Poor and TERRIBLE");
        List<String> sentiments = List.of("POSITIVE", "NEGATIVE", "NEUTRAL", "UNKNOWN");
        Set<Double> allowed = Set.of(0.1, 0.4, 0.8);

        for (int rating = 0; rating <= 10; rating++) {
            for (String text : texts) {
                for (String sentiment : sentiments) {
                    boolean keyword = !text.isEmpty() && !text.equals("fine");
                    double expected;
                    if ((rating < 5 && keyword) || (rating < 3 && sentiment.equals("NEGATIVE"))) {
                        expected = 0.8;
                    } else if (rating >= 8) {
                        expected = 0.1;
                    } else {
                        expected = 0.4;
                    }

                    double actual = engine.score(rating, text, sentiment).probability();
                    assertTrue(allowed.contains(actual));
                    assertEquals(expected, actual, "NLS " + rating + ", text '" + text + "', " + sentiment);
                }
            }
        }
    }

    @ParameterizedTest(name = "NLS {0}, текст \"{1}\", тональность {2} -> {3}")
    @CsvSource({
            "0, '', NEGATIVE, 0.8",
            "2, '', NEGATIVE, 0.8",
            "3, '', NEGATIVE, 0.4",
            "4, poor quality, NEUTRAL, 0.8",
            "5, poor quality, NEUTRAL, 0.4",
            "7, terrible, NEGATIVE, 0.4",
            "7, '', POSITIVE, 0.4",
            "8, '', NEUTRAL, 0.1",
            "10, unhappy, NEGATIVE, 0.1"
    })
    @DisplayName("score - границы правил")
    void ruleBoundaries(int rating, String text, String sentiment, double expected) {
        assertEquals(expected, engine.score(rating, text, sentiment).probability());
    }

    @ParameterizedTest
    @ValueSource(strings = {"BAD experience", "Poorly made", "TeRRible", "I'm unhappy", "badly packed"})
    @DisplayName("containsNegativeKeyword - поиск подстроки без учета регистра")
    void negativeKeywordMatchesSubstringIgnoringCase(String text) {
        assertTrue(ChurnScoringEngine.containsNegativeKeyword(text));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "Great!", "not so good"})
    @DisplayName("containsNegativeKeyword - текст без ключевых слов")
    void textWithoutKeywords(String text) {
        assertFalse(ChurnScoringEngine.containsNegativeKeyword(text));
    }

    @Test
    @DisplayName("containsNegativeKeyword - null не считается негативом")
    void nullTextHasNoKeyword() {
        assertFalse(ChurnScoringEngine.containsNegativeKeyword(null));
    }
}
