package in.the13th.intel.service.scoring;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.the13th.intel.config.RuleConfig;
import in.the13th.intel.domain.event.Event;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EventScorerTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final double EPS = 1e-9;

    private final EventScorer scorer = new EventScorer();
    private final RuleConfig defaults = new RuleConfig(0.8);

    private static Event event(String action, String payloadJson) throws Exception {
        JsonNode payload = payloadJson == null ? null : MAPPER.readTree(payloadJson);
        return new Event(1L, "u1", action, payload, 1_700_000_000.0, false);
    }

    @Test
    @DisplayName("lead_hot with empty payload scores 0.95 and triggers")
    void leadHotTriggers() throws Exception {
        double score = scorer.score(event("lead_hot", "{}"));

        assertEquals(0.95, score, EPS);
        assertTrue(scorer.shouldTrigger(score, defaults));
    }

    @Test
    @DisplayName("login scores 0.1 and does not trigger")
    void loginDoesNotTrigger() throws Exception {
        double score = scorer.score(event("login", null));

        assertEquals(0.1, score, EPS);
        assertFalse(scorer.shouldTrigger(score, defaults));
    }

    @Test
    @DisplayName("api_error with value 100 gets the capped value boost but stays below 0.8")
    void apiErrorWithValue() throws Exception {
        double score = scorer.score(event("api_error", "{\"value\": 100}"));

        assertEquals(0.65, score, EPS);
        assertFalse(scorer.shouldTrigger(score, defaults));
    }

    @Test
    void unknownActionUsesDefaultBase() throws Exception {
        assertEquals(0.2, scorer.score(event("something_new", "{}")), EPS);
    }

    @Test
    void smallValueBoostIsUncapped() throws Exception {
        double score = scorer.score(event("signup", "{\"value\": 1}"));

        assertEquals(0.3 + Math.log1p(1) / 10.0, score, EPS);
    }

    @Test
    void priorityAndSuspectedBoostsAdd() throws Exception {
        double score = scorer.score(event("api_error", "{\"priority\": \"high\", \"suspected\": true}"));

        assertEquals(0.4 + 0.15 + 0.20, score, EPS);
    }

    @Test
    void priorityMatchIsExact() throws Exception {
        assertEquals(0.4, scorer.score(event("api_error", "{\"priority\": \"HIGH\"}")), EPS);
        assertEquals(0.4, scorer.score(event("api_error", "{\"suspected\": \"true\"}")), EPS);
    }

    @Test
    void occurrenceBoostStartsAboveOneAndIsCapped() throws Exception {
        assertEquals(0.1, scorer.score(event("login", "{\"occurrences\": 1}")), EPS);
        assertEquals(0.1 + 0.15, scorer.score(event("login", "{\"occurrences\": 3}")), EPS);
        assertEquals(0.1 + 0.25, scorer.score(event("login", "{\"occurrences\": 40}")), EPS);
    }

    @Test
    @DisplayName("Wrongly typed payload fields are ignored")
    void wrongTypesIgnored() throws Exception {
        double score = scorer.score(event("login",
            "{\"value\": \"100\", \"occurrences\": 2.5, \"extra\": [1, 2]}"));

        assertEquals(0.1, score, EPS);
    }

    @Test
    void negativeValues() throws Exception {
        assertEquals(0.4 + Math.log1p(-0.5) / 10.0, scorer.score(event("api_error", "{\"value\": -0.5}")), EPS);
        // log1p is -inf at -1 and NaN below it: no boost
        assertEquals(0.4, scorer.score(event("api_error", "{\"value\": -1}")), EPS);
        assertEquals(0.4, scorer.score(event("api_error", "{\"value\": -5}")), EPS);
    }

    @Test
    @DisplayName("Score is clamped to 1.0")
    void clampedToOne() throws Exception {
        double score = scorer.score(event("lead_hot",
            "{\"value\": 1000000, \"priority\": \"high\", \"suspected\": true, \"occurrences\": 9}"));

        assertEquals(1.0, score, EPS);
    }

    @Test
    void scoreIsDeterministic() throws Exception {
        Event e = event("billing_failure", "{\"value\": 42, \"occurrences\": 2}");

        assertEquals(scorer.score(e), scorer.score(e));
    }

    @Test
    void nonObjectPayloadRaisesScoringException() throws Exception {
        assertThrows(ScoringException.class, () -> scorer.score(event("login", "[1, 2, 3]")));
        assertThrows(ScoringException.class, () -> scorer.score(event("login", "\"text\"")));
    }

    @Test
    void thresholdIsInclusive() {
        assertTrue(scorer.shouldTrigger(0.8, defaults));
        assertFalse(scorer.shouldTrigger(0.7999, defaults));
        assertTrue(scorer.shouldTrigger(0.0, new RuleConfig(0.0)));
    }
}
