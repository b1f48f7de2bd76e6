package webagent.decision;

import org.testng.annotations.Test;
import webagent.action.Action;
import webagent.action.ClickAction;
import webagent.action.HoverAction;
import webagent.action.IdleAction;
import webagent.action.NavigateAction;
import webagent.action.ScrollAction;
import webagent.action.SelectAction;
import webagent.action.SubmitAction;
import webagent.action.TypeAction;
import webagent.action.WaitAction;
import webagent.model.Candidate;
import webagent.model.Selector;
import webagent.model.SelectorKind;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link ActionNormalizer}: alias resolution, candidate binding
 * and the per-intent construction rules.
 */
public class ActionNormalizerTest {

    private static final Selector EMAIL = Selector.attributeValue("id", "email");
    private static final Selector LOGIN = Selector.attributeValue("id", "login");
    private static final Selector COUNTRY = Selector.attributeValue("name", "country");

    private static final List<Candidate> CANDIDATES = List.of(
            new Candidate(0, "input", "", "", EMAIL, Map.of(), "form", List.of()),
            new Candidate(1, "button", "Log in", "", LOGIN, Map.of(), "form", List.of()),
            new Candidate(2, "select", "Country", "", COUNTRY, Map.of("name", "country"), "form",
                    List.of("Canada", "Mexico")));

    private final ActionNormalizer normalizer = new ActionNormalizer();

    private static Map<String, Object> decision(Object... kv) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            map.put((String) kv[i], kv[i + 1]);
        }
        return map;
    }

    private Optional<Action> normalize(Object... kv) {
        return normalizer.normalize(decision(kv), CANDIDATES);
    }

    // ── Click ─────────────────────────────────────────────────────────────

    @Test
    public void click_boundToCandidate() {
        assertThat(normalize("action", "ClickAction", "candidate_id", 1))
                .contains(new ClickAction(LOGIN));
    }

    @Test
    public void click_candidateIdAsNumericString() {
        assertThat(normalize("type", "click", "candidate_id", " 1 ")).contains(new ClickAction(LOGIN));
    }

    @Test
    public void click_inlineSelectorWhenNoCandidate() {
        Optional<Action> action = normalize("action", "click",
                "selector", Map.of("type", "xpathSelector", "value", " //a[@id='go'] "));

        assertThat(action).isPresent();
        Selector s = ((ClickAction) action.get()).selector();
        assertThat(s.getKind()).isEqualTo(SelectorKind.XPATH);
        assertThat(s.getAttribute()).isEqualTo("xpath");
        assertThat(s.getValue()).isEqualTo("//a[@id='go']");
    }

    @Test
    public void click_inlineSelectorDefaultsToIdAttribute() {
        Optional<Action> action = normalize("action", "click",
                "selector", Map.of("value", "go", "case_sensitive", true));

        assertThat(action).contains(new ClickAction(
                new Selector(SelectorKind.ATTRIBUTE_VALUE, "id", "go", true)));
    }

    @Test
    public void click_candidateWinsOverInlineSelector() {
        assertThat(normalize("action", "click", "candidate_id", 0, "selector", Map.of("value", "other")))
                .contains(new ClickAction(EMAIL));
    }

    @Test
    public void click_withoutAnySelector_isNone() {
        assertThat(normalize("action", "click")).isEmpty();
        assertThat(normalize("action", "click", "selector", Map.of("value", "  "))).isEmpty();
        assertThat(normalize("action", "click", "selector", "not-an-object")).isEmpty();
    }

    // ── Candidate binding ─────────────────────────────────────────────────

    @Test
    public void outOfRangeOrNonNumericCandidateId_neverBinds() {
        for (Object id : new Object[]{-1, 3, 99, "abc", "", 1.5, true, Map.of()}) {
            assertThat(normalize("action", "click", "candidate_id", id)).as("id %s", id).isEmpty();
            assertThat(normalize("action", "type", "candidate_id", id, "text", "x")).as("id %s", id).isEmpty();
            assertThat(normalize("action", "submit", "candidate_id", id)).as("id %s", id).isEmpty();
            assertThat(normalize("action", "hover", "candidate_id", id)).as("id %s", id).isEmpty();
        }
    }

    @Test
    public void emptyCandidateList_neverBinds() {
        assertThat(normalizer.normalize(decision("action", "click", "candidate_id", 0), List.of())).isEmpty();
    }

    // ── Type / select ─────────────────────────────────────────────────────

    @Test
    public void type_emptyTextClearsField() {
        assertThat(normalize("action", "type", "candidate_id", 0, "text", ""))
                .contains(new TypeAction(EMAIL, ""));
    }

    @Test
    public void type_valueFieldAndMissingText() {
        assertThat(normalize("action", "fill", "candidate_id", 0, "value", "me@example.com"))
                .contains(new TypeAction(EMAIL, "me@example.com"));
        assertThat(normalize("action", "type", "candidate_id", 0))
                .contains(new TypeAction(EMAIL, ""));
    }

    @Test
    public void type_numericTextRenderedAsString() {
        assertThat(normalize("action", "type", "candidate_id", 0, "text", 42))
                .contains(new TypeAction(EMAIL, "42"));
    }

    @Test
    public void select_requiresOptionText() {
        assertThat(normalize("action", "SelectDropDownOptionAction", "candidate_id", 2, "text", "Canada"))
                .contains(new SelectAction(COUNTRY, "Canada"));
        assertThat(normalize("action", "select", "candidate_id", 2, "option", "Mexico"))
                .contains(new SelectAction(COUNTRY, "Mexico"));
        assertThat(normalize("action", "select", "candidate_id", 2, "text", "")).isEmpty();
        assertThat(normalize("action", "select", "candidate_id", 2)).isEmpty();
        assertThat(normalize("action", "select", "text", "Canada")).isEmpty();
    }

    // ── Navigate / scroll / wait / idle ───────────────────────────────────

    @Test
    public void navigate_requiresUrl_ignoresCandidate() {
        assertThat(normalize("action", "goto", "url", " https://example.com/ ", "candidate_id", 1))
                .contains(new NavigateAction("https://example.com/"));
        assertThat(normalize("action", "navigate", "url", "   ")).isEmpty();
        assertThat(normalize("action", "navigate")).isEmpty();
    }

    @Test
    public void scroll_directionFromFieldOrIntent() {
        assertThat(normalize("action", "scroll")).contains(ScrollAction.of(true));
        assertThat(normalize("action", "scroll", "direction", " UP ")).contains(ScrollAction.of(false));
        assertThat(normalize("action", "scrollup")).contains(ScrollAction.of(false));
        assertThat(normalize("action", "scrolldown")).contains(ScrollAction.of(true));
        assertThat(normalize("action", "scrolldown", "direction", "up")).contains(ScrollAction.of(false));
        assertThat(normalize("action", "scroll", "direction", "sideways")).contains(ScrollAction.of(true));
    }

    @Test
    public void wait_secondsFromAnyFieldDefaultingToOne() {
        assertThat(normalize("action", "wait", "seconds", 2.5)).contains(new WaitAction(2.5));
        assertThat(normalize("action", "sleep", "time", "3")).contains(new WaitAction(3.0));
        assertThat(normalize("action", "WaitAction", "time_seconds", 4)).contains(new WaitAction(4.0));
        assertThat(normalize("action", "wait", "seconds", "soon")).contains(new WaitAction(1.0));
        assertThat(normalize("action", "pause")).contains(new WaitAction(1.0));
        assertThat(normalize("action", "wait", "seconds", -5)).contains(new WaitAction(0.0));
    }

    @Test
    public void idle_alwaysSucceeds() {
        assertThat(normalize("action", "done")).contains(new IdleAction());
        assertThat(normalize("action", "complete", "candidate_id", 77)).contains(new IdleAction());
    }

    @Test
    public void submitAndHover_requireCandidate() {
        assertThat(normalize("action", "submit", "candidate_id", 1)).contains(new SubmitAction(LOGIN));
        assertThat(normalize("action", "HoverAction", "candidate_id", "1")).contains(new HoverAction(LOGIN));
        assertThat(normalize("action", "submit")).isEmpty();
    }

    // ── Unknown / missing ─────────────────────────────────────────────────

    @Test
    public void unknownAction_isReportedAndNone() {
        NormalizationResult result = normalizer.resolve(Decision.of(decision("action", "frobnicate")), CANDIDATES);

        assertThat(result.outcome()).isEqualTo(NormalizationResult.Outcome.UNKNOWN_ACTION);
        assertThat(result.detail()).contains("frobnicate");
        assertThat(result.toOptional()).isEmpty();
    }

    @Test
    public void missingAction_isNone() {
        assertThat(normalizer.resolve(Decision.of(decision("candidate_id", 1)), CANDIDATES).outcome())
                .isEqualTo(NormalizationResult.Outcome.MISSING_ACTION);
        assertThat(normalize("action", "   ")).isEmpty();
        assertThat(normalize("action", Map.of("name", "click"))).isEmpty();
    }

    @Test
    public void typeFieldAcceptedAsActionName() {
        assertThat(normalize("type", "hover", "candidate_id", 0)).contains(new HoverAction(EMAIL));
    }

    @Test
    public void unresolved_reportsIntent() {
        NormalizationResult result = normalizer.resolve(
                Decision.of(decision("action", "type", "candidate_id", 9)), CANDIDATES);

        assertThat(result.outcome()).isEqualTo(NormalizationResult.Outcome.UNRESOLVED);
        assertThat(result.intent()).isEqualTo(Intent.TYPE);
        assertThat(result.isBuilt()).isFalse();
    }

    @Test
    public void nullArguments_throw() {
        assertThatThrownBy(() -> normalizer.normalize(decision("action", "idle"), null))
                .isInstanceOf(NullPointerException.class);
    }
}
