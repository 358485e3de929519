package com.dubbi.statetrace.trace.rewrite;

import static com.dubbi.statetrace.trace.TraceFixtures.hash;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class TransitionReferenceNormalizerTest {

    private static final String H1 = hash('1');
    private static final String H2 = hash('2');
    private static final String H3 = hash('3');
    private static final Map<String, String> TRANSITIONS = Map.of("T1", H1, "T2", H2, "T3", H3);

    private static String normalize(String text) {
        return TransitionReferenceNormalizer.normalize(text, TRANSITIONS);
    }

    @Test
    void rewritesProseReferences() {
        assertThat(normalize("see transition T3 and (transition T1)"))
                .isEqualTo("see transition <" + H3 + "> and <" + H1 + ">");
    }

    @Test
    void rewritesWrappedForms() {
        assertThat(normalize("Answer: <T1>")).isEqualTo("Answer: <" + H1 + ">");
        assertThat(normalize("Answer: < 2 >")).isEqualTo("Answer: <" + H2 + ">");
        assertThat(normalize("pick (t3)")).isEqualTo("pick <" + H3 + ">");
        assertThat(normalize("pick [T2]")).isEqualTo("pick <" + H2 + ">");
    }

    @Test
    void rewritesTransitionIdKeyValueForms() {
        assertThat(normalize("<transition_id=2>")).isEqualTo("<" + H2 + ">");
        assertThat(normalize("chosen [transition_id: T3]")).isEqualTo("chosen <" + H3 + ">");
        assertThat(normalize("Transition_ID = 1")).isEqualTo("<" + H1 + ">");
    }

    @Test
    void rewritesWholeLineForms() {
        assertThat(normalize("Transition: T2")).isEqualTo("<" + H2 + ">");
        assertThat(normalize("Transition T1")).isEqualTo("<" + H1 + ">");
        assertThat(normalize("T3")).isEqualTo("<" + H3 + ">");
        assertThat(normalize("2")).isEqualTo("<" + H2 + ">");
    }

    @Test
    void unknownNumeralIsEchoedInTagSyntax() {
        assertThat(normalize("transition_id-7")).isEqualTo("<T7>");
        assertThat(normalize("(T42)")).isEqualTo("<T42>");
    }

    @Test
    void unrecognizedSpellingsAreLeftUntouched() {
        assertThat(normalize("Go to screen S3 now")).isEqualTo("Go to screen S3 now");
        assertThat(normalize("The answer is T2 probably")).isEqualTo("The answer is T2 probably");
    }

    @Test
    void eachLineIsHandledSeparately() {
        String text = "Step 1: tap login (T1)\nStep 2: open home (T2)";

        assertThat(normalize(text)).isEqualTo("Step 1: tap login <" + H1 + ">\nStep 2: open home <" + H2 + ">");
    }

    @Test
    void lineBreaksAroundReferencesArePreserved() {
        assertThat(normalize("pick <T1>\n\nnext")).isEqualTo("pick <" + H1 + ">\n\nnext");
        assertThat(normalize("step one\ntransition T2\n\ndone")).isEqualTo("step one\n<" + H2 + ">\n\ndone");
        assertThat(normalize("use transition T3")).isEqualTo("use <" + H3 + ">");
    }

    @Test
    void mapKeysAreMatchedCaseInsensitively() {
        String rewritten = TransitionReferenceNormalizer.normalize("(T1)", Map.of(" t1 ", H1));

        assertThat(rewritten).isEqualTo("<" + H1 + ">");
    }
}
