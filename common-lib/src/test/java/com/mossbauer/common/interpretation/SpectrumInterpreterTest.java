package com.mossbauer.common.interpretation;

import com.mossbauer.common.lineshape.LineShape;
import com.mossbauer.common.model.FitResult;
import com.mossbauer.common.model.Site;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class SpectrumInterpreterTest {

    private static final FitResult RESULT = new FitResult(
        List.of(
            Site.doublet(0.35, 0.70, 0.30, 60.0, "Fe³⁺ high-spin (octahedral)"),
            Site.doublet(1.15, 2.60, 0.32, 40.0, "Fe²⁺ high-spin (octahedral)")),
        210.0, 1.05, 213, 13, "", LineShape.LORENTZIAN, null, null);

    private static InterpreterContext context(String apiKey, TextCompletionClient client) {
        return new InterpreterContext(apiKey, client, 300, 0.4, Duration.ofMillis(200));
    }

    // ── rule-based path ───────────────────────────────────────────────────

    @Nested
    @DisplayName("rule-based path")
    class RuleBasedTests {

        @Test
        @DisplayName("no credential → rule-based text, client never called")
        void noCredential() {
            AtomicInteger calls = new AtomicInteger();
            TextCompletionClient client = (key, prompt, tokens, temperature) -> {
                calls.incrementAndGet();
                return Mono.just("should not be used");
            };
            SpectrumInterpreter interpreter = new SpectrumInterpreter(context(null, client));

            StepVerifier.create(interpreter.interpret(RESULT))
                .assertNext(i -> {
                    assertEquals(InterpretationPath.RULE_BASED, i.path());
                    assertEquals(SpectrumInterpreter.NO_CREDENTIAL, i.fallbackReason());
                    assertEquals(RuleBasedInterpreter.summarize(RESULT), i.text());
                })
                .verifyComplete();
            assertEquals(0, calls.get());
        }

        @Test
        @DisplayName("blank credential counts as missing")
        void blankCredential() {
            SpectrumInterpreter interpreter = new SpectrumInterpreter(context("   ", (k, p, t, temp) -> Mono.just("x")));
            StepVerifier.create(interpreter.interpret(RESULT))
                .assertNext(i -> assertEquals(InterpretationPath.RULE_BASED, i.path()))
                .verifyComplete();
        }

        @Test
        @DisplayName("rule-based text lists every site and the fit quality")
        void summaryContent() {
            String text = RuleBasedInterpreter.summarize(RESULT);
            assertTrue(text.contains("Site 1"), text);
            assertTrue(text.contains("Site 2"), text);
            assertTrue(text.contains("Fe³⁺ high-spin (octahedral)"), text);
            assertTrue(text.contains("Fe²⁺ high-spin (octahedral)"), text);
            assertTrue(text.contains("excellent"), text);
        }

        @Test
        @DisplayName("out-of-table site is reported as Unknown")
        void unknownSite() {
            FitResult odd = new FitResult(List.of(Site.doublet(2.5, 0.1, 0.3, 100.0, "Unknown")),
                10.0, 5.0, 20, 7, "", LineShape.VOIGT, null, null);
            String text = RuleBasedInterpreter.summarize(odd);
            assertTrue(text.contains("Unknown"), text);
            assertTrue(text.contains(RuleBasedInterpreter.OUT_OF_RANGE), text);
            assertTrue(text.contains("moderate"), text);
        }

        @Test
        @DisplayName("deterministic for the same input")
        void deterministic() {
            assertEquals(RuleBasedInterpreter.summarize(RESULT), RuleBasedInterpreter.summarize(RESULT));
        }
    }

    // ── AI path ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("AI path")
    class AiTests {

        @Test
        @DisplayName("successful completion is returned trimmed")
        void success() {
            AtomicReference<String> seenPrompt = new AtomicReference<>();
            TextCompletionClient client = (key, prompt, tokens, temperature) -> {
                assertEquals("sk-test", key);
                assertEquals(300, tokens);
                assertEquals(0.4, temperature, 0.0);
                seenPrompt.set(prompt);
                return Mono.just("  Two iron sites are present.  \n");
            };
            StepVerifier.create(new SpectrumInterpreter(context("sk-test", client)).interpret(RESULT))
                .assertNext(i -> {
                    assertEquals(InterpretationPath.AI_ATTEMPT, i.path());
                    assertEquals("Two iron sites are present.", i.text());
                    assertNull(i.fallbackReason());
                })
                .verifyComplete();
            assertTrue(seenPrompt.get().contains("IS=0.350"), seenPrompt.get());
            assertTrue(seenPrompt.get().contains("reduced chi-square"), seenPrompt.get());
        }

        @Test
        @DisplayName("client error → rule-based fallback, error not propagated")
        void clientError() {
            TextCompletionClient client = (k, p, t, temp) -> Mono.error(new IllegalStateException("503 from upstream"));
            StepVerifier.create(new SpectrumInterpreter(context("sk-test", client)).interpret(RESULT))
                .assertNext(i -> {
                    assertEquals(InterpretationPath.RULE_BASED, i.path());
                    assertTrue(i.fallbackReason().contains("503 from upstream"), i.fallbackReason());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("client throwing synchronously is handled the same way")
        void clientThrows() {
            TextCompletionClient client = (k, p, t, temp) -> {
                throw new IllegalArgumentException("bad key");
            };
            StepVerifier.create(new SpectrumInterpreter(context("sk-test", client)).interpret(RESULT))
                .assertNext(i -> assertEquals(InterpretationPath.RULE_BASED, i.path()))
                .verifyComplete();
        }

        @Test
        @DisplayName("timeout → rule-based fallback")
        void timeout() {
            TextCompletionClient client = (k, p, t, temp) -> Mono.never();
            StepVerifier.create(new SpectrumInterpreter(context("sk-test", client)).interpret(RESULT))
                .assertNext(i -> {
                    assertEquals(InterpretationPath.RULE_BASED, i.path());
                    assertTrue(i.fallbackReason().contains("timed out"), i.fallbackReason());
                })
                .expectComplete()
                .verify(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("blank or empty response → rule-based fallback")
        void emptyResponse() {
            for (Mono<String> response : List.of(Mono.just("   "), Mono.<String>empty())) {
                TextCompletionClient client = (k, p, t, temp) -> response;
                StepVerifier.create(new SpectrumInterpreter(context("sk-test", client)).interpret(RESULT))
                    .assertNext(i -> assertEquals(SpectrumInterpreter.EMPTY_RESPONSE, i.fallbackReason()))
                    .verifyComplete();
            }
        }

        @Test
        @DisplayName("AI path is attempted exactly once")
        void noRetry() {
            AtomicInteger calls = new AtomicInteger();
            TextCompletionClient client = (k, p, t, temp) -> {
                calls.incrementAndGet();
                return Mono.error(new RuntimeException("boom"));
            };
            StepVerifier.create(new SpectrumInterpreter(context("sk-test", client)).interpret(RESULT))
                .expectNextCount(1)
                .verifyComplete();
            assertEquals(1, calls.get());
        }

        @Test
        @DisplayName("withCredential enables the AI path without touching the original")
        void perRequestCredential() {
            SpectrumInterpreter shared = new SpectrumInterpreter(context(null, (k, p, t, temp) -> Mono.just("ok " + k)));
            StepVerifier.create(shared.withCredential("sk-user").interpret(RESULT))
                .assertNext(i -> assertEquals("ok sk-user", i.text()))
                .verifyComplete();
            assertFalse(shared.context().hasCredential());
            assertSame(shared, shared.withCredential(" "));
        }
    }

    @Test
    @DisplayName("fit quality thresholds")
    void fitQuality() {
        assertEquals(FitQuality.EXCELLENT, FitQuality.of(1.49));
        assertEquals(FitQuality.GOOD, FitQuality.of(1.5));
        assertEquals(FitQuality.GOOD, FitQuality.of(2.99));
        assertEquals(FitQuality.MODERATE, FitQuality.of(3.0));
    }

    @Test
    @DisplayName("context toString never prints the credential")
    void credentialMasked() {
        assertFalse(context("sk-secret", null).toString().contains("sk-secret"));
    }
}
