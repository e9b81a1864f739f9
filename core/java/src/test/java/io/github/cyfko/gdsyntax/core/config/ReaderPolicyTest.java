package io.github.cyfko.gdsyntax.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ReaderPolicy} presets, builder and validation.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("ReaderPolicy Tests")
class ReaderPolicyTest {

    @Nested
    @DisplayName("Presets")
    class Presets {

        @Test
        @DisplayName("Default policy limits")
        void testDefaults() {
            ReaderPolicy policy = ReaderPolicy.defaults();

            assertEquals(ReaderPolicy.PolicyName.DEFAULT_POLICY.name(), policy.policyName());
            assertEquals(1_000_000, policy.maxContentLength());
            assertEquals(1024, policy.maxReadingDepth());
            assertEquals(4, policy.tabWidth());
        }

        @Test
        @DisplayName("Strict policy is tighter than defaults")
        void testStrict() {
            ReaderPolicy strict = ReaderPolicy.strict();
            ReaderPolicy defaults = ReaderPolicy.defaults();

            assertEquals(ReaderPolicy.PolicyName.STRICT_POLICY.name(), strict.policyName());
            assertTrue(strict.maxContentLength() < defaults.maxContentLength());
            assertTrue(strict.maxReadingDepth() < defaults.maxReadingDepth());
        }

        @Test
        @DisplayName("Relaxed policy is looser than defaults")
        void testRelaxed() {
            ReaderPolicy relaxed = ReaderPolicy.relaxed();
            ReaderPolicy defaults = ReaderPolicy.defaults();

            assertEquals(ReaderPolicy.PolicyName.RELAXED_POLICY.name(), relaxed.policyName());
            assertTrue(relaxed.maxContentLength() > defaults.maxContentLength());
            assertTrue(relaxed.maxReadingDepth() > defaults.maxReadingDepth());
        }
    }

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        @DisplayName("Builder starts from default limits with a custom name")
        void testBuilderDefaults() {
            ReaderPolicy policy = ReaderPolicy.builder().build();

            assertEquals(ReaderPolicy.PolicyName.CUSTOM_POLICY.name(), policy.policyName());
            assertEquals(ReaderPolicy.defaults().maxContentLength(), policy.maxContentLength());
            assertEquals(ReaderPolicy.defaults().maxReadingDepth(), policy.maxReadingDepth());
            assertEquals(ReaderPolicy.defaults().tabWidth(), policy.tabWidth());
        }

        @Test
        @DisplayName("Builder overrides every limit")
        void testBuilderOverrides() {
            ReaderPolicy policy = ReaderPolicy.builder()
                    .policyName("editor")
                    .maxContentLength(500)
                    .maxReadingDepth(64)
                    .tabWidth(8)
                    .build();

            assertEquals("editor", policy.policyName());
            assertEquals(500, policy.maxContentLength());
            assertEquals(64, policy.maxReadingDepth());
            assertEquals(8, policy.tabWidth());
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @ParameterizedTest
        @ValueSource(ints = {0, -1, -1000})
        @DisplayName("Non-positive content length is rejected")
        void testInvalidContentLength(int length) {
            IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                    () -> ReaderPolicy.builder().maxContentLength(length).build());

            assertTrue(exception.getMessage().contains("maxContentLength must be positive"));
        }

        @ParameterizedTest
        @ValueSource(ints = {0, 1, 7})
        @DisplayName("Reading depth below 8 is rejected")
        void testInvalidReadingDepth(int depth) {
            IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
                    () -> ReaderPolicy.builder().maxReadingDepth(depth).build());

            assertTrue(exception.getMessage().contains("maxReadingDepth must be at least 8"));
        }

        @Test
        @DisplayName("Non-positive tab width is rejected")
        void testInvalidTabWidth() {
            assertThrows(IllegalArgumentException.class, () -> ReaderPolicy.builder().tabWidth(0).build());
        }

        @Test
        @DisplayName("Blank policy name is rejected")
        void testBlankName() {
            assertThrows(IllegalArgumentException.class, () -> ReaderPolicy.builder().policyName(" ").build());
            assertThrows(IllegalArgumentException.class, () -> new ReaderPolicy(null, 10, 10, 4));
        }
    }
}
