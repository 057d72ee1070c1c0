package net.luminalib.support.prompt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import net.luminalib.domain.review.Review;
import net.luminalib.testutil.LibraryTestData;
import org.junit.jupiter.api.Test;

class PromptTemplatesTest {

    @Test
    void should_RegisterBothPipelineTemplates() {
        assertThat(PromptTemplates.all()).containsOnlyKeys("summarize_book", "analyze_reviews");
        assertThat(PromptTemplates.get("summarize_book").maxOutputTokens()).isEqualTo(1024);
        assertThat(PromptTemplates.get("analyze_reviews").inputTokenCap()).isEqualTo(3000);
    }

    @Test
    void should_Throw_When_TemplateNameUnknown() {
        assertThatThrownBy(() -> PromptTemplates.get("missing"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("summarize_book");
    }

    @Test
    void should_RenderDeterministically_When_InputsAreEqual() {
        RenderedPrompt first = PromptTemplates.renderBookSummary("Chapter one. The storm arrives.");
        RenderedPrompt second = PromptTemplates.renderBookSummary("Chapter one. The storm arrives.");

        assertThat(first).isEqualTo(second);
        assertThat(first.fingerprint()).isEqualTo(second.fingerprint()).hasSize(64);
        assertThat(first.userMessage()).contains("Chapter one. The storm arrives.");
        assertThat(first.templateVersion()).isEqualTo("1.2.0");
    }

    @Test
    void should_TruncateBookContent_When_AboveInputCap() {
        String content = "x".repeat(20_000);

        RenderedPrompt prompt = PromptTemplates.renderBookSummary(content);

        assertThat(prompt.userMessage()).contains(TokenBudget.TRUNCATION_MARKER.trim());
        assertThat(prompt.userMessage()).doesNotContain("x".repeat(16_001));
    }

    @Test
    void should_FormatReviewsWithRatingMarkers() {
        UUID bookId = UUID.randomUUID();
        List<Review> reviews = List.of(
            LibraryTestData.review(bookId, 5, "Loved it"),
            LibraryTestData.review(bookId, 2, "Too slow"));

        RenderedPrompt prompt = PromptTemplates.renderReviewConsensus(reviews, null);

        assertThat(prompt.userMessage())
            .contains("[Rating: 5/5]\nLoved it\n\n[Rating: 2/5]\nToo slow")
            .doesNotContain("PREVIOUS CONSENSUS");
    }

    @Test
    void should_FramePreviousConsensusAsUpdate_When_Present() {
        UUID bookId = UUID.randomUUID();

        RenderedPrompt prompt = PromptTemplates.renderReviewConsensus(
            List.of(LibraryTestData.review(bookId, 4, "Solid")), "Readers liked it.");

        assertThat(prompt.userMessage())
            .startsWith("--- PREVIOUS CONSENSUS (START) ---\nReaders liked it.")
            .contains("Update the consensus above");
    }

    @Test
    void should_CopyBracesFromValuesVerbatim() {
        PromptTemplate template = new PromptTemplate("t", "1", "sys", "A {a} B {b}", 10, 10, List.of());

        RenderedPrompt prompt = template.render(Map.of("a", "{b}", "b", "$1"));

        assertThat(prompt.userMessage()).isEqualTo("A {b} B $1");
    }

    @Test
    void should_ThrowMissingPlaceholder_When_InputAbsent() {
        PromptTemplate template = new PromptTemplate("t", "1", "sys", "Hello {name}", 10, 10, List.of());

        assertThatThrownBy(() -> template.render(Map.of()))
            .isInstanceOf(MissingPlaceholderException.class)
            .satisfies(failure -> assertThat(((MissingPlaceholderException) failure).getPlaceholder()).isEqualTo("name"));
        assertThat(template.placeholders()).containsExactly("name");
    }
}
