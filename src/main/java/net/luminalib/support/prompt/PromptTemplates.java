package net.luminalib.support.prompt;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import net.luminalib.domain.review.Review;

/**
 * Registry of the prompts used by the book intelligence pipeline.
 */
public final class PromptTemplates {

    public static final String CONTENT_KEY = "content";
    public static final String REVIEWS_KEY = "reviews_text";
    public static final String PREVIOUS_CONSENSUS_KEY = "previous_consensus_section";

    public static final PromptTemplate SUMMARIZE_BOOK = new PromptTemplate(
        "summarize_book",
        "1.2.0",
        """
            You are a literary analyst writing catalog summaries for a digital library.
            Guidelines:
            - Write 3-5 concise paragraphs.
            - Cover the main themes, the structure and the key arguments or plot points.
            - Avoid spoilers for fiction.
            - Keep a neutral, professional tone.
            - Say which readers would benefit most from the book.
            - If the content looks partial or corrupted, say so plainly.""",
        """
            Summarize the following book content.

            --- BOOK CONTENT (START) ---
            {content}
            --- BOOK CONTENT (END) ---

            Write the summary in 3-5 paragraphs:""",
        1024,
        4000,
        List.of("summarization", "book", "ingestion")
    );

    public static final PromptTemplate ANALYZE_REVIEWS = new PromptTemplate(
        "analyze_reviews",
        "1.1.0",
        """
            You analyse sentiment in reader reviews of books and merge many opinions into
            one balanced consensus.
            Guidelines:
            - Write 2-3 paragraphs.
            - Point out where reviewers agree and where they disagree.
            - State the overall sentiment (positive, mixed or negative) with nuance.
            - Name the strengths readers praise and the weaknesses they cite most often.
            - Close with the kind of reader most likely to enjoy the book.
            - When a previous consensus is provided, update it instead of starting over.""",
        """
            {previous_consensus_section}Reader reviews for this book:

            --- REVIEWS (START) ---
            {reviews_text}
            --- REVIEWS (END) ---

            Write the updated consensus:""",
        512,
        3000,
        List.of("sentiment", "reviews", "consensus")
    );

    private static final Map<String, PromptTemplate> REGISTRY = register(SUMMARIZE_BOOK, ANALYZE_REVIEWS);

    private PromptTemplates() {
    }

    /**
     * Looks up a template by name.
     *
     * @throws IllegalArgumentException when no template has that name
     */
    public static PromptTemplate get(String name) {
        PromptTemplate template = REGISTRY.get(name);
        if (template == null) {
            throw new IllegalArgumentException(
                "Prompt '%s' not found. Available: %s".formatted(name, REGISTRY.keySet()));
        }
        return template;
    }

    public static Map<String, PromptTemplate> all() {
        return REGISTRY;
    }

    /**
     * Renders the summary prompt for raw book text.
     */
    public static RenderedPrompt renderBookSummary(String content) {
        return SUMMARIZE_BOOK.renderWithTruncation(CONTENT_KEY, Map.of(CONTENT_KEY, content == null ? "" : content));
    }

    /**
     * Renders the consensus prompt. A previous consensus is framed as text to update.
     */
    public static RenderedPrompt renderReviewConsensus(List<Review> reviews, String previousConsensus) {
        String reviewsText = reviews.stream()
            .map(review -> "[Rating: %d/5]\n%s".formatted(review.rating(), review.text()))
            .collect(Collectors.joining("\n\n"));

        String previousSection = "";
        if (previousConsensus != null && !previousConsensus.isBlank()) {
            previousSection = """
                --- PREVIOUS CONSENSUS (START) ---
                %s
                --- PREVIOUS CONSENSUS (END) ---

                Update the consensus above with the reviews below.

                """.formatted(previousConsensus);
        }

        return ANALYZE_REVIEWS.renderWithTruncation(
            REVIEWS_KEY,
            Map.of(REVIEWS_KEY, reviewsText, PREVIOUS_CONSENSUS_KEY, previousSection)
        );
    }

    private static Map<String, PromptTemplate> register(PromptTemplate... templates) {
        Map<String, PromptTemplate> registry = new LinkedHashMap<>();
        for (PromptTemplate template : templates) {
            registry.put(template.name(), template);
        }
        return Collections.unmodifiableMap(registry);
    }
}
