package net.luminalib.controller.dto;

import java.util.UUID;
import net.luminalib.domain.recommendation.RecommendationResult;

public record RecommendationDto(UUID bookId, double score, String reason) {

    public static RecommendationDto from(RecommendationResult result) {
        return new RecommendationDto(result.bookId(), Math.round(result.score() * 10_000.0) / 10_000.0, result.reason());
    }
}
