package net.luminalib.controller.dto;

import java.util.UUID;

public record ReviewRequest(UUID userId, Integer rating, String text) {
}
