package net.luminalib.controller.dto;

public record QueueStatsDto(int running, int pending, int maxParallel, int maxPending) {
}
