package net.luminalib.controller;

import java.util.UUID;
import net.luminalib.application.ai.BookIntelligenceCoordinator;
import net.luminalib.application.ai.BookIntelligenceCoordinator.TriggerDisposition;
import net.luminalib.controller.dto.BookAnalysisDto;
import net.luminalib.controller.dto.IntelligenceTriggerDto;
import net.luminalib.controller.dto.QueueStatsDto;
import net.luminalib.domain.ai.IntelligenceKind;
import net.luminalib.support.ai.IntelligenceWorkQueue;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Exposes the analysis view and fire-and-forget intelligence triggers.
 *
 * <p>Triggers answer {@code 202 Accepted} as soon as the work is queued or coalesced with
 * a running flight; progress is visible through the analysis view.</p>
 */
@RestController
@RequestMapping("/api/books")
public class BookIntelligenceController {

    private final BookIntelligenceCoordinator coordinator;

    public BookIntelligenceController(BookIntelligenceCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @GetMapping("/{bookId}/analysis")
    public ResponseEntity<BookAnalysisDto> analysis(@PathVariable UUID bookId) {
        return ResponseEntity.ok(BookAnalysisDto.from(coordinator.analysis(bookId)));
    }

    @PostMapping("/{bookId}/intelligence/summary")
    public ResponseEntity<IntelligenceTriggerDto> triggerSummary(@PathVariable UUID bookId) {
        return accepted(bookId, IntelligenceKind.SUMMARY, coordinator.triggerSummary(bookId));
    }

    @PostMapping("/{bookId}/intelligence/consensus")
    public ResponseEntity<IntelligenceTriggerDto> triggerConsensus(@PathVariable UUID bookId) {
        return accepted(bookId, IntelligenceKind.CONSENSUS, coordinator.triggerConsensus(bookId));
    }

    /**
     * Returns global queue depth for generation tasks.
     */
    @GetMapping("/intelligence/queue")
    public ResponseEntity<QueueStatsDto> queueStats() {
        IntelligenceWorkQueue.QueueSnapshot snapshot = coordinator.queueSnapshot();
        return ResponseEntity.ok(new QueueStatsDto(
            snapshot.running(), snapshot.pending(), snapshot.maxParallel(), snapshot.maxPending()));
    }

    private static ResponseEntity<IntelligenceTriggerDto> accepted(UUID bookId,
                                                                   IntelligenceKind kind,
                                                                   TriggerDisposition disposition) {
        IntelligenceTriggerDto body = new IntelligenceTriggerDto(bookId, kind.name(), disposition.name());
        if (disposition == TriggerDisposition.REJECTED) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }
}
