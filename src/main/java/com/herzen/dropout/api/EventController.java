package com.herzen.dropout.api;

import com.herzen.dropout.event.EventModels.LearningEvent;
import com.herzen.dropout.service.DropoutDetectionService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/events")
public class EventController {
    private final DropoutDetectionService detectionService;

    public EventController(DropoutDetectionService detectionService) {
        this.detectionService = detectionService;
    }

    /**
     * Records a batch in order. Malformed and null entries are counted as rejected; an ordering violation
     * aborts the rest of the batch with 409.
     */
    @PostMapping
    public ResponseEntity<EventBatchAck> ingest(@RequestBody EventBatchRequest request) {
        List<String> eventIds = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        List<EventRequest> events = request.events() == null ? List.of() : request.events();
        for (EventRequest e : events) {
            if (e == null) {
                errors.add("Empty event entry");
                continue;
            }
            try {
                LearningEvent recorded = detectionService.recordEvent(e.eventType(), e.studentId(), e.questionId(), e.payload());
                eventIds.add(recorded.eventId());
            } catch (IllegalArgumentException ex) {
                errors.add(ex.getMessage());
            }
        }
        return ResponseEntity.ok(new EventBatchAck(eventIds.size(), errors.size(), eventIds, errors));
    }

    public record EventRequest(String eventType, String studentId, String questionId, Map<String, Object> payload) {}

    public record EventBatchRequest(List<EventRequest> events) {}

    public record EventBatchAck(int accepted, int rejected, List<String> eventIds, List<String> errors) {}
}
