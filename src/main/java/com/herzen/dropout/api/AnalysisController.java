package com.herzen.dropout.api;

import com.herzen.dropout.classification.ClassificationModels.InterventionType;
import com.herzen.dropout.features.CompetitionContextProvider.RankSnapshot;
import com.herzen.dropout.features.InMemoryCompetitionContextProvider;
import com.herzen.dropout.intervention.InterventionTracker.InterventionRecord;
import com.herzen.dropout.service.DropoutDetectionService;
import com.herzen.dropout.view.UserRole;
import com.herzen.dropout.view.ViewModels.AnalysisView;
import com.herzen.dropout.view.ViewModels.TeacherReport;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
public class AnalysisController {
    private final DropoutDetectionService detectionService;
    private final InMemoryCompetitionContextProvider competitionContext;

    public AnalysisController(DropoutDetectionService detectionService, InMemoryCompetitionContextProvider competitionContext) {
        this.detectionService = detectionService;
        this.competitionContext = competitionContext;
    }

    @GetMapping("/analysis")
    public ResponseEntity<AnalysisView> analyze(@RequestParam String studentId,
                                                @RequestParam String questionId,
                                                @RequestParam(defaultValue = "TEACHER") UserRole role,
                                                @RequestParam(required = false) String questionContext) {
        return ResponseEntity.ok(detectionService.analyze(studentId, questionId, role, questionContext));
    }

    @GetMapping("/analysis/students/{studentId}")
    public ResponseEntity<List<TeacherReport>> analyzeStudent(@PathVariable String studentId) {
        return ResponseEntity.ok(detectionService.analyzeStudent(studentId));
    }

    @PostMapping("/interventions")
    public ResponseEntity<InterventionRecord> flag(@RequestBody InterventionRequest request) {
        return ResponseEntity.ok(detectionService.flagForIntervention(
                request.studentId(), request.questionId(), request.interventionType(), request.notes()));
    }

    @PostMapping("/competition/ranks")
    public ResponseEntity<RankSnapshot> recordRank(@RequestBody RankRequest request) {
        if (request.studentId() == null || request.studentId().isBlank() || request.rank() == null || request.rank() < 1) {
            throw new IllegalArgumentException("studentId and a positive rank are required");
        }
        return ResponseEntity.ok(competitionContext.recordRank(request.studentId(), request.rank()));
    }

    public record InterventionRequest(String studentId, String questionId, InterventionType interventionType, String notes) {}

    public record RankRequest(String studentId, Integer rank) {}
}
