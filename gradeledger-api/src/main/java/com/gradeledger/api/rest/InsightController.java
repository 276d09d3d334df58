package com.gradeledger.api.rest;

import com.gradeledger.core.exception.ValidationException;
import com.gradeledger.insights.InsightPresentation;
import com.gradeledger.insights.LedgerInsightService;
import com.gradeledger.insights.model.Insight;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Advisory insights computed on demand from the event ledger.
 * Nothing is stored; every call analyzes the current ledger.
 */
@RestController
@RequestMapping("/api/v1/courses/{courseId}/insights")
public class InsightController {

    static final String RAW = "raw";
    static final String DISPLAY = "display";

    private final LedgerInsightService insightService;
    private final InsightPresentation presentation;

    public InsightController(LedgerInsightService insightService, InsightPresentation presentation) {
        this.insightService = insightService;
        this.presentation = presentation;
    }

    /**
     * @param mode {@code display} rounds confidence and labels weak insights;
     *             {@code raw} returns analyzer output as is
     */
    @GetMapping
    public ResponseEntity<List<Insight>> getInsights(
            @PathVariable String courseId,
            @RequestParam(name = "presentation", defaultValue = DISPLAY) String mode) {

        if (!RAW.equals(mode) && !DISPLAY.equals(mode)) {
            throw new ValidationException("presentation", "expected raw or display, got " + mode);
        }
        List<Insight> insights = insightService.analyzeCourse(courseId);
        return ResponseEntity.ok(RAW.equals(mode) ? insights : presentation.normalize(insights));
    }
}
