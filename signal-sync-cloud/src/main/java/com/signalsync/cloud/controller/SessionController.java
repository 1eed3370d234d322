package com.signalsync.cloud.controller;

import com.signalsync.cloud.dto.RoiRequest;
import com.signalsync.cloud.dto.SamplingRateRequest;
import com.signalsync.cloud.dto.SessionView;
import com.signalsync.cloud.service.RoiReportService;
import com.signalsync.cloud.service.SyncAnalysisService;
import com.signalsync.shared.domain.AnalysisRequest;
import com.signalsync.shared.domain.RoiResult;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final SyncAnalysisService analysisService;
    private final RoiReportService reportService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public SessionView create() {
        return analysisService.createSession();
    }

    @GetMapping("/{id}")
    public SessionView get(@PathVariable String id) {
        return analysisService.getSession(id);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String id) {
        analysisService.deleteSession(id);
    }

    @PutMapping("/{id}/sampling-rate")
    public SessionView setSamplingRate(@PathVariable String id, @RequestBody SamplingRateRequest request) {
        return analysisService.setSamplingRate(id, request.getSamplingRate());
    }

    @PutMapping("/{id}/roi")
    public SessionView setRoi(@PathVariable String id, @RequestBody RoiRequest request) {
        return analysisService.setRoi(id, request.getStart(), request.getEnd());
    }

    @DeleteMapping("/{id}/roi")
    public SessionView clearRoi(@PathVariable String id) {
        return analysisService.clearRoi(id);
    }

    @PostMapping("/{id}/analyze")
    public RoiResult analyze(@PathVariable String id, @RequestBody AnalysisRequest request) {
        return analysisService.analyze(id, request);
    }

    @PostMapping(value = "/{id}/report", produces = MediaType.TEXT_PLAIN_VALUE)
    public String report(@PathVariable String id, @RequestBody AnalysisRequest request) {
        return reportService.summarize(analysisService.analyze(id, request));
    }
}
