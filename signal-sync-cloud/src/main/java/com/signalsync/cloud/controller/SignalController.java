package com.signalsync.cloud.controller;

import com.signalsync.cloud.dto.ResampleRequest;
import com.signalsync.cloud.service.SyncAnalysisService;
import com.signalsync.shared.domain.ResampledSignal;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/signal")
public class SignalController {

    private final SyncAnalysisService analysisService;

    @Autowired
    public SignalController(SyncAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @PostMapping("/resample")
    public ResampledSignal resample(@RequestBody ResampleRequest request) {
        return analysisService.resample(request.getSamples(), request.getOrigFs(), request.getTargetFs());
    }

    @GetMapping("/health")
    public String health() {
        return "Signal Sync Service is Running";
    }
}
