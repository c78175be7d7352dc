package com.di.ecomflow.controller;

import com.di.ecomflow.runner.EtlPipelineService;
import com.di.ecomflow.runner.PipelineRunResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Pipeline API.
 * <ul>
 *   <li>{@code POST /api/pipeline/run} runs the pipeline and returns its result</li>
 *   <li>{@code GET /api/pipeline/runs/latest} returns the last run, 404 before the first</li>
 * </ul>
 */
@Slf4j
@RestController
@RequestMapping("/api/pipeline")
@RequiredArgsConstructor
public class PipelineController {

    private final EtlPipelineService pipelineService;

    @PostMapping("/run")
    public ResponseEntity<PipelineRunResult> run() {
        log.info("[API] Pipeline run requested");
        return ResponseEntity.ok(pipelineService.runPipeline());
    }

    @GetMapping("/runs/latest")
    public ResponseEntity<PipelineRunResult> latest() {
        return pipelineService.latestRun()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
