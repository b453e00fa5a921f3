package com.survey.codeframe.controller;

import com.survey.codeframe.dto.ApplySummary;
import com.survey.codeframe.dto.GenerationRequest;
import com.survey.codeframe.dto.GenerationStartResponse;
import com.survey.codeframe.dto.GenerationStatusResponse;
import com.survey.codeframe.exception.CodeframeException;
import com.survey.codeframe.exception.ResourceNotFoundException;
import com.survey.codeframe.service.CodeframeApplyService;
import com.survey.codeframe.service.CodeframeGenerationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API for starting, polling and applying codeframe generations
 */
@RestController
@RequestMapping("/api/codeframe/generations")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Generations", description = "Codeframe generation lifecycle")
public class GenerationController {

    private final CodeframeGenerationService generationService;
    private final CodeframeApplyService applyService;

    @Operation(
        summary = "Start a generation",
        description = "Validates the request and starts building a codeframe in the background"
    )
    @ApiResponse(responseCode = "202", description = "Generation started")
    @ApiResponse(responseCode = "400", description = "Invalid request")
    @ApiResponse(responseCode = "409", description = "A generation is already processing for the category")
    @PostMapping
    public ResponseEntity<Object> start(@Valid @RequestBody GenerationRequest request) {
        try {
            GenerationStartResponse response = generationService.start(request);
            return ResponseEntity.accepted().body(response);
        } catch (CodeframeException e) {
            log.warn("Generation rejected for category {}: {}", request.getCategoryId(), e.getMessage());
            return ErrorBodies.of(e);
        } catch (Exception e) {
            log.error("Failed to start generation: {}", e.getMessage(), e);
            return ErrorBodies.internal();
        }
    }

    @Operation(
        summary = "Get generation status",
        description = "Progress while processing; counts, MECE report and hierarchy once completed; error once failed"
    )
    @ApiResponse(responseCode = "200", description = "Status snapshot")
    @ApiResponse(responseCode = "404", description = "Generation not found")
    @GetMapping("/{id}/status")
    public ResponseEntity<Object> status(@Parameter(description = "Generation ID") @PathVariable UUID id) {
        try {
            GenerationStatusResponse response = generationService.getStatus(id);
            return ResponseEntity.ok(response);
        } catch (ResourceNotFoundException e) {
            return ErrorBodies.notFound(e.getMessage());
        }
    }

    @Operation(
        summary = "List generations of a category",
        description = "Newest first, without hierarchies"
    )
    @GetMapping
    public List<GenerationStatusResponse> history(@RequestParam("category_id") Long categoryId) {
        return generationService.history(categoryId);
    }

    @Operation(
        summary = "Apply a generation",
        description = "Creates or links production codes and assigns answers. Only completed generations can be applied."
    )
    @ApiResponse(responseCode = "200", description = "Applied")
    @ApiResponse(responseCode = "404", description = "Generation not found")
    @ApiResponse(responseCode = "409", description = "Generation is not completed")
    @PostMapping("/{id}/apply")
    public ResponseEntity<Object> apply(
            @Parameter(description = "Generation ID") @PathVariable UUID id,
            @RequestParam(value = "applied_by", required = false) String appliedBy) {
        try {
            ApplySummary summary = applyService.apply(id, appliedBy);
            return ResponseEntity.ok(summary);
        } catch (ResourceNotFoundException e) {
            return ErrorBodies.notFound(e.getMessage());
        } catch (CodeframeException e) {
            log.warn("Apply rejected for generation {}: {}", id, e.getMessage());
            return ErrorBodies.of(e);
        }
    }
}
