package com.finbrain.interfaces.api.categorization;

import com.finbrain.application.categorization.CategorizationOrchestrator;
import com.finbrain.domain.inference.model.CategorizationResult;
import com.finbrain.interfaces.api.dto.CategorizationResponse;
import com.finbrain.interfaces.api.dto.CategorizeRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/categorizations")
@RequiredArgsConstructor
public class CategorizationController {

    private final CategorizationOrchestrator orchestrator;

    @PostMapping
    public ResponseEntity<CategorizationResponse> categorize(@Valid @RequestBody CategorizeRequest request) {
        CategorizationResult result = orchestrator.categorize(request.description(), request.sourceFacts());
        return ResponseEntity.ok(CategorizationResponse.from(result));
    }
}
