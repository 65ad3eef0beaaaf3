package com.finbrain.interfaces.api.feedback;

import com.finbrain.domain.inference.service.FeedbackHook;
import com.finbrain.interfaces.api.dto.CorrectionRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/feedback")
@RequiredArgsConstructor
public class FeedbackController {

    private final FeedbackHook feedbackHook;

    @PostMapping("/corrections")
    public ResponseEntity<Void> recordCorrection(@Valid @RequestBody CorrectionRequest request) {
        feedbackHook.recordCorrection(request.originalCategory(), request.correctedCategory(), request.description());
        return ResponseEntity.accepted().build();
    }
}
