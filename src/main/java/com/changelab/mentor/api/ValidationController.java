package com.changelab.mentor.api;

import com.changelab.mentor.validation.ResponseValidator;
import com.changelab.mentor.validation.ValidationModels;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/validation")
public class ValidationController {
    private final ResponseValidator validator;

    public ValidationController(ResponseValidator validator) {
        this.validator = validator;
    }

    @PostMapping("/check")
    public ResponseEntity<ValidationModels.ValidationVerdict> check(@RequestBody ValidationModels.CheckRequest request) {
        int minLength = request.minLength() == null ? ResponseValidator.DEFAULT_MIN_LENGTH : request.minLength();
        return ResponseEntity.ok(validator.verdict(request.text(), request.corpus(), minLength));
    }

    @PostMapping("/complete")
    public ResponseEntity<ValidationModels.CompletionCheck> complete(@RequestBody ValidationModels.CompletionRequest request) {
        int minLength = request.minLength() == null ? ResponseValidator.DEFAULT_MIN_LENGTH : request.minLength();
        return ResponseEntity.ok(validator.completion(request.entries(), request.requiredCount(), minLength));
    }
}
