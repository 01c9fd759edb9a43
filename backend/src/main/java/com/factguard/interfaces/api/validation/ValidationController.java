package com.factguard.interfaces.api.validation;

import com.factguard.application.validation.ValidationAppService;
import com.factguard.application.validation.ValidationOutcome;
import com.factguard.interfaces.api.dto.ValidateRequest;
import com.factguard.interfaces.api.dto.ValidateResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/validate")
@RequiredArgsConstructor
public class ValidationController {

    private final ValidationAppService validationAppService;

    @PostMapping
    public ResponseEntity<ValidateResponse> validate(@Valid @RequestBody ValidateRequest request) {
        ValidationOutcome outcome = validationAppService.validate(request.toInput());
        return ResponseEntity.ok(ValidateResponse.from(outcome.result(), outcome.interactionId()));
    }
}
