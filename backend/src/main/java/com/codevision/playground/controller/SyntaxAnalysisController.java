package com.codevision.playground.controller;

import com.codevision.playground.dto.SyntaxAnalysisRequest;
import com.codevision.playground.dto.SyntaxAnalysisResponse;
import com.codevision.playground.service.SyntaxAnalysisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

import java.util.stream.Collectors;

/** Highlighting endpoint the editor calls while the user types. */
@RestController
@RequestMapping("/api/syntax")
@Validated
public class SyntaxAnalysisController {

    private static final Logger logger = LoggerFactory.getLogger(SyntaxAnalysisController.class);

    private final SyntaxAnalysisService syntaxAnalysisService;

    public SyntaxAnalysisController(SyntaxAnalysisService syntaxAnalysisService) {
        this.syntaxAnalysisService = syntaxAnalysisService;
    }

    @PostMapping("/analyze")
    public ResponseEntity<SyntaxAnalysisResponse> analyze(@Valid @RequestBody SyntaxAnalysisRequest request) {
        try {
            SyntaxAnalysisResponse response = syntaxAnalysisService.analyzeSyntax(request);

            logger.debug("Analyzed {} characters: {} tokens, {} diagnostic(s) in {}ms",
                request.sourceCode().length(),
                response.tokens().size(),
                response.diagnostics().size(),
                response.analysisTimeMs());

            return ResponseEntity.ok(response);

        } catch (RuntimeException e) {
            logger.error("Syntax analysis crashed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError()
                .body(SyntaxAnalysisResponse.rejected("Internal server error: " + e.getMessage()));
        }
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Syntax analysis service is running");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<SyntaxAnalysisResponse> handleValidationException(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
            .map(FieldError::getDefaultMessage)
            .collect(Collectors.joining("; "));

        logger.warn("Rejected syntax analysis request: {}", message);
        return ResponseEntity.badRequest().body(SyntaxAnalysisResponse.rejected(message));
    }
}
