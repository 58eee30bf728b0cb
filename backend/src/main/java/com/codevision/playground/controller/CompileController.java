package com.codevision.playground.controller;

import com.codevision.playground.dto.CompileRequest;
import com.codevision.playground.dto.CompileResponse;
import com.codevision.playground.service.CompilerService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api")
@Validated
public class CompileController {

    private static final Logger logger = LoggerFactory.getLogger(CompileController.class);

    private static final String VALIDATION_ERROR = "validation_error";

    private final CompilerService compilerService;

    public CompileController(CompilerService compilerService) {
        this.compilerService = compilerService;
    }

    /**
     * Runs the whole front end on the submitted source. Source-level problems (unknown characters,
     * unused variables) and pipeline failures are part of a 200 response; only a rejected request
     * answers 400.
     */
    @PostMapping("/compile")
    public ResponseEntity<CompileResponse> compile(@Valid @RequestBody CompileRequest request) {
        String source = request.sanitizedSourceCode();
        logger.info("Compile request for {} characters", source.length());

        try {
            CompileResponse response = compilerService.compile(source);

            if (VALIDATION_ERROR.equals(response.resultType())) {
                return ResponseEntity.badRequest().body(response);
            }

            logger.info("Compile finished as '{}' with {} diagnostic(s)",
                       response.resultType(),
                       response.result() != null ? response.result().diagnostics().size() : 0);

            return ResponseEntity.ok(response);

        } catch (RuntimeException e) {
            logger.error("Compile request crashed: {}", e.getMessage(), e);

            return ResponseEntity.internalServerError()
                .body(CompileResponse.internalError("Internal server error: " + e.getMessage()));
        }
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("CodeVision Playground Backend is healthy");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<CompileResponse> handleValidationException(MethodArgumentNotValidException e) {

        StringBuilder errorMessage = new StringBuilder("Validation error: ");

        e.getBindingResult().getFieldErrors().forEach(error ->
            errorMessage.append(error.getField())
                       .append(" - ")
                       .append(error.getDefaultMessage())
                       .append("; ")
        );

        logger.warn("Rejected compile request: {}", errorMessage);

        return ResponseEntity.badRequest().body(CompileResponse.validationError(errorMessage.toString()));
    }
}
