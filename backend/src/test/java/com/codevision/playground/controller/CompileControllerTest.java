package com.codevision.playground.controller;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class CompileControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void compilesSource() throws Exception {
        mockMvc.perform(post("/api/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceCode\": \"int main() { int x = 10; return 0; }\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.resultType").value("warnings"))
                .andExpect(jsonPath("$.result.tokens", hasSize(14)))
                .andExpect(jsonPath("$.result.tokens[0].kind").value("KEYWORD"))
                .andExpect(jsonPath("$.result.syntaxTree.kind").value("PROGRAM"))
                .andExpect(jsonPath("$.result.scopes[0].name").value("main"))
                .andExpect(jsonPath("$.result.controlFlow.kind").value("ENTRY"))
                .andExpect(jsonPath("$.result.complexity.time.complexityClass").value(1))
                .andExpect(jsonPath("$.result.diagnostics[0].severity").value("warning"))
                .andExpect(jsonPath("$.result.diagnostics[0].line").value(1))
                .andExpect(jsonPath("$.result.diagnostics[0].column").value(18));
    }

    @Test
    void missingSourceIsAValidationError() throws Exception {
        mockMvc.perform(post("/api/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.resultType").value("validation_error"))
                .andExpect(jsonPath("$.error", containsString("sourceCode")));
    }

    @Test
    void sourceWithoutMainHasNoControlFlow() throws Exception {
        mockMvc.perform(post("/api/compile")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceCode\": \"int helper() { return 1; }\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.resultType").value("success"))
                .andExpect(jsonPath("$.result.controlFlow").doesNotExist())
                .andExpect(jsonPath("$.result.complexity").doesNotExist());
    }

    @Test
    void health() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("CodeVision Playground Backend is healthy"));
    }

    @Test
    void analyzesSyntax() throws Exception {
        mockMvc.perform(post("/api/syntax/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sourceCode\": \"int main() { return 0; }\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.tokens[1].value").value("main"))
                .andExpect(jsonPath("$.tokens[1].tokenType").value("function.user"))
                .andExpect(jsonPath("$.tokens[1].endColumn").value(9))
                .andExpect(jsonPath("$.diagnostics", hasSize(0)));
    }

    @Test
    void syntaxAnalysisRejectsMissingSource() throws Exception {
        mockMvc.perform(post("/api/syntax/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Source code cannot be null"));
    }

    @Test
    void syntaxHealth() throws Exception {
        mockMvc.perform(get("/api/syntax/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("Syntax analysis service is running"));
    }
}
