package com.codevision.playground.compiler.model;

import java.util.List;

public record ComplexityInfo(
        Time time,
        Space space,
        List<Suggestion> suggestions) {

    public ComplexityInfo {
        suggestions = List.copyOf(suggestions);
    }

    public record Time(ComplexityClass complexityClass, List<String> factors) {
        public Time {
            factors = List.copyOf(factors);
        }
    }

    public record Space(ComplexityClass complexityClass, List<String> details) {
        public Space {
            details = List.copyOf(details);
        }
    }

    public record Suggestion(String title, String description) {
    }
}
