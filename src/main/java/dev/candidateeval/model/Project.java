package dev.candidateeval.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Project(
        String name,
        String description,
        List<String> technologies,
        String url) {

    public Project {
        technologies = technologies == null ? List.of() : List.copyOf(technologies);
    }
}
