package dev.candidateeval.generator;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.candidateeval.config.GeneratorConfig;
import dev.candidateeval.config.RetryPolicy;
import dev.candidateeval.error.ExternalServiceException;
import dev.candidateeval.error.OutputValidationException;
import dev.candidateeval.model.CandidateProfile;
import dev.candidateeval.model.JobRequirement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;

/**
 * Implementation of CategoryScoreGenerator that uses the OpenRouter API.
 * OpenRouter exposes many models through an OpenAI-compatible chat completions endpoint.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "generator.provider", havingValue = "openrouter")
public class OpenRouterCategoryScoreGenerator implements CategoryScoreGenerator {

    private static final int MAX_DOCUMENT_CHARS = 12000;

    private static final String SYSTEM_PROMPT = """
            You are an expert technical recruiter. Compare the candidate profile with the job
            requirements and score four categories from 0 to 100: skills, experience, education
            and additional (projects, certifications, other qualifications).
            Respond with JSON only, in exactly this format:
            {
              "match_score": <integer 0-100>,
              "categories": {
                "skills": {"score": <0-100>, "matches": [<string>], "gaps": [<string>]},
                "experience": {"score": <0-100>, "matches": [<string>], "gaps": [<string>]},
                "education": {"score": <0-100>, "matches": [<string>], "gaps": [<string>]},
                "additional": {"score": <0-100>, "matches": [<string>], "gaps": [<string>]}
              }
            }
            """;

    private final WebClient webClient;
    private final GeneratorConfig config;
    private final RetryPolicy retryPolicy;
    private final UpstreamMatchParser parser;
    private final ObjectMapper objectMapper;

    public OpenRouterCategoryScoreGenerator(GeneratorConfig config, RetryPolicy generatorRetryPolicy,
            UpstreamMatchParser parser, ObjectMapper objectMapper) {
        this.config = config;
        this.retryPolicy = generatorRetryPolicy;
        this.parser = parser;
        this.objectMapper = objectMapper;
        this.webClient = WebClient.builder()
                .baseUrl(Objects.requireNonNull(config.getBaseUrl()))
                .defaultHeader("Authorization", "Bearer " + config.getApiKey())
                .defaultHeader("Content-Type", "application/json")
                .defaultHeader("X-Title", "Candidate Evaluator")
                .build();

        if (!isEnabled()) {
            log.warn("OpenRouter API Key is missing! Category scoring will fail.");
        } else {
            log.info("OpenRouter category scoring enabled with model: {}", config.getModel());
        }
    }

    @Override
    public Mono<GeneratedScores> generate(CandidateProfile profile, JobRequirement requirement) {
        if (!isEnabled()) {
            return Mono.error(new ExternalServiceException("Generator API key is not configured", false));
        }

        return Mono.fromCallable(() -> buildRequest(buildPrompt(profile, requirement)))
                .flatMap(request -> retryPolicy.apply(callApi(request)))
                .map(parser::parse)
                .doOnSuccess(scores -> log.debug("Generator scored {} categories for '{}'",
                        scores.categories().size(), profile.candidateName()));
    }

    private Mono<String> callApi(OpenRouterRequest request) {
        return webClient.post()
                .uri("/chat/completions")
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError,
                        response -> response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .map(body -> {
                                    log.warn("OpenRouter API Error {}: {}", response.statusCode().value(), body);
                                    return ExternalServiceException.forStatus(response.statusCode().value(), body);
                                }))
                .bodyToMono(OpenRouterResponse.class)
                .flatMap(response -> Mono.justOrEmpty(extractContent(response)))
                .switchIfEmpty(Mono.error(() -> new OutputValidationException("Generator response has no content")))
                .onErrorMap(WebClientRequestException.class,
                        e -> new ExternalServiceException("Generator unreachable: " + e.getMessage(), true, e));
    }

    private String buildPrompt(CandidateProfile profile, JobRequirement requirement) throws JsonProcessingException {
        return "Job requirements:\n" + truncate(objectMapper.writeValueAsString(requirement))
                + "\n\nCandidate profile:\n" + truncate(objectMapper.writeValueAsString(profile));
    }

    private OpenRouterRequest buildRequest(String prompt) {
        return new OpenRouterRequest(config.getModel(),
                List.of(new Message("system", SYSTEM_PROMPT), new Message("user", prompt)),
                config.getTemperature(), config.getMaxTokens());
    }

    private String extractContent(OpenRouterResponse response) {
        if (response != null && response.choices() != null && !response.choices().isEmpty()
                && response.choices().get(0).message() != null) {
            String content = response.choices().get(0).message().content();
            return content == null || content.isBlank() ? null : content;
        }
        return null;
    }

    private String truncate(String document) {
        return document.length() > MAX_DOCUMENT_CHARS ? document.substring(0, MAX_DOCUMENT_CHARS) + "..." : document;
    }

    @Override
    public boolean isEnabled() {
        return config.getApiKey() != null && !config.getApiKey().isBlank();
    }

    // OpenAI Compatible DTOs
    record OpenRouterRequest(String model, List<Message> messages, double temperature,
            @JsonProperty("max_tokens") int maxTokens) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Message(String role, String content) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record OpenRouterResponse(List<Choice> choices) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Choice(Message message) {
        }
    }
}
