package dev.candidateeval;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Parsed command line of one evaluation run:
 * {@code <profile.json> <requirement.json> [--weights=...] [--assessment=<file>] [--scores=<file>]
 * [--candidate-id=<id>] --output=<prefix>}. Options also accept the {@code --name value} form.
 */
public record EvaluationCommand(
        Path profile,
        Path requirement,
        Path assessment,
        Path scores,
        String candidateId,
        String weights,
        String outputPrefix) {

    static final String USAGE = "Usage: candidate-evaluator <profile.json> <requirement.json> "
            + "[--weights=skills=0.4,experience=0.3,education=0.2,additional=0.1] [--assessment=<file>] "
            + "[--scores=<file>] [--candidate-id=<id>] --output=<prefix>";

    private static final Set<String> OPTIONS = Set.of("weights", "assessment", "scores", "candidate-id", "output");

    /**
     * Parse raw program arguments.
     *
     * @throws IllegalArgumentException on unknown options, missing files or a missing output prefix
     */
    public static EvaluationCommand parse(String... args) {
        ApplicationArguments arguments = new DefaultApplicationArguments(normalize(args));

        for (String name : arguments.getOptionNames()) {
            if (!OPTIONS.contains(name)) {
                throw new IllegalArgumentException("Unknown option --" + name);
            }
        }
        List<String> files = arguments.getNonOptionArgs();
        if (files.size() != 2) {
            throw new IllegalArgumentException("Expected a profile file and a requirement file, got " + files.size()
                    + " positional argument(s)");
        }
        String output = single(arguments, "output");
        if (output == null || output.isBlank()) {
            throw new IllegalArgumentException("Missing required option --output");
        }

        String assessment = single(arguments, "assessment");
        String scores = single(arguments, "scores");
        return new EvaluationCommand(
                Path.of(files.get(0)),
                Path.of(files.get(1)),
                assessment != null ? Path.of(assessment) : null,
                scores != null ? Path.of(scores) : null,
                single(arguments, "candidate-id"),
                single(arguments, "weights"),
                output);
    }

    // "--output out/jane" becomes "--output=out/jane"
    private static String[] normalize(String... args) {
        List<String> normalized = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            boolean bareOption = arg.startsWith("--") && !arg.contains("=")
                    && OPTIONS.contains(arg.substring(2));
            if (bareOption && i + 1 < args.length && !args[i + 1].startsWith("--")) {
                normalized.add(arg + "=" + args[++i]);
            } else {
                normalized.add(arg);
            }
        }
        return normalized.toArray(String[]::new);
    }

    private static String single(ApplicationArguments arguments, String name) {
        List<String> values = arguments.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        if (values.size() > 1) {
            throw new IllegalArgumentException("Option --" + name + " given more than once");
        }
        return values.get(0);
    }
}
