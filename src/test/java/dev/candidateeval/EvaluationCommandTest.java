package dev.candidateeval;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EvaluationCommandTest {

  @Test
  @DisplayName("Should parse positional files and equals-style options")
  void shouldParseEqualsOptions() {
    EvaluationCommand command = EvaluationCommand.parse(
        "in/jane.json", "in/role.json",
        "--assessment=in/answers.json", "--candidate-id=jane-01",
        "--weights=skills=0.5,experience=0.3,education=0.1,additional=0.1",
        "--output=out/jane");

    assertThat(command.profile()).isEqualTo(Path.of("in/jane.json"));
    assertThat(command.requirement()).isEqualTo(Path.of("in/role.json"));
    assertThat(command.assessment()).isEqualTo(Path.of("in/answers.json"));
    assertThat(command.scores()).isNull();
    assertThat(command.candidateId()).isEqualTo("jane-01");
    assertThat(command.weights()).isEqualTo("skills=0.5,experience=0.3,education=0.1,additional=0.1");
    assertThat(command.outputPrefix()).isEqualTo("out/jane");
  }

  @Test
  @DisplayName("Should accept space-separated option values")
  void shouldParseSpaceSeparatedOptions() {
    EvaluationCommand command = EvaluationCommand.parse(
        "--output", "out/jane", "jane.json", "--scores", "scores.json", "role.json");

    assertThat(command.profile()).isEqualTo(Path.of("jane.json"));
    assertThat(command.requirement()).isEqualTo(Path.of("role.json"));
    assertThat(command.scores()).isEqualTo(Path.of("scores.json"));
    assertThat(command.outputPrefix()).isEqualTo("out/jane");
    assertThat(command.assessment()).isNull();
    assertThat(command.weights()).isNull();
  }

  @Test
  @DisplayName("Should require the output prefix")
  void shouldRequireOutput() {
    assertThatThrownBy(() -> EvaluationCommand.parse("jane.json", "role.json"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("--output");
  }

  @Test
  @DisplayName("Should require exactly two input files")
  void shouldRequireTwoFiles() {
    assertThatThrownBy(() -> EvaluationCommand.parse("jane.json", "--output=out/jane"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("1 positional");
  }

  @Test
  @DisplayName("Should reject unknown and repeated options")
  void shouldRejectBadOptions() {
    assertThatThrownBy(() -> EvaluationCommand.parse("a.json", "b.json", "--output=x", "--verbose"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("Unknown option --verbose");
    assertThatThrownBy(() -> EvaluationCommand.parse("a.json", "b.json", "--output=x", "--output=y"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("more than once");
  }
}
