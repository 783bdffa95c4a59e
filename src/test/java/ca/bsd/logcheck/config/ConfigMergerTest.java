package ca.bsd.logcheck.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlWhichOverridesDefaults() {
    Map<String, String> defaults = Map.of("in", "input", "out", "output", "pattern", "*.txt");
    Map<String, String> yaml = Map.of("in", "/yaml/in", "pattern", "*.log");
    Map<String, String> cli = Map.of("in", "/cli/in");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "analyze", Optional.of(yaml), cli, defaults, warnings::add);

    assertEquals("/cli/in", merged.get("in"));
    assertEquals("*.log", merged.get("pattern"));
    assertEquals("output", merged.get("out"));
    assertEquals(List.of("CLI overrides YAML for key: in"), warnings);
  }

  @Test
  void cliWithoutYamlDoesNotWarn() {
    List<String> warnings = new ArrayList<>();

    ConfigMerger.buildEffectiveConfig(
        "analyze", Optional.empty(), Map.of("sort", "false"), Map.of("sort", "true"), warnings::add);

    assertEquals(List.of(), warnings);
  }

  @Test
  void patternMustStayInsideInputFolder() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "analyze", Optional.empty(), Map.of("pattern", "../*.txt"), Map.of(), msg -> {}));
  }

  @Test
  void outputMustDifferFromInput() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "analyze", Optional.empty(), Map.of("in", "logs", "out", "logs"), Map.of(), msg -> {}));
  }
}
