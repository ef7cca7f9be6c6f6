package io.b2mash.b2b.automation.template;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TemplateRendererTest {

  private final TemplateRenderer renderer = new TemplateRenderer();

  @Test
  void render_substitutesEveryOccurrence() {
    var result =
        renderer.render(
            "Hi {{client_name}}, {{ client_name }} owes {{amount}}",
            Map.of("client_name", "Acme", "amount", new BigDecimal("1.50E+3")));

    assertThat(result).isEqualTo("Hi Acme, Acme owes 1500");
  }

  @Test
  void render_leavesUnknownPlaceholdersInPlace() {
    assertThat(renderer.render("Due {{due_date}}", Map.of())).isEqualTo("Due {{due_date}}");
  }

  @Test
  void render_nullValueIsTreatedAsMissing() {
    var variables = new HashMap<String, Object>();
    variables.put("client_name", null);

    assertThat(renderer.render("Dear {{client_name}}", variables))
        .isEqualTo("Dear {{client_name}}");
  }

  @Test
  void render_followsDottedPaths() {
    var variables = Map.<String, Object>of("client", Map.of("email", "a@b.test"));

    assertThat(renderer.render("{{client.email}}", variables)).isEqualTo("a@b.test");
  }

  @Test
  void render_replacementTextIsLiteral() {
    assertThat(renderer.render("{{x}}", Map.of("x", "$1 \\ ok"))).isEqualTo("$1 \\ ok");
  }
}
