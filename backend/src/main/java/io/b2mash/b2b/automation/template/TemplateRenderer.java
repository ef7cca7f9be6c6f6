package io.b2mash.b2b.automation.template;

import io.b2mash.b2b.automation.rule.ContextPaths;
import java.math.BigDecimal;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Substitutes {@code {{name}}} placeholders with values from a variable map. Names may be dotted
 * paths into nested maps. No template engine: a placeholder whose name does not resolve is left
 * unreplaced in the output, so a missing variable is visible rather than silently blank.
 */
@Component
public class TemplateRenderer {

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([\\w.\\-]+)\\s*}}");

  public String render(String text, Map<String, ?> variables) {
    if (text == null || text.indexOf("{{") < 0) {
      return text;
    }
    Matcher matcher = PLACEHOLDER.matcher(text);
    var result = new StringBuilder(text.length());
    while (matcher.find()) {
      Object value = ContextPaths.resolve(variables, matcher.group(1));
      String replacement =
          ContextPaths.isDefined(value) && value != null ? format(value) : matcher.group();
      matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(result);
    return result.toString();
  }

  private static String format(Object value) {
    if (value instanceof BigDecimal decimal) {
      return decimal.toPlainString();
    }
    return String.valueOf(value);
  }
}
