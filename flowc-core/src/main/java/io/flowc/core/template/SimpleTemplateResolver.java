package io.flowc.core.template;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Template resolver using regex.
///
/// A placeholder is `{identifier}` with identifier `[A-Za-z_][A-Za-z0-9_]*`. Placeholders
/// whose name is not a key of the value mapping stay in the text byte for byte, as do doubled
/// braces (`{{x}}`) and anything that is not a well-formed placeholder (`{1x}`, `{ x }`).
public class SimpleTemplateResolver implements TemplateResolver {

    private static final Pattern TEMPLATE_PATTERN =
            Pattern.compile("(?<!\\{)\\{([A-Za-z_][A-Za-z0-9_]*)}(?!})");

    @Override
    public String resolve(String template, Map<String, String> values) {
        if (template == null || values.isEmpty() || template.indexOf('{') < 0) {
            return template;
        }

        Matcher matcher = TEMPLATE_PATTERN.matcher(template);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            String replacement = value != null ? value : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }

        matcher.appendTail(result);
        return result.toString();
    }
}
