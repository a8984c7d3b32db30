package io.flowc.core.template;

import java.util.Map;

/// Resolves `{name}` placeholders in strings. Pure utility, no dependencies.
public interface TemplateResolver {

    /// Replaces the placeholders whose name is a key of `values`.
    ///
    /// @param template text to resolve, may be null
    /// @param values known values by placeholder name, not null
    /// @return resolved text, null if `template` is null
    String resolve(String template, Map<String, String> values);
}
