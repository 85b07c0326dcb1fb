package com.taskweaver.core.template;

import java.util.Map;

/**
 * Renders prompt templates for child sessions.
 */
public interface TemplateEngine {

    /**
     * Renders {@code template} with the given bindings. Implementations never throw:
     * a template that cannot be rendered is returned unchanged.
     */
    String render(String template, Map<String, Object> bindings);
}
