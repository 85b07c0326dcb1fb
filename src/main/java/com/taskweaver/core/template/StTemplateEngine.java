package com.taskweaver.core.template;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.template.TemplateRenderer;
import org.springframework.ai.template.ValidationMode;
import org.springframework.ai.template.st.StTemplateRenderer;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * {@link TemplateEngine} backed by Spring AI's StringTemplate renderer.
 * Placeholders use braces, e.g. {@code Summarize {topic} for {_parameter.value}}.
 */
@Component
public class StTemplateEngine implements TemplateEngine {

    private static final Logger log = LoggerFactory.getLogger(StTemplateEngine.class);

    private final TemplateRenderer renderer;

    public StTemplateEngine() {
        this(StTemplateRenderer.builder().validationMode(ValidationMode.NONE).build());
    }

    StTemplateEngine(TemplateRenderer renderer) {
        this.renderer = renderer;
    }

    @Override
    public String render(String template, Map<String, Object> bindings) {
        if (template == null || template.isBlank()) {
            return "";
        }
        try {
            return renderer.apply(template, bindings);
        } catch (RuntimeException e) {
            log.warn("Template rendering failed, using the raw template: {}", e.getMessage());
            return template;
        }
    }
}
