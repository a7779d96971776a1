package com.defold.prefab.cli;

import com.samskivert.mustache.Mustache;
import com.samskivert.mustache.MustacheException;
import com.samskivert.mustache.Template;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Renders the Mustache templates stored under {@code /templates} on the classpath.
 *
 * Values are written verbatim. A variable missing from the context is an error.
 */
public class TemplateExecutor {
    private static final Logger LOGGER = LoggerFactory.getLogger(TemplateExecutor.class);

    private final Mustache.Compiler compiler = Mustache.compiler().escapeHTML(false);
    private final Map<String, Template> templates = new HashMap<>();

    /**
     * @param templateName The template path relative to {@code /templates} without the {@code .mustache} suffix,
     *                     e.g. "cmake/dependency"
     */
    public String execute(String templateName, Map<String, Object> context) {
        Template template = templates.computeIfAbsent(templateName, this::load);
        try {
            return template.execute(context);
        } catch (MustacheException e) {
            LOGGER.error("Failed to render template '{}' with {}", templateName, context);
            throw e;
        }
    }

    public String execute(String template, String key, Object value) {
        Map<String, Object> context = new HashMap<>();
        context.put(key, value);
        return execute(template, context);
    }

    private Template load(String templateName) {
        String resource = String.format("/templates/%s.mustache", templateName);
        try (InputStream input = TemplateExecutor.class.getResourceAsStream(resource)) {
            if (input == null) {
                throw new IllegalArgumentException(String.format("No such template: %s", resource));
            }
            return compiler.compile(IOUtils.toString(input, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
