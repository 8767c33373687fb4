package com.eci.notification.template;

import com.eci.notification.model.Channel;

import java.util.Map;

/**
 * Maps an event type and locale to a template and renders payload values
 * into it.
 */
public interface TemplateResolver {

    /**
     * Find the template for {@code eventType}, falling back from the given
     * locale to its language and then to the default locale.
     *
     * @throws com.eci.notification.error.TemplateNotFoundException if no locale matches
     */
    Template resolve(String eventType, String locale);

    /**
     * Substitute payload values into the template's subject and the body
     * used for {@code channel}.
     *
     * @throws com.eci.notification.error.MissingVariableException if a required
     *         placeholder has no value in {@code payload}
     */
    RenderedContent render(Template template, Map<String, String> payload, Channel channel);
}
