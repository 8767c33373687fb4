package com.eci.notification.template;

import com.eci.notification.error.MissingVariableException;
import com.eci.notification.error.TemplateNotFoundException;
import com.eci.notification.model.Channel;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigUtil;
import com.typesafe.config.ConfigValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * {@link TemplateResolver} backed by the {@code templates} section of the
 * application config ({@code templates.conf}).
 *
 * <pre>{@code
 * templates {
 *   "order.confirmed" {
 *     en { subject = "...", body = """...""", sms = "..." }
 *     fr { ... }
 *   }
 * }
 * }</pre>
 *
 * Templates are parsed once at construction; the instance is immutable and
 * thread-safe.
 */
public class ConfigTemplateResolver implements TemplateResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigTemplateResolver.class);

    private final Map<String, Map<String, Template>> byType = new HashMap<>();
    private final String defaultLocale;

    public ConfigTemplateResolver(final Config templates, final String defaultLocale) {
        this.defaultLocale = normalize(defaultLocale);
        for (final Map.Entry<String, ConfigValue> typeEntry : templates.root().entrySet()) {
            final String eventType = typeEntry.getKey();
            final Config locales   = templates.getConfig(ConfigUtil.joinPath(eventType));
            final Map<String, Template> byLocale = new HashMap<>();
            for (final String localeKey : locales.root().keySet()) {
                final Config t = locales.getConfig(ConfigUtil.joinPath(localeKey));
                final String locale = normalize(localeKey);
                byLocale.put(locale, new Template(
                        eventType,
                        locale,
                        t.hasPath("subject") ? t.getString("subject") : "",
                        t.getString("body"),
                        t.hasPath("sms") ? t.getString("sms") : null));
            }
            byType.put(eventType, byLocale);
        }
        LOG.info("Loaded templates for {} event types", byType.size());
    }

    @Override
    public Template resolve(final String eventType, final String locale) {
        final Map<String, Template> byLocale = byType.get(eventType);
        if (byLocale == null || byLocale.isEmpty()) {
            throw new TemplateNotFoundException(eventType, locale);
        }
        for (final String candidate : fallbackChain(locale)) {
            final Template t = byLocale.get(candidate);
            if (t != null) return t;
        }
        throw new TemplateNotFoundException(eventType, locale);
    }

    @Override
    public RenderedContent render(final Template template,
                                  final Map<String, String> payload,
                                  final Channel channel) {
        final List<String> missing = new ArrayList<>();
        final String subject = PlaceholderRenderer.render(template.getSubject(), payload, missing);
        final String body    = PlaceholderRenderer.render(template.bodyFor(channel), payload, missing);
        if (!missing.isEmpty()) {
            throw new MissingVariableException(template.getId(), missing);
        }
        return new RenderedContent(template.getId(), subject, body);
    }

    /** {@code fr-CA} → [{@code fr-ca}, {@code fr}, default]. */
    List<String> fallbackChain(final String locale) {
        final List<String> chain = new ArrayList<>(3);
        if (locale != null && !locale.isBlank()) {
            final String normalized = normalize(locale);
            chain.add(normalized);
            final int dash = normalized.indexOf('-');
            if (dash > 0) chain.add(normalized.substring(0, dash));
        }
        if (!chain.contains(defaultLocale)) chain.add(defaultLocale);
        return chain;
    }

    private static String normalize(final String locale) {
        return locale.trim().replace('_', '-').toLowerCase(Locale.ROOT);
    }
}
