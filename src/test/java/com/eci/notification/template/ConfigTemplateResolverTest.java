package com.eci.notification.template;

import com.eci.notification.error.MissingVariableException;
import com.eci.notification.error.TemplateNotFoundException;
import com.eci.notification.model.Channel;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.*;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ConfigTemplateResolverTest {

    private static final String TEMPLATES = String.join("\n",
            "\"order.confirmed\" {",
            "  en { subject = \"Order #{{order_id}}\", body = \"Hi {{customer_name|Customer}}, total {{order_total}}\", sms = \"Order {{order_id}} ok\" }",
            "  fr { subject = \"Commande #{{order_id}}\", body = \"Bonjour {{customer_name|Client}}\" }",
            "  fr-CA { subject = \"Commande QC #{{order_id}}\", body = \"Allo {{customer_name|Client}}\" }",
            "}",
            "\"payment.failed\" {",
            "  de { subject = \"Zahlung\", body = \"Fehlgeschlagen\" }",
            "}");

    private ConfigTemplateResolver resolver;

    @BeforeEach
    void setup() {
        resolver = new ConfigTemplateResolver(ConfigFactory.parseString(TEMPLATES), "en");
    }

    // ── resolve ───────────────────────────────────────────────────────────────

    @Test
    void resolve_prefersExactLocale() {
        assertThat(resolver.resolve("order.confirmed", "fr-CA").getId()).isEqualTo("order.confirmed/fr-ca");
        assertThat(resolver.resolve("order.confirmed", "fr_ca").getId()).isEqualTo("order.confirmed/fr-ca");
    }

    @Test
    void resolve_fallsBackToLanguage_thenDefaultLocale() {
        assertThat(resolver.resolve("order.confirmed", "fr-BE").getLocale()).isEqualTo("fr");
        assertThat(resolver.resolve("order.confirmed", "pt-BR").getLocale()).isEqualTo("en");
        assertThat(resolver.resolve("order.confirmed", null).getLocale()).isEqualTo("en");
    }

    @Test
    void resolve_throwsTemplateNotFound_whenNoLocaleInChainMatches() {
        assertThatThrownBy(() -> resolver.resolve("payment.failed", "fr"))
                .isInstanceOf(TemplateNotFoundException.class);
        assertThatThrownBy(() -> resolver.resolve("no.such.type", "en"))
                .isInstanceOf(TemplateNotFoundException.class)
                .hasMessageContaining("no.such.type");
    }

    @Test
    void fallbackChain_doesNotRepeatDefault() {
        assertThat(resolver.fallbackChain("en-GB")).containsExactly("en-gb", "en");
        assertThat(resolver.fallbackChain("fr-CA")).containsExactly("fr-ca", "fr", "en");
    }

    // ── render ────────────────────────────────────────────────────────────────

    @Test
    void render_substitutesValues_andUsesFallbacks() {
        final var template = resolver.resolve("order.confirmed", "en");

        final var content = resolver.render(template,
                Map.of("order_id", "o-42", "order_total", "99.90"), Channel.EMAIL);

        assertThat(content.getSubject()).isEqualTo("Order #o-42");
        assertThat(content.getBody()).isEqualTo("Hi Customer, total 99.90");
        assertThat(content.getTemplateId()).isEqualTo("order.confirmed/en");
    }

    @Test
    void render_usesShortBodyForSms() {
        final var template = resolver.resolve("order.confirmed", "en");

        final var content = resolver.render(template,
                Map.of("order_id", "o-42", "order_total", "99.90"), Channel.SMS);

        assertThat(content.getBody()).isEqualTo("Order o-42 ok");
    }

    @Test
    void render_listsEveryMissingVariable() {
        final var template = resolver.resolve("order.confirmed", "en");

        assertThatThrownBy(() -> resolver.render(template, Map.of("order_total", " "), Channel.EMAIL))
                .isInstanceOfSatisfying(MissingVariableException.class, e ->
                        assertThat(e.getMissing()).containsExactly("order_id", "order_total"));
    }

    @Test
    void render_keepsReplacementTextLiteral() {
        final var template = resolver.resolve("order.confirmed", "en");

        final var content = resolver.render(template,
                Map.of("order_id", "$1\\x", "order_total", "1"), Channel.EMAIL);

        assertThat(content.getSubject()).isEqualTo("Order #$1\\x");
    }

    // ── bundled templates ─────────────────────────────────────────────────────

    @Test
    void bundledTemplates_coverEveryKnownEventType() {
        final var config = ConfigFactory.load();
        final var bundled = new ConfigTemplateResolver(config.getConfig("templates"), "en");

        for (final String type : config.getStringList("events.known-types")) {
            final var template = bundled.resolve(type, "en");
            assertThat(template.getBody()).as(type).isNotBlank();
            assertThat(template.getShortBody()).as(type).isNotBlank();
        }
    }
}
