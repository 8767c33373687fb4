package com.eci.notification.template;

/**
 * Output of {@link TemplateResolver#render}: subject and body with every
 * placeholder substituted.
 */
public final class RenderedContent {

    private final String templateId;
    private final String subject;
    private final String body;

    public RenderedContent(final String templateId, final String subject, final String body) {
        this.templateId = templateId;
        this.subject    = subject;
        this.body       = body;
    }

    public String getTemplateId() { return templateId; }
    public String getSubject()    { return subject; }
    public String getBody()       { return body; }
}
