package com.phillippitts.voiceorders.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Per-session settings of the voice pipeline.
 * Binds to properties prefixed with "voice.session".
 *
 * @param systemPrompt       first system message of every conversation; the store knowledge base when blank
 * @param idleTimeoutSeconds sessions without inbound frames for this long are closed
 * @param audioLogInterval   inbound audio is logged every Nth chunk
 */
@ConfigurationProperties(prefix = "voice.session")
@Validated
public record SessionProperties(
        String systemPrompt,

        @Positive(message = "Idle timeout must be positive")
        @DefaultValue("300") int idleTimeoutSeconds,

        @Positive(message = "Audio log interval must be positive")
        @DefaultValue("50") int audioLogInterval
) {
    public SessionProperties {
        if (systemPrompt == null || systemPrompt.isBlank()) {
            systemPrompt = DEFAULT_SYSTEM_PROMPT;
        }
    }

    public static final String DEFAULT_SYSTEM_PROMPT =
            "You are a helpful voice assistant for an online store. Keep responses concise and conversational.\n"
            + "Knowledge Base:\n"
            + "- Customers ask about their orders, products, or account details.\n"
            + "- When a customer asks for an order status, make sure you have an order number.\n"
            + "- If no order number is available, politely ask for it.\n"
            + "- When order details are provided, summarize the status and delivery expectation using the supplied data.\n"
            + "- Be empathetic, efficient, and avoid exposing internal system details.";
}
