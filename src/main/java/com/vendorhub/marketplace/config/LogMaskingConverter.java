package com.vendorhub.marketplace.config;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

import java.util.regex.Pattern;

/**
 * Logback converter that masks credentials in log messages.
 * <ul>
 * <li>Bearer tokens: first 8 chars + "..."</li>
 * <li>Bare JWTs (eyJ...): first 8 chars + "..."</li>
 * <li>secret_access_key / secretAccessKey / jwt secret: "[REDACTED]"</li>
 * <li>AWS access key ids (AKIA...): last 4 chars only</li>
 * </ul>
 * <p>
 * Register in logback-spring.xml:
 * {@code <conversionRule conversionWord="mask" converterClass=
 * "com.vendorhub.marketplace.config.LogMaskingConverter" />}
 * </p>
 */
public class LogMaskingConverter extends CompositeConverter<ILoggingEvent> {

    // Matches Bearer tokens: "Bearer <token>"
    private static final Pattern BEARER_PATTERN = Pattern
            .compile("(Bearer\\s+)([A-Za-z0-9_\\-./+=]{8})[A-Za-z0-9_\\-./+=]+");

    // Matches a compact JWS outside a Bearer header
    private static final Pattern JWT_PATTERN = Pattern
            .compile("(?<![A-Za-z0-9_\\-.])(eyJ[A-Za-z0-9_\\-]{5})[A-Za-z0-9_\\-]*\\.[A-Za-z0-9_\\-]+\\.[A-Za-z0-9_\\-]+");

    // Matches secret_access_key=<value>, "secretAccessKey":"<value>", secret: <value>
    private static final Pattern SECRET_PATTERN = Pattern
            .compile("((?:secret_access_key|secretAccessKey|secret-access-key|jwt\\.secret)[\"=:]+\\s*[\"']?)[^\"&\\s,]+");

    // Matches AWS access key ids
    private static final Pattern ACCESS_KEY_ID_PATTERN = Pattern.compile("\\b(?:AKIA|ASIA)[A-Z0-9]{12}([A-Z0-9]{4})\\b");

    @Override
    protected String transform(ILoggingEvent event, String formattedMessage) {
        if (formattedMessage == null || formattedMessage.isEmpty()) {
            return formattedMessage;
        }

        String masked = formattedMessage;
        masked = BEARER_PATTERN.matcher(masked).replaceAll("$1$2...");
        masked = JWT_PATTERN.matcher(masked).replaceAll("$1...");
        masked = SECRET_PATTERN.matcher(masked).replaceAll("$1[REDACTED]");
        masked = ACCESS_KEY_ID_PATTERN.matcher(masked).replaceAll("****$1");

        return masked;
    }
}
