package com.phillippitts.voiceorders.service.orders;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds order numbers and order-status intent in transcribed speech.
 *
 * <p>Extraction precedence:
 * <ol>
 *   <li>a number of at least three digits after the word "order", optionally followed by
 *       "number", "no.", or "#", and optionally "is" or ":" ("order number is 1003", "order #1003")</li>
 *   <li>otherwise the first standalone run of three or more digits anywhere in the text</li>
 * </ol>
 * Explicit "order N" phrasing wins over incidental numbers. The fallback also matches unrelated
 * numbers such as prices.
 */
public final class OrderRequestParser {

    private static final Pattern EXPLICIT_ORDER_NUMBER = Pattern.compile(
            "order\\s*(?:number|no\\.?|#)?(?:\\s*(?:is|:))?\\s*(\\d{3,})",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern STANDALONE_NUMBER = Pattern.compile("\\b(\\d{3,})\\b");

    private static final List<String> INTENT_PHRASES = List.of(
            "order status", "track my order", "check my order", "order update");

    private OrderRequestParser() {}

    /**
     * Extracts an order number from the text.
     *
     * @return the digits, or empty if the text holds no number of three or more digits
     */
    public static Optional<String> extractOrderNumber(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher explicit = EXPLICIT_ORDER_NUMBER.matcher(text);
        if (explicit.find()) {
            return Optional.of(explicit.group(1));
        }
        Matcher standalone = STANDALONE_NUMBER.matcher(text);
        if (standalone.find()) {
            return Optional.of(standalone.group(1));
        }
        return Optional.empty();
    }

    /**
     * Whether the caller is asking about an order's status (case-insensitive).
     */
    public static boolean isOrderStatusRequest(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String normalized = text.toLowerCase(Locale.ROOT);
        for (String phrase : INTENT_PHRASES) {
            if (normalized.contains(phrase)) {
                return true;
            }
        }
        return normalized.contains("order") && normalized.contains("status");
    }
}
