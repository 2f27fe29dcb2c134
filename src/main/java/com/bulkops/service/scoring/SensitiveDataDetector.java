package com.bulkops.service.scoring;

import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes values that must not travel in test or bulk data: social security numbers
 * and payment card numbers (Luhn-valid, 13 to 19 digits, optionally grouped).
 */
@Component
public class SensitiveDataDetector {

    private static final Pattern SSN = Pattern.compile("\\b(?!000|666|9\\d\\d)\\d{3}-(?!00)\\d{2}-(?!0000)\\d{4}\\b");
    private static final Pattern CARD = Pattern.compile("\\b\\d(?:[ -]?\\d){12,18}\\b");

    public boolean isSensitive(Object value) {
        return value instanceof CharSequence text && classify(text.toString()).isPresent();
    }

    /**
     * @return "SSN" or "CARD_NUMBER" for the first sensitive pattern found
     */
    public Optional<String> classify(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        if (SSN.matcher(text).find()) {
            return Optional.of("SSN");
        }
        Matcher card = CARD.matcher(text);
        while (card.find()) {
            if (passesLuhn(card.group().replaceAll("[ -]", ""))) {
                return Optional.of("CARD_NUMBER");
            }
        }
        return Optional.empty();
    }

    static boolean passesLuhn(String digits) {
        int sum = 0;
        boolean doubled = false;
        for (int i = digits.length() - 1; i >= 0; i--) {
            int d = digits.charAt(i) - '0';
            if (doubled) {
                d *= 2;
                if (d > 9) {
                    d -= 9;
                }
            }
            sum += d;
            doubled = !doubled;
        }
        return sum % 10 == 0;
    }
}
