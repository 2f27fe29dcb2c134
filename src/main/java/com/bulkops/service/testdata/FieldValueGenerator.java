package com.bulkops.service.testdata;

import com.bulkops.model.FieldDescriptor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Random;

/**
 * Produces type-appropriate values for one field of one synthetic record.
 * All randomness comes from the caller's seeded {@link Random}, so output is reproducible.
 */
@Component
public class FieldValueGenerator {

    static final int DEFAULT_TEXT_LENGTH = 255;
    private static final LocalDate BASE_DATE = LocalDate.of(2024, 1, 1);
    private static final LocalDate EARLIEST_DATE = LocalDate.of(1700, 1, 1);
    private static final LocalDate LATEST_DATE = LocalDate.of(4000, 12, 31);

    /**
     * @param objectName     object being generated, used in text values
     * @param field          target field; relationship fields are not handled here
     * @param ordinal        zero-based record number
     * @param random         seeded source
     * @param boundaryString fill text fields to their maximum length
     * @param outOfRange     use extreme but valid numbers and dates
     * @return the value, null when the field type cannot be generated (picklist without values,
     *         reference or id fields)
     */
    public Object generate(String objectName, FieldDescriptor field, int ordinal, Random random,
                           boolean boundaryString, boolean outOfRange) {
        return switch (field.type()) {
            case STRING, TEXTAREA -> text(objectName + " " + field.name() + " " + String.format("%05d", ordinal),
                    field, boundaryString);
            case EMAIL -> boundaryString
                    ? pad("user" + ordinal, field, "@example.com")
                    : "user" + ordinal + "@example.com";
            case PHONE -> String.format("(555) 01%d-%04d", ordinal % 10, random.nextInt(10_000));
            case URL -> "https://example.com/" + objectName.toLowerCase(Locale.ROOT) + "/" + ordinal;
            case INTEGER -> outOfRange ? Integer.MAX_VALUE : random.nextInt(1_000);
            case DOUBLE, CURRENCY -> outOfRange
                    ? new BigDecimal("999999999999.99")
                    : BigDecimal.valueOf(random.nextInt(1_000_000), 2);
            case PERCENT -> outOfRange
                    ? BigDecimal.valueOf(100)
                    : BigDecimal.valueOf(random.nextDouble() * 100).setScale(2, RoundingMode.HALF_UP);
            case BOOLEAN -> random.nextBoolean();
            case DATE -> (outOfRange ? (random.nextBoolean() ? EARLIEST_DATE : LATEST_DATE)
                    : BASE_DATE.plusDays(random.nextInt(365))).toString();
            case DATETIME -> (outOfRange
                    ? LATEST_DATE.atTime(23, 59, 59)
                    : LocalDateTime.of(BASE_DATE.plusDays(random.nextInt(365)), LocalTime.of(random.nextInt(24), 0)))
                    .toInstant(ZoneOffset.UTC).toString();
            case PICKLIST -> field.picklistValues().isEmpty()
                    ? null
                    : field.picklistValues().get(outOfRange ? field.picklistValues().size() - 1
                            : ordinal % field.picklistValues().size());
            case REFERENCE, ID -> null;
        };
    }

    private static String text(String base, FieldDescriptor field, boolean boundary) {
        int max = maxLength(field);
        if (boundary) {
            return pad(base, field, "");
        }
        return base.length() > max ? base.substring(0, max) : base;
    }

    /**
     * Fill {@code base} with filler characters so that base + suffix is exactly the field's maximum length.
     */
    private static String pad(String base, FieldDescriptor field, String suffix) {
        int max = maxLength(field);
        int room = max - suffix.length();
        if (room <= base.length()) {
            return (base + suffix).substring(0, max);
        }
        return base + "x".repeat(room - base.length()) + suffix;
    }

    private static int maxLength(FieldDescriptor field) {
        return field.length() > 0 ? field.length() : DEFAULT_TEXT_LENGTH;
    }
}
