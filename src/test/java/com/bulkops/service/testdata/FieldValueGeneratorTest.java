package com.bulkops.service.testdata;

import com.bulkops.model.FieldDescriptor;
import com.bulkops.model.FieldType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class FieldValueGeneratorTest {

    private final FieldValueGenerator generator = new FieldValueGenerator();

    @Test
    @DisplayName("Should fill text to the field length at the boundary")
    void shouldPadBoundaryText() {
        FieldDescriptor name = FieldDescriptor.text("Name", true, 40);

        Object plain = generator.generate("Widget", name, 7, new Random(1), false, false);
        Object boundary = generator.generate("Widget", name, 7, new Random(1), true, false);

        assertThat(plain).isEqualTo("Widget Name 00007");
        assertThat((String) boundary).hasSize(40).startsWith("Widget Name 00007");
    }

    @Test
    @DisplayName("Should keep boundary emails valid")
    void shouldPadEmailBeforeDomain() {
        FieldDescriptor email = FieldDescriptor.of("Email", FieldType.EMAIL, true);

        String value = (String) generator.generate("Contact", email, 3, new Random(1), true, false);

        assertThat(value).hasSize(255).startsWith("user3").endsWith("@example.com");
    }

    @Test
    @DisplayName("Should use extreme values when out of range is requested")
    void shouldUseExtremes() {
        Random random = new Random(1);

        assertThat(generator.generate("Widget", FieldDescriptor.of("Quantity", FieldType.INTEGER, false), 0, random, false, true))
                .isEqualTo(Integer.MAX_VALUE);
        assertThat(generator.generate("Widget", FieldDescriptor.of("Price", FieldType.CURRENCY, false), 0, random, false, true))
                .isEqualTo(new BigDecimal("999999999999.99"));
        assertThat(generator.generate("Widget",
                FieldDescriptor.picklist("Status", false, List.of("New", "Active", "Retired")), 0, random, false, true))
                .isEqualTo("Retired");
    }

    @Test
    void shouldLeaveReferencesToTheCaller() {
        assertThat(generator.generate("Contact", FieldDescriptor.reference("AccountId", true, "Account"),
                0, new Random(1), false, false)).isNull();
    }
}
