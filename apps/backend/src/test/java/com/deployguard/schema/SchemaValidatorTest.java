package com.deployguard.schema;

import com.deployguard.model.Dataset;
import com.deployguard.model.Finding;
import com.deployguard.model.FindingCategory;
import com.deployguard.model.ValidationResult;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.deployguard.Fixtures.customers;
import static com.deployguard.Fixtures.dataset;
import static org.assertj.core.api.Assertions.assertThat;

class SchemaValidatorTest {

    private final SchemaValidator validator = new SchemaValidator();

    private static DatasetSchema customerSchema() {
        return DatasetSchema.builder()
                .type("array")
                .requiredField("id")
                .requiredField("email")
                .property("id", FieldRule.ofType("integer"))
                .property("email", FieldRule.builder().type("string").pattern("^[^@\\s]+@[^@\\s]+$").build())
                .property("status", FieldRule.builder().type("string").enumValues(List.of("active", "inactive")).build())
                .property("balance", FieldRule.builder().type("number").min(BigDecimal.ZERO).max(new BigDecimal("1000")).build())
                .build();
    }

    @Test
    void validDatasetPasses() {
        ValidationResult r = validator.validate(dataset(customers(10)), customerSchema());
        assertThat(r.passed()).isTrue();
        assertThat(r.errors()).isEmpty();
        assertThat(r.riskScore()).isZero();
    }

    @Test
    void accumulatesErrorsAcrossRecords() {
        Map<String, Object> noEmail = new LinkedHashMap<>(Map.of("id", 2, "status", "active", "balance", 5));
        Map<String, Object> badStatus = new LinkedHashMap<>(Map.of("id", 3, "email", "c@x.io", "status", "gone", "balance", 5));
        Map<String, Object> negative = new LinkedHashMap<>(Map.of("id", 4, "email", "d@x.io", "status", "active", "balance", -1));
        Map<String, Object> badEmail = new LinkedHashMap<>(Map.of("id", 5, "email", "nope", "status", "active", "balance", 1));
        Dataset d = dataset(List.of(customers(1).get(0), noEmail, badStatus, negative, badEmail));

        ValidationResult r = validator.validate(d, customerSchema());

        assertThat(r.passed()).isFalse();
        assertThat(r.errors()).extracting(Finding::subject)
                .containsExactlyInAnyOrder("2.email", "3.status", "4.balance", "5.email");
        assertThat(r.errors()).allMatch(f -> f.category() == FindingCategory.SCHEMA_VIOLATION);
    }

    @Test
    void reportsOnlyFirstViolatedRulePerField() {
        DatasetSchema schema = DatasetSchema.builder().type("array")
                .property("code", FieldRule.builder().type("string").pattern("^[A-Z]+$").minLength(5).build())
                .build();
        ValidationResult r = validator.validate(dataset(List.of(Map.of("id", 1, "code", "ab"))), schema);
        assertThat(r.errors()).hasSize(1);
        assertThat(r.errors().get(0).message()).contains("pattern");
    }

    @Test
    void typeMismatchIsReported() {
        ValidationResult r = validator.validate(dataset(List.of(Map.of("id", "one", "email", "a@b.c"))), customerSchema());
        assertThat(r.errors()).singleElement()
                .satisfies(f -> assertThat(f.message()).contains("expected integer"));
    }

    @Test
    void missingSchemaIsSingleTopLevelError() {
        ValidationResult r = validator.validate(dataset(customers(3)), (DatasetSchema) null);
        assertThat(r.errors()).singleElement()
                .satisfies(f -> assertThat(f.message()).isEqualTo("No schema supplied"));
    }

    @Test
    void invalidSchemaIsSingleTopLevelError() {
        DatasetSchema badRegex = DatasetSchema.builder().type("array")
                .property("email", FieldRule.builder().pattern("([a-z").build()).build();
        DatasetSchema badBounds = DatasetSchema.builder().type("array")
                .property("n", FieldRule.builder().min(BigDecimal.TEN).max(BigDecimal.ONE).build()).build();
        DatasetSchema badType = DatasetSchema.builder().type("table").build();

        for (DatasetSchema s : List.of(badRegex, badBounds, badType)) {
            ValidationResult r = validator.validate(dataset(customers(3)), s);
            assertThat(r.errors()).hasSize(1);
            assertThat(r.errors().get(0).message()).startsWith("Invalid schema");
        }
    }

    @Test
    void nullEntriesInSchemaAreReportedNotThrown() {
        DatasetSchema nullRequired = DatasetSchema.builder().type("array").requiredField(null).build();
        DatasetSchema nullRule = DatasetSchema.builder().type("array").property("x", null).build();
        List<String> required = new ArrayList<>();
        required.add("id");
        required.add(null);
        DatasetSchema fromList = new DatasetSchema("array", required, null);

        assertThat(validator.validate(dataset(customers(3)), nullRequired).errors()).singleElement()
                .satisfies(f -> assertThat(f.message()).isEqualTo("Invalid schema: blank entry in required list"));
        assertThat(validator.validate(dataset(customers(3)), nullRule).errors()).singleElement()
                .satisfies(f -> assertThat(f.message()).isEqualTo("Invalid schema: field 'x' has no rule"));
        assertThat(validator.validate(dataset(customers(3)), fromList).errors()).hasSize(1);
    }

    @Test
    void rawMapSchemaIsParsed() {
        Map<String, Object> raw = Map.of(
                "type", "array",
                "required", List.of("id"),
                "properties", Map.of("balance", Map.of("type", "number", "minimum", 0, "maximum", 200)));

        assertThat(validator.validate(dataset(customers(5)), raw).passed()).isTrue();
        assertThat(validator.validate(dataset(customers(5)), Map.of("type", "array", "required", "id")).errors())
                .singleElement()
                .satisfies(f -> assertThat(f.message()).startsWith("Invalid schema"));
    }

    @Test
    void objectSchemaNeedsExactlyOneRecord() {
        DatasetSchema object = DatasetSchema.builder().type("object").requiredField("id").build();
        assertThat(validator.validate(dataset(customers(1)), object).passed()).isTrue();
        assertThat(validator.validate(dataset(customers(2)), object).passed()).isFalse();
    }

    @Test
    void scalarSchemaRejectsRecordDatasets() {
        DatasetSchema scalar = DatasetSchema.builder().type("scalar").build();
        assertThat(validator.validate(dataset(customers(1)), scalar).passed()).isFalse();
    }
}
