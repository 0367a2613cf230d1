package io.lighting.metakit.validate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.lighting.metakit.page.PageMetadata;
import java.util.List;
import org.junit.jupiter.api.Test;

class MetadataValidatorTest {

    @Test
    void defaultsAreValid() {
        ValidationResult result = PageMetadata.create().validate();

        assertTrue(result.isValid());
        assertEquals(List.of(), result.errors());
    }

    @Test
    void reportsEveryBuiltInViolation() {
        PageMetadata metadata = new PageMetadata()
            .withPage(0)
            .withPageSize(0)
            .withSortDirection("up")
            .withCursor("Y3Vyc29y");

        ValidationResult result = metadata.validate();

        assertFalse(result.isValid());
        assertEquals(
            List.of(ErrorCode.INVALID_PAGE, ErrorCode.INVALID_PAGE_SIZE, ErrorCode.INVALID_SORT_DIRECTION,
                ErrorCode.MISSING_CURSOR_FIELD),
            result.errors().stream().map(ValidationError::code).toList()
        );
        assertEquals("page", result.errors().get(0).field());
        assertEquals("page_size", result.errors().get(1).field());
        assertEquals("sort_direction", result.errors().get(2).field());
        assertEquals("cursor_field", result.errors().get(3).field());
    }

    @Test
    void pageSizeAboveHardLimit() {
        ValidationResult result = PageMetadata.create().withPageSize(101).validate();

        assertEquals(1, result.errors().size());
        assertTrue(result.hasError(ErrorCode.PAGE_SIZE_TOO_LARGE));
    }

    @Test
    void directionsMustBeExactKeywords() {
        ValidationResult upper = PageMetadata.create()
            .withSortDirection("DESC")
            .withCursorField("id")
            .withCursorOrder("Asc")
            .validate();
        ValidationResult padded = PageMetadata.create().withSortDirection(" asc").validate();

        assertEquals(2, upper.errors().size());
        assertTrue(upper.hasError(ErrorCode.INVALID_SORT_DIRECTION));
        assertTrue(upper.hasError(ErrorCode.INVALID_CURSOR_ORDER));
        assertTrue(padded.hasError(ErrorCode.INVALID_SORT_DIRECTION));
        assertTrue(PageMetadata.create().withSortDirection("desc").validate().isValid());
    }

    @Test
    void invalidCursorOrder() {
        ValidationResult result = PageMetadata.create().withCursorField("id").withCursorOrder("newest").validate();

        assertEquals(1, result.errors().size());
        assertTrue(result.hasError(ErrorCode.INVALID_CURSOR_ORDER));
        assertEquals("cursor_order", result.errors().get(0).field());
    }

    @Test
    void maxRuleOnPageSize() {
        ValidationResult result = PageMetadata.create()
            .withPageSize(30)
            .withValidationRule("page_size", "max:20")
            .validate();

        assertEquals(1, result.errors().size());
        assertTrue(result.hasError(ErrorCode.PAGE_SIZE_EXCEEDS_MAX));
    }

    @Test
    void minRuleOnPageSize() {
        ValidationResult result = PageMetadata.create()
            .withPageSize(2)
            .withValidationRule("page_size", "min:5")
            .validate();

        assertTrue(result.hasError(ErrorCode.PAGE_SIZE_BELOW_MIN));
    }

    @Test
    void inRuleOnSort() {
        PageMetadata metadata = PageMetadata.create().withValidationRule("sort", "in:name,email,age");

        assertTrue(metadata.withSort("age").validate().isValid());

        ValidationResult result = metadata.withSort("invalid_field").validate();
        assertTrue(result.hasError(ErrorCode.INVALID_SORT_FIELD));
        assertEquals("sort", result.errors().get(0).field());
    }

    @Test
    void inRuleOnFieldsReportsFirstOffender() {
        ValidationResult result = PageMetadata.create()
            .withFields("id", "invalid_field", "other_field")
            .withValidationRule("fields", "in:id,name,email,age")
            .validate();

        assertEquals(1, result.errors().size());
        assertTrue(result.hasError(ErrorCode.INVALID_SELECTED_FIELD));
        assertTrue(result.errors().get(0).message().contains("invalid_field"));
    }

    @Test
    void wildcardSelectionPassesFieldRule() {
        ValidationResult result = PageMetadata.create()
            .withFields("*")
            .withValidationRule("fields", "in:id,name")
            .validate();

        assertTrue(result.isValid());
    }

    @Test
    void malformedRuleIsReported() {
        ValidationResult result = PageMetadata.create()
            .withValidationRule("page_size", "max:abc")
            .withValidationRule("sort", "between:1")
            .validate();

        assertEquals(2, result.errors().size());
        assertEquals(
            List.of(ErrorCode.INVALID_VALIDATION_RULE, ErrorCode.INVALID_VALIDATION_RULE),
            result.errors().stream().map(ValidationError::code).toList()
        );
    }

    @Test
    void rulesOnOtherFieldsOrKindsAreIgnored() {
        ValidationResult result = PageMetadata.create()
            .withSort("name")
            .withValidationRule("cursor_field", "in:id")
            .withValidationRule("sort", "max:1")
            .withValidationRule("page_size", "in:5,10")
            .validate();

        assertTrue(result.isValid());
    }

    @Test
    void validationDoesNotChangeMetadata() {
        PageMetadata metadata = new PageMetadata().withPage(-2).withPageSize(500).withSortDirection("x");

        metadata.validate();

        assertEquals(-2, metadata.getPage());
        assertEquals(500, metadata.getPageSize());
        assertEquals("x", metadata.getSortDirection());
    }
}
