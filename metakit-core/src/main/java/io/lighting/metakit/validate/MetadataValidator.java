package io.lighting.metakit.validate;

import io.lighting.metakit.page.PageMetadata;
import io.lighting.metakit.page.SortDirection;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Built-in and declarative checks for {@link PageMetadata}.
 * <p>
 * Every check runs independently, so one call reports all violations. Nothing here
 * throws for bad input or changes the metadata.
 */
public final class MetadataValidator {
    public static final String FIELD_PAGE = "page";
    public static final String FIELD_PAGE_SIZE = "page_size";
    public static final String FIELD_SORT = "sort";
    public static final String FIELD_SORT_DIRECTION = "sort_direction";
    public static final String FIELD_CURSOR_FIELD = "cursor_field";
    public static final String FIELD_CURSOR_ORDER = "cursor_order";
    public static final String FIELD_FIELDS = "fields";

    private MetadataValidator() {
    }

    public static ValidationResult validate(PageMetadata metadata) {
        Objects.requireNonNull(metadata, "metadata");
        List<ValidationError> errors = new ArrayList<>();
        checkBuiltIns(metadata, errors);
        for (Map.Entry<String, String> entry : metadata.getValidationRules().entrySet()) {
            checkRule(metadata, entry.getKey(), entry.getValue(), errors);
        }
        if (errors.isEmpty()) {
            return ValidationResult.valid();
        }
        return new ValidationResult(errors);
    }

    private static void checkBuiltIns(PageMetadata metadata, List<ValidationError> errors) {
        if (metadata.getPage() < 1) {
            errors.add(new ValidationError(FIELD_PAGE, "page must be >= 1", ErrorCode.INVALID_PAGE));
        }
        if (metadata.getPageSize() < 1) {
            errors.add(new ValidationError(FIELD_PAGE_SIZE, "page size must be >= 1", ErrorCode.INVALID_PAGE_SIZE));
        }
        if (metadata.getPageSize() > PageMetadata.MAX_PAGE_SIZE) {
            errors.add(new ValidationError(
                FIELD_PAGE_SIZE,
                "page size must be <= " + PageMetadata.MAX_PAGE_SIZE,
                ErrorCode.PAGE_SIZE_TOO_LARGE
            ));
        }
        String sortDirection = metadata.getSortDirection();
        if (!sortDirection.isEmpty() && !SortDirection.isValid(sortDirection)) {
            errors.add(new ValidationError(
                FIELD_SORT_DIRECTION,
                "sort direction must be 'asc' or 'desc'",
                ErrorCode.INVALID_SORT_DIRECTION
            ));
        }
        if (!metadata.getCursor().isEmpty() && metadata.getCursorField().isEmpty()) {
            errors.add(new ValidationError(
                FIELD_CURSOR_FIELD,
                "cursor field is required when a cursor is given",
                ErrorCode.MISSING_CURSOR_FIELD
            ));
        }
        String cursorOrder = metadata.getCursorOrder();
        if (!metadata.getCursorField().isEmpty() && !cursorOrder.isEmpty() && !SortDirection.isValid(cursorOrder)) {
            errors.add(new ValidationError(
                FIELD_CURSOR_ORDER,
                "cursor order must be 'asc' or 'desc'",
                ErrorCode.INVALID_CURSOR_ORDER
            ));
        }
    }

    private static void checkRule(PageMetadata metadata, String field, String text, List<ValidationError> errors) {
        ValidationRule rule;
        try {
            rule = ValidationRule.parse(text);
        } catch (IllegalArgumentException ex) {
            errors.add(new ValidationError(field, ex.getMessage(), ErrorCode.INVALID_VALIDATION_RULE));
            return;
        }
        switch (field) {
            case FIELD_PAGE_SIZE -> checkPageSize(metadata.getPageSize(), rule, errors);
            case FIELD_SORT -> checkSort(metadata.getSort(), rule, errors);
            case FIELD_FIELDS -> checkFields(metadata, rule, errors);
            default -> {
                // rules for other fields are not enforced
            }
        }
    }

    private static void checkPageSize(int pageSize, ValidationRule rule, List<ValidationError> errors) {
        if (rule instanceof ValidationRule.Max max && pageSize > max.limit()) {
            errors.add(new ValidationError(
                FIELD_PAGE_SIZE,
                "page size must not exceed " + max.limit(),
                ErrorCode.PAGE_SIZE_EXCEEDS_MAX
            ));
        } else if (rule instanceof ValidationRule.Min min && pageSize < min.limit()) {
            errors.add(new ValidationError(
                FIELD_PAGE_SIZE,
                "page size must be at least " + min.limit(),
                ErrorCode.PAGE_SIZE_BELOW_MIN
            ));
        }
    }

    private static void checkSort(String sort, ValidationRule rule, List<ValidationError> errors) {
        if (rule instanceof ValidationRule.In in && !sort.isEmpty() && !in.allows(sort)) {
            errors.add(new ValidationError(
                FIELD_SORT,
                "sort field '" + sort + "' is not allowed",
                ErrorCode.INVALID_SORT_FIELD
            ));
        }
    }

    private static void checkFields(PageMetadata metadata, ValidationRule rule, List<ValidationError> errors) {
        if (!(rule instanceof ValidationRule.In in)) {
            return;
        }
        for (String field : metadata.getSelectedFields()) {
            if (PageMetadata.ALL_FIELDS.equals(field)) {
                continue;
            }
            if (!in.allows(field)) {
                errors.add(new ValidationError(
                    FIELD_FIELDS,
                    "field '" + field + "' is not allowed",
                    ErrorCode.INVALID_SELECTED_FIELD
                ));
                return;
            }
        }
    }
}
