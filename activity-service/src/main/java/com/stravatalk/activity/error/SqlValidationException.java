package com.stravatalk.activity.error;

/**
 * Thrown when candidate SQL does not have an allowed shape.
 *
 * <p>Raised for unparseable text, anything other than a single SELECT, references
 * to tables outside the tenant-scoped set, functions missing from the allow-list,
 * table references the tenant predicate could not be bound to and, under the
 * {@code REJECT} policy, any mention of the tenant column.</p>
 */
public class SqlValidationException extends ActivityServiceException {

    public SqlValidationException(String message) {
        super(message);
    }

    public SqlValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
