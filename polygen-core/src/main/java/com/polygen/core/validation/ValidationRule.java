package com.polygen.core.validation;

/**
 * One semantic check over a merged schema.
 *
 * <p>Rules never stop at the first problem; they report every violation they find
 * through {@link ValidationContext#report}.
 */
public interface ValidationRule {

    /**
     * Short identifier used in logs.
     *
     * @return rule name
     */
    String getName();

    void validate(ValidationContext context);
}
