package io.b2mash.b2b.licensemanager.validation;

/**
 * A single rejected field of an admin submission.
 *
 * @param field the submitted property that caused the rejection, in snake_case (e.g. {@code
 *     num_licenses})
 * @param message human-readable description shown to the submitter
 */
public record FieldRejection(String field, String message) {}
