package com.parley.messages.pipeline.check;

/**
 * A failed constraint.
 *
 * @param code stable error code reported in the veto
 */
public record ConstraintViolation(String code, String reason) {
}
