package com.phillippitts.numberdrill.presentation.dto;

/**
 * Decoded value; {@code value} is null when {@code parsed} is false.
 */
public record DecodeResponse(String text, String language, boolean parsed, Long value) {
}
