package com.pipekit.core.model;

/**
 * A token of a text with its character span.
 *
 * @param text token text as it appears in the input
 * @param start start offset (inclusive)
 * @param end end offset (exclusive)
 */
public record Token(String text, int start, int end) {
}
