package org.springaicommunity.github.triage;

import org.jspecify.annotations.Nullable;

/**
 * A label attached to an issue or pull request.
 *
 * @param name the label name
 * @param color the hex color without leading '#', may be null
 */
public record Label(String name, @Nullable String color) {
}
