package com.demochat.model.dto;

import java.util.UUID;

/**
 * A change event rendered for a single viewer.
 *
 * @param kind      change that produced this event
 * @param messageId message the fragment refers to
 * @param eventName SSE event name the browser swaps on
 * @param data      single-line HTML fragment, or the out-of-band delete instruction
 */
public record RenderedEvent(
        ChangeKind kind,
        UUID messageId,
        String eventName,
        String data
) { }
