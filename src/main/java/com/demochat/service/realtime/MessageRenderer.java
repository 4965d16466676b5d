package com.demochat.service.realtime;

import com.demochat.config.LiveUpdateProperties;
import com.demochat.model.dto.ChangeKind;
import com.demochat.model.dto.LiveMessage;
import com.demochat.model.dto.RenderedEvent;
import com.demochat.model.dto.TopicKey;
import com.demochat.util.RelativeTime;
import com.demochat.util.UuidTimestamps;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Renders the chat list item pushed to viewers. The markup matches the
 * server-rendered message list so htmx can swap it in place.
 *
 * Output is a single line: SSE splits multi-line data into several fields,
 * so line breaks in user text are written as character references.
 */
@Component
public class MessageRenderer {

    private final Clock clock;
    private final String eventName;

    public MessageRenderer(Clock clock, LiveUpdateProperties properties) {
        this.clock = clock;
        this.eventName = properties.getEventName();
    }

    /**
     * Renders an inserted or updated message for one viewer. Only the viewer's
     * ownership of the message changes the output.
     *
     * @throws MessageRenderException when the message id carries no timestamp
     */
    public RenderedEvent renderMessage(LiveMessage message, TopicKey topic, UUID viewerId, ChangeKind kind) {
        if (kind == ChangeKind.DELETE) {
            throw new IllegalArgumentException("Deleted messages are rendered with renderDeletion");
        }
        Instant createdAt = UuidTimestamps.creationInstant(message.id())
                .orElseThrow(() -> new MessageRenderException(message.id(),
                        "No timestamp in message id " + message.id()));

        boolean isAuthor = message.authorId().equals(viewerId);
        boolean edited = message.updated() != null
                && message.updated().toInstant(ZoneOffset.UTC).isAfter(createdAt);
        String messagePath = topic.messagesPath() + "/" + message.id();

        StringBuilder html = new StringBuilder(512);
        html.append("<li class=\"group chat ").append(isAuthor ? "chat-end" : "chat-start").append('"')
                .append(" id=\"msg-").append(message.id()).append('"');
        if (kind == ChangeKind.UPDATE) {
            html.append(" hx-swap-oob=\"true\"");
        }
        html.append('>');

        html.append("<div class=\"chat-header\">");
        if (edited) {
            html.append("<span class=\"italic text-xs opacity-50\">Edited </span>");
        }
        html.append(escape(message.authorName())).append(' ')
                .append("<time class=\"text-xs opacity-50\" datetime=\"").append(createdAt).append("\">")
                .append(RelativeTime.describe(createdAt, clock.instant()))
                .append("</time></div>");

        html.append("<div class=\"chat-bubble").append(isAuthor ? " chat-bubble-primary" : "").append("\">")
                .append(escape(message.content()))
                .append("</div>");

        html.append("<div class=\"chat-footer transition-opacity\" hx-target=\"closest li\" hx-swap=\"outerHTML\">");
        if (isAuthor) {
            html.append("<button class=\"link mr-2 opacity-0 group-hover:opacity-100\" hx-get=\"")
                    .append(messagePath).append("/editable\">Edit</button>");
        }
        html.append("<button class=\"link link-error opacity-0 group-hover:opacity-100\" hx-delete=\"")
                .append(messagePath).append("\" hx-confirm=\"Are you sure?\">Delete</button>")
                .append("</div></li>");

        return new RenderedEvent(kind, message.id(), eventName, html.toString());
    }

    /**
     * Out-of-band instruction removing the message's list item. Identical for every viewer.
     */
    public RenderedEvent renderDeletion(UUID messageId) {
        String html = "<div id=\"msg-" + messageId + "\" hx-swap-oob=\"delete\"></div>";
        return new RenderedEvent(ChangeKind.DELETE, messageId, eventName, html);
    }

    private static String escape(String text) {
        return HtmlUtils.htmlEscape(text)
                .replace("\r", "&#13;")
                .replace("\n", "&#10;");
    }
}
