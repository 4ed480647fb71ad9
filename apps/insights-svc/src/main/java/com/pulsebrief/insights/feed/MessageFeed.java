package com.pulsebrief.insights.feed;

import com.pulsebrief.insights.model.MessageItem;

/**
 * Inbound messages with sender role and unread flag.
 */
public interface MessageFeed extends ItemFeed<MessageItem> {
}
