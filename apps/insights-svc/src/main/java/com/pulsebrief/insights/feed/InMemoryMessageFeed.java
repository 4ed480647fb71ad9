package com.pulsebrief.insights.feed;

import com.pulsebrief.insights.model.MessageItem;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryMessageFeed extends InMemoryItemFeed<MessageItem> implements MessageFeed {

    public InMemoryMessageFeed() {
        super(MessageItem::id);
    }
}
