package com.pulsebrief.insights.feed;

import com.pulsebrief.insights.model.MeetingItem;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryCalendarFeed extends InMemoryItemFeed<MeetingItem> implements CalendarFeed {

    public InMemoryCalendarFeed() {
        super(MeetingItem::id);
    }
}
