package com.pulsebrief.insights.feed;

import com.pulsebrief.insights.model.MeetingItem;

/**
 * Upcoming meetings with attendee roles.
 */
public interface CalendarFeed extends ItemFeed<MeetingItem> {
}
