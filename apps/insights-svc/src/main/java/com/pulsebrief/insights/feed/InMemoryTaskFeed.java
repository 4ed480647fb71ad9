package com.pulsebrief.insights.feed;

import com.pulsebrief.insights.model.TaskItem;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryTaskFeed extends InMemoryItemFeed<TaskItem> implements TaskFeed {

    public InMemoryTaskFeed() {
        super(TaskItem::id);
    }
}
