package com.pulsebrief.insights.feed;

import com.pulsebrief.insights.model.TaskItem;

/**
 * Open and completed tasks with due dates, priority and blocking flags.
 */
public interface TaskFeed extends ItemFeed<TaskItem> {
}
