package com.pulsebrief.insights.feed;

import com.pulsebrief.insights.model.DecisionItem;

/**
 * Recently recorded decisions.
 */
public interface DecisionFeed extends ItemFeed<DecisionItem> {
}
