package com.pulsebrief.insights.feed;

import com.pulsebrief.insights.model.DecisionItem;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryDecisionFeed extends InMemoryItemFeed<DecisionItem> implements DecisionFeed {

    public InMemoryDecisionFeed() {
        super(DecisionItem::id);
    }
}
