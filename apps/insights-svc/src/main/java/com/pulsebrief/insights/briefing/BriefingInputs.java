package com.pulsebrief.insights.briefing;

import com.pulsebrief.insights.model.Anomaly;
import com.pulsebrief.insights.model.BriefingType;
import com.pulsebrief.insights.model.DataQualityIssue;
import com.pulsebrief.insights.model.DecisionItem;
import com.pulsebrief.insights.model.FounderProfile;
import com.pulsebrief.insights.model.MeetingItem;
import com.pulsebrief.insights.model.MessageItem;
import com.pulsebrief.insights.model.Recommendation;
import com.pulsebrief.insights.model.RootCauseFinding;
import com.pulsebrief.insights.model.TaskItem;
import com.pulsebrief.insights.model.Trend;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Everything a briefing can draw from for one tenant at one point in time.
 */
public record BriefingInputs(
        String tenantId,
        BriefingType type,
        Instant asOf,
        FounderProfile profile,
        List<TaskItem> tasks,
        List<MeetingItem> meetings,
        List<MessageItem> messages,
        List<DecisionItem> decisions,
        List<Anomaly> anomalies,
        List<RootCauseFinding> rootCauses,
        List<Trend> trends,
        List<Recommendation> recommendations,
        Map<String, Double> latestValues,
        List<DataQualityIssue> issues
) {

    public BriefingInputs {
        profile = profile == null ? FounderProfile.defaultFor(tenantId) : profile;
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        meetings = meetings == null ? List.of() : List.copyOf(meetings);
        messages = messages == null ? List.of() : List.copyOf(messages);
        decisions = decisions == null ? List.of() : List.copyOf(decisions);
        anomalies = anomalies == null ? List.of() : List.copyOf(anomalies);
        rootCauses = rootCauses == null ? List.of() : List.copyOf(rootCauses);
        trends = trends == null ? List.of() : List.copyOf(trends);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        latestValues = latestValues == null ? Map.of() : Map.copyOf(latestValues);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
