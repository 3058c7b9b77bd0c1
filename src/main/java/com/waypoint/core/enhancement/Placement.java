package com.waypoint.core.enhancement;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Where an enhancement's tasks go.
 *
 * @param kind         into an existing open milestone, or into newly created milestones
 * @param milestoneIds target milestone(s); several only when the feature had to be split
 * @param position     plan index of the (first) target milestone
 * @param reason       why this position was chosen
 */
public record Placement(
    Kind kind,
    List<String> milestoneIds,
    int position,
    String reason
) {

    public Placement {
        milestoneIds = List.copyOf(milestoneIds);
    }

    public enum Kind {
        @JsonProperty("existing_milestone") EXISTING_MILESTONE,
        @JsonProperty("new_milestone") NEW_MILESTONE
    }
}
