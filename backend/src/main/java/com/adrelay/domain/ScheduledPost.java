package com.adrelay.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One planned distribution event: channel x day x time slot of a campaign.
 * Created SCHEDULED by the provisioner; the external publisher moves it to PUBLISHED or FAILED.
 */
@Document(collection = "scheduled_posts")
@CompoundIndexes({
        @CompoundIndex(name = "campaign_channel_day_slot", def = "{'campaignId': 1, 'channelId': 1, 'dayIndex': 1, 'slotIndex': 1}", unique = true),
        @CompoundIndex(name = "status_due", def = "{'status': 1, 'absoluteTimestamp': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ScheduledPost {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String campaignId;
    private String channelId;
    private int dayIndex;
    private int slotIndex;
    /** Time of day, HH:mm (UTC offset from the campaign start). */
    private String slotTime;
    private Instant absoluteTimestamp;
    private ScheduledPostStatus status;
    private Instant statusUpdatedAt;
    private String failureReason;
}
