package com.bbthechange.moments.model;

import com.bbthechange.moments.util.MomentsKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

import java.time.Instant;
import java.util.UUID;

/**
 * A media moment of an event, stored in the MomentsTable.
 * Created as a DRAFT visible only to its author, later flipped to PUBLISHED.
 *
 * Key Pattern: PK = EVENT#{eventId}, SK = MOMENT#{momentId}
 */
@DynamoDbBean
public class MomentDraft extends BaseItem {

    private String momentId;
    private String eventId;
    private String userId;
    private String batchId;
    private String contentType;   // photo or video
    private String mediaUrl;      // null while a streamed video is still transcoding
    private String thumbnailUrl;
    private String caption;
    private String videoId;
    private String contentHash;
    private String status;        // DRAFT or PUBLISHED
    private Instant publishedAt;

    // Default constructor for DynamoDB
    public MomentDraft() {
        super();
        setItemType(MomentsKeyFactory.MOMENT_PREFIX);
        this.status = MomentsKeyFactory.STATUS_DRAFT;
    }

    public MomentDraft(String eventId, String userId) {
        this();
        this.momentId = UUID.randomUUID().toString();
        this.eventId = eventId;
        this.userId = userId;
        setPk(MomentsKeyFactory.getEventPk(eventId));
        setSk(MomentsKeyFactory.getMomentSk(this.momentId));
    }

    public String getMomentId() {
        return momentId;
    }

    public void setMomentId(String momentId) {
        this.momentId = momentId;
    }

    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getBatchId() {
        return batchId;
    }

    public void setBatchId(String batchId) {
        this.batchId = batchId;
    }

    public String getContentType() {
        return contentType;
    }

    public void setContentType(String contentType) {
        this.contentType = contentType;
    }

    public String getMediaUrl() {
        return mediaUrl;
    }

    public void setMediaUrl(String mediaUrl) {
        this.mediaUrl = mediaUrl;
    }

    public String getThumbnailUrl() {
        return thumbnailUrl;
    }

    public void setThumbnailUrl(String thumbnailUrl) {
        this.thumbnailUrl = thumbnailUrl;
    }

    public String getCaption() {
        return caption;
    }

    public void setCaption(String caption) {
        this.caption = caption;
    }

    public String getVideoId() {
        return videoId;
    }

    public void setVideoId(String videoId) {
        this.videoId = videoId;
    }

    public String getContentHash() {
        return contentHash;
    }

    public void setContentHash(String contentHash) {
        this.contentHash = contentHash;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Instant getPublishedAt() {
        return publishedAt;
    }

    public void setPublishedAt(Instant publishedAt) {
        this.publishedAt = publishedAt;
    }
}
