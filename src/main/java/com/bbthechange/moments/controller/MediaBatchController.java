package com.bbthechange.moments.controller;

import com.bbthechange.moments.dto.AddFilesResponse;
import com.bbthechange.moments.dto.BatchCaptionRequest;
import com.bbthechange.moments.dto.BatchSnapshotResponse;
import com.bbthechange.moments.dto.CaptionRequest;
import com.bbthechange.moments.dto.PublishResponse;
import com.bbthechange.moments.service.MediaBatchService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

/**
 * Bulk media upload sessions for event moments.
 */
@RestController
@Validated
@Tag(name = "Media batches", description = "Bulk photo and video upload for event moments")
public class MediaBatchController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(MediaBatchController.class);

    private final MediaBatchService mediaBatchService;

    @Autowired
    public MediaBatchController(MediaBatchService mediaBatchService) {
        this.mediaBatchService = mediaBatchService;
    }

    /**
     * POST /events/{eventId}/media-batches
     */
    @PostMapping("/events/{eventId}/media-batches")
    @Operation(summary = "Open an upload batch", description = "Creates an idle batch for the caller and the event.")
    public ResponseEntity<BatchSnapshotResponse> openBatch(
            @Parameter(description = "Event ID") @PathVariable String eventId,
            HttpServletRequest request) {
        String userId = extractUserId(request);
        logger.info("Opening upload batch for event {} by user {}", eventId, userId);
        return ResponseEntity.status(HttpStatus.CREATED).body(mediaBatchService.openBatch(eventId, userId));
    }

    /**
     * GET /media-batches/{sessionId}
     */
    @GetMapping("/media-batches/{sessionId}")
    @Operation(summary = "Get batch snapshot", description = "Batch status, counts and per-file state.")
    public ResponseEntity<BatchSnapshotResponse> getBatch(@PathVariable String sessionId, HttpServletRequest request) {
        String userId = extractUserId(request);
        return ResponseEntity.ok(mediaBatchService.getBatch(sessionId, userId));
    }

    /**
     * POST /media-batches/{sessionId}/files
     */
    @PostMapping(value = "/media-batches/{sessionId}/files", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Add files", description = "Adds files to the batch. Each file is hashed and checked for duplicates right away.")
    public ResponseEntity<AddFilesResponse> addFiles(
            @PathVariable String sessionId,
            @RequestPart("files") List<MultipartFile> files,
            HttpServletRequest request) {
        String userId = extractUserId(request);
        logger.info("Adding {} files to session {} for user {}", files.size(), sessionId, userId);
        return ResponseEntity.status(HttpStatus.CREATED).body(mediaBatchService.addFiles(sessionId, userId, files));
    }

    /**
     * DELETE /media-batches/{sessionId}/files/{fileId}
     */
    @DeleteMapping("/media-batches/{sessionId}/files/{fileId}")
    @Operation(summary = "Remove a file", description = "Removes a file in any state. A running transfer is left to finish and its result is dropped.")
    public ResponseEntity<BatchSnapshotResponse> removeFile(
            @PathVariable String sessionId,
            @PathVariable String fileId,
            HttpServletRequest request) {
        String userId = extractUserId(request);
        return ResponseEntity.ok(mediaBatchService.removeFile(sessionId, userId, fileId));
    }

    @PostMapping("/media-batches/{sessionId}/start")
    @Operation(summary = "Start uploading")
    public ResponseEntity<BatchSnapshotResponse> start(@PathVariable String sessionId, HttpServletRequest request) {
        String userId = extractUserId(request);
        logger.info("Starting upload session {} for user {}", sessionId, userId);
        return ResponseEntity.ok(mediaBatchService.start(sessionId, userId));
    }

    @PostMapping("/media-batches/{sessionId}/pause")
    @Operation(summary = "Pause dispatch", description = "Transfers already running carry on.")
    public ResponseEntity<BatchSnapshotResponse> pause(@PathVariable String sessionId, HttpServletRequest request) {
        String userId = extractUserId(request);
        return ResponseEntity.ok(mediaBatchService.pause(sessionId, userId));
    }

    @PostMapping("/media-batches/{sessionId}/resume")
    @Operation(summary = "Resume dispatch")
    public ResponseEntity<BatchSnapshotResponse> resume(@PathVariable String sessionId, HttpServletRequest request) {
        String userId = extractUserId(request);
        return ResponseEntity.ok(mediaBatchService.resume(sessionId, userId));
    }

    @PostMapping("/media-batches/{sessionId}/retry-failed")
    @Operation(summary = "Retry every failed file")
    public ResponseEntity<BatchSnapshotResponse> retryAllFailed(@PathVariable String sessionId, HttpServletRequest request) {
        String userId = extractUserId(request);
        return ResponseEntity.ok(mediaBatchService.retryAllFailed(sessionId, userId));
    }

    @PostMapping("/media-batches/{sessionId}/files/{fileId}/retry")
    @Operation(summary = "Retry one failed file")
    public ResponseEntity<BatchSnapshotResponse> retryFile(
            @PathVariable String sessionId,
            @PathVariable String fileId,
            HttpServletRequest request) {
        String userId = extractUserId(request);
        return ResponseEntity.ok(mediaBatchService.retryFile(sessionId, userId, fileId));
    }

    @PostMapping("/media-batches/{sessionId}/clear-complete")
    @Operation(summary = "Drop completed files from the batch")
    public ResponseEntity<BatchSnapshotResponse> clearComplete(@PathVariable String sessionId, HttpServletRequest request) {
        String userId = extractUserId(request);
        return ResponseEntity.ok(mediaBatchService.clearComplete(sessionId, userId));
    }

    @PostMapping("/media-batches/{sessionId}/reset")
    @Operation(summary = "Reset the batch", description = "Discards every file and starts over under a new batch id.")
    public ResponseEntity<BatchSnapshotResponse> reset(@PathVariable String sessionId, HttpServletRequest request) {
        String userId = extractUserId(request);
        logger.info("Resetting upload session {} for user {}", sessionId, userId);
        return ResponseEntity.ok(mediaBatchService.reset(sessionId, userId));
    }

    /**
     * PUT /media-batches/{sessionId}/files/{fileId}/caption
     */
    @PutMapping("/media-batches/{sessionId}/files/{fileId}/caption")
    @Operation(summary = "Caption one file", description = "Ignored once the file has a draft.")
    public ResponseEntity<BatchSnapshotResponse> setCaption(
            @PathVariable String sessionId,
            @PathVariable String fileId,
            @Valid @RequestBody CaptionRequest captionRequest,
            HttpServletRequest request) {
        String userId = extractUserId(request);
        return ResponseEntity.ok(mediaBatchService.setCaption(sessionId, userId, fileId, captionRequest.getCaption()));
    }

    /**
     * PUT /media-batches/{sessionId}/caption
     */
    @PutMapping("/media-batches/{sessionId}/caption")
    @Operation(summary = "Caption several files", description = "Without fileIds every file of the batch is captioned.")
    public ResponseEntity<BatchSnapshotResponse> setBatchCaption(
            @PathVariable String sessionId,
            @Valid @RequestBody BatchCaptionRequest captionRequest,
            HttpServletRequest request) {
        String userId = extractUserId(request);
        return ResponseEntity.ok(mediaBatchService.setBatchCaption(
                sessionId, userId, captionRequest.getFileIds(), captionRequest.getCaption()));
    }

    /**
     * POST /media-batches/{sessionId}/publish
     */
    @PostMapping("/media-batches/{sessionId}/publish")
    @Operation(summary = "Publish drafts", description = "Publishes the caller's drafts for the batch's event.")
    public ResponseEntity<PublishResponse> publishBatch(@PathVariable String sessionId, HttpServletRequest request) {
        String userId = extractUserId(request);
        logger.info("Publishing drafts of session {} for user {}", sessionId, userId);
        return ResponseEntity.ok(mediaBatchService.publishBatch(sessionId, userId));
    }

    /**
     * POST /events/{eventId}/moments/publish
     */
    @PostMapping("/events/{eventId}/moments/publish")
    @Operation(summary = "Publish drafts for an event", description = "Does not need an open batch.")
    public ResponseEntity<PublishResponse> publishEvent(
            @Parameter(description = "Event ID") @PathVariable String eventId,
            HttpServletRequest request) {
        String userId = extractUserId(request);
        logger.info("Publishing drafts of event {} for user {}", eventId, userId);
        return ResponseEntity.ok(mediaBatchService.publishEvent(eventId, userId));
    }

    /**
     * DELETE /media-batches/{sessionId}
     */
    @DeleteMapping("/media-batches/{sessionId}")
    @Operation(summary = "Discard the batch")
    public ResponseEntity<Void> discard(@PathVariable String sessionId, HttpServletRequest request) {
        String userId = extractUserId(request);
        mediaBatchService.discard(sessionId, userId);
        return ResponseEntity.noContent().build();
    }
}
