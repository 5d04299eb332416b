package com.bbthechange.moments.dto;

import com.bbthechange.moments.upload.state.FileUploadState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One file of a batch as the client renders it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FileUploadDTO {

    private String fileId;
    private String name;
    private long sizeBytes;
    private String mediaKind;
    private String status;
    private int progressPercent;
    private String previewRef;
    private String mediaUrl;
    private String thumbnailUrl;
    private String videoId;
    private String videoTranscodeStatus;
    private String draftId;
    private String error;
    private int retryCount;
    private String caption;

    public static FileUploadDTO from(FileUploadState file) {
        return FileUploadDTO.builder()
                .fileId(file.getId())
                .name(file.getName())
                .sizeBytes(file.getSizeBytes())
                .mediaKind(file.getMediaKind() != null ? file.getMediaKind().getValue() : null)
                .status(file.getStatus().getValue())
                .progressPercent(file.getProgressPercent())
                .previewRef(file.getPreviewRef())
                .mediaUrl(file.getRemoteMediaUrl())
                .thumbnailUrl(file.getRemoteThumbnailUrl())
                .videoId(file.getRemoteVideoId())
                .videoTranscodeStatus(file.getVideoTranscodeStatus())
                .draftId(file.getDraftId())
                .error(file.getError())
                .retryCount(file.getRetryCount())
                .caption(file.getCaption())
                .build();
    }
}
