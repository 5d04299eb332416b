package com.bbthechange.moments.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;

/**
 * Caption applied to several files at once. Without {@code fileIds} every file of the batch is
 * captioned. Files that already have a draft or were skipped keep their caption.
 */
@Data
public class BatchCaptionRequest {

    private List<String> fileIds;

    @Size(max = 500, message = "Caption must be 500 characters or less")
    private String caption;
}
