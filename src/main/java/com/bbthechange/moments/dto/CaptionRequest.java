package com.bbthechange.moments.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Caption for a single file. A blank caption clears it.
 */
@Data
public class CaptionRequest {

    @Size(max = 500, message = "Caption must be 500 characters or less")
    private String caption;
}
