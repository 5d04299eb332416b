package com.bbthechange.moments.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PublishResponse {

    private String eventId;
    private int publishedCount;
}
