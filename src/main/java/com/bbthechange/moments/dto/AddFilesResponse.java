package com.bbthechange.moments.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AddFilesResponse {

    private List<String> fileIds;
    private BatchSnapshotResponse batch;
}
