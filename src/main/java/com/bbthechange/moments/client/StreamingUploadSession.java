package com.bbthechange.moments.client;

/**
 * A resumable upload created on the streaming service.
 *
 * @param uploadUrl tus endpoint the chunks are sent to
 * @param videoId the service's id of the video being created
 */
public record StreamingUploadSession(String uploadUrl, String videoId) {
}
