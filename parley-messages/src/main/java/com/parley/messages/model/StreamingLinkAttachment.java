package com.parley.messages.model;

/**
 * Preview of a link to a music-streaming resource.
 *
 * @param provider     host name or URI scheme the link was recognized by
 * @param resourceType track, album, playlist, artist, episode or show
 * @param resourceId   provider-side identifier
 * @param url          the link as it appeared in the message
 */
public record StreamingLinkAttachment(String provider, String resourceType, String resourceId, String url)
        implements MessageAttachment {

    @Override
    public AttachmentKind kind() {
        return AttachmentKind.STREAMING_LINK;
    }
}
