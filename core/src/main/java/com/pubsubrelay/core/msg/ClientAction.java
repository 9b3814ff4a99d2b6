package com.pubsubrelay.core.msg;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Client → server request, discriminated by the {@code action} field.
 *
 * @see PublishAction
 * @see UpdateMetadataAction
 */
public interface ClientAction {

    /**
     * Optional correlation id, echoed only to the requester.
     */
    JsonNode getRef();
}
