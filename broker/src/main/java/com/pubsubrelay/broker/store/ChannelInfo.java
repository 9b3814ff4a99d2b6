package com.pubsubrelay.broker.store;

import lombok.Value;

/**
 * Persisted channel identity row. Never updated once written.
 */
@Value
public class ChannelInfo {
    String contextId;
    long createdAt;
    String createdBy;
}
