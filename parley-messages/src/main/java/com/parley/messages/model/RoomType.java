package com.parley.messages.model;

public enum RoomType {
    CHANNEL,
    PRIVATE_GROUP,
    DIRECT,
    OMNICHANNEL
}
