package com.lansync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Session start. {@code config} and {@code world} are opaque blobs owned by the simulation
 * (settings, level walls and so on) and may be absent.
 */
@JsonTypeName("GAME_START")
public final class GameStartMessage extends Message {

    private final int participantCount;
    private final JsonNode config;
    private final JsonNode world;

    @JsonCreator
    public GameStartMessage(@JsonProperty(value = "participantCount", required = true) int participantCount,
                            @JsonProperty("config") JsonNode config,
                            @JsonProperty("world") JsonNode world) {
        this.participantCount = participantCount;
        this.config = blob(config);
        this.world = blob(world);
    }

    public GameStartMessage(int participantCount) {
        this(participantCount, null, null);
    }

    @Override
    public MessageType getType() {
        return MessageType.GAME_START;
    }

    public int getParticipantCount() {
        return participantCount;
    }

    public JsonNode getConfig() {
        return config;
    }

    public JsonNode getWorld() {
        return world;
    }

    @Override
    public String toString() {
        return "GameStartMessage{participantCount=" + participantCount + '}';
    }
}
