package com.lansync.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;

/**
 * Session end. A missing {@code winnerId} means the session ended in a draw.
 */
@JsonTypeName("GAME_END")
public final class GameEndMessage extends Message {

    private final Integer winnerId;
    private final List<Integer> scores;

    @JsonCreator
    public GameEndMessage(@JsonProperty("winnerId") Integer winnerId,
                          @JsonProperty("scores") List<Integer> scores) {
        this.winnerId = winnerId;
        this.scores = scores != null ? List.copyOf(scores) : List.of();
    }

    public static GameEndMessage draw(List<Integer> scores) {
        return new GameEndMessage(null, scores);
    }

    @Override
    public MessageType getType() {
        return MessageType.GAME_END;
    }

    public Integer getWinnerId() {
        return winnerId;
    }

    public List<Integer> getScores() {
        return scores;
    }

    @JsonIgnore
    public boolean isDraw() {
        return winnerId == null;
    }

    @Override
    public String toString() {
        return "GameEndMessage{winnerId=" + winnerId + ", scores=" + scores + '}';
    }
}
