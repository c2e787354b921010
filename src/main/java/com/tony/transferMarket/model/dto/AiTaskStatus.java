package com.tony.transferMarket.model.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** État de la dernière journée IA lancée pour une partie. */
@Value
@Builder
public class AiTaskStatus {

    public enum State { RUNNING, SUCCEEDED, FAILED }

    Long saveId;
    State state;
    int season;
    int round;
    Instant startedAt;
    Instant finishedAt;
    AiTransferSummary summary;
    String error;
}
