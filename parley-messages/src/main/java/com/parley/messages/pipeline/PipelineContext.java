package com.parley.messages.pipeline;

import com.parley.messages.config.PipelineConfig;
import com.parley.messages.model.ActingUser;
import com.parley.messages.model.Room;

import java.time.Instant;

/**
 * Per-run inputs shared by every stage and check.
 *
 * @param config the snapshot read at the start of the run
 * @param now    processing time of the run
 */
public record PipelineContext(Room room, ActingUser user, PipelineConfig config, Instant now) {
}
