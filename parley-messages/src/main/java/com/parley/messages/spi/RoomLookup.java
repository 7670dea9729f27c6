package com.parley.messages.spi;

import com.parley.messages.model.Room;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

@FunctionalInterface
public interface RoomLookup {

    /**
     * Resolve room ids to room records. Unknown ids are absent from the result.
     */
    CompletableFuture<List<Room>> findByIds(Collection<String> roomIds);
}
