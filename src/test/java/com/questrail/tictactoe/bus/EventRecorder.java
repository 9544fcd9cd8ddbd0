package com.questrail.tictactoe.bus;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test subscriber that records every {@link GameEvent} published on a bus, in
 * delivery order.
 */
public final class EventRecorder
{
    private final List<GameEvent> events = new ArrayList<>();

    @SuppressWarnings("unchecked")
    public EventRecorder(EventBus bus)
    {
        for (Class<?> type : GameEvent.class.getPermittedSubclasses()) {
            bus.subscribe((Class<GameEvent>) type, this::record);
        }
    }

    private synchronized void record(GameEvent event)
    {
        events.add(event);
    }

    public synchronized List<GameEvent> all()
    {
        return new ArrayList<>(events);
    }

    public synchronized <T extends GameEvent> List<T> ofType(Class<T> type)
    {
        return events.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }

    public synchronized void clear()
    {
        events.clear();
    }
}
