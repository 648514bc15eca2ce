package com.binday.core.calendar;

import com.binday.core.model.CollectionEvent;

import java.util.List;

public interface CalendarBuilder {
    byte[] build(List<CollectionEvent> events);
}
