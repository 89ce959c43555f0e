package com.providerhub.routing;

import com.providerhub.providers.ChatResponse;

/** A response together with the schedule that produced it. */
public record RoutedResponse(ScheduleResult schedule, ChatResponse response, long latencyMs) {}
