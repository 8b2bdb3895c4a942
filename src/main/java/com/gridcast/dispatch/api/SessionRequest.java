package com.gridcast.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/sessions.
 *
 * @param goal the operator's question, e.g. "Forecast Ontario demand for the next 24 hours"
 */
public record SessionRequest(String goal) {}
