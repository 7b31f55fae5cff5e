package com.skycomm.planner.rules;

import com.skycomm.planner.mission.Transport;
import java.time.Instant;

/**
 * Operator instruction derived from a transition window.
 *
 * @param transport transport to disable
 * @param satelliteId satellite being switched to
 * @param start window start
 * @param end window end
 * @param message sentence shown to operators
 */
public record Advisory(Transport transport, String satelliteId, Instant start, Instant end, String message) {}
