package com.skycomm.planner.mission;

/**
 * Air-to-air refueling segment defined between two named route waypoints.
 */
public record RefuelingWindow(String id, String startWaypointName, String endWaypointName) {}
