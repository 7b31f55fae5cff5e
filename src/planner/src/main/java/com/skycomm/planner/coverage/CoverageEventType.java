package com.skycomm.planner.coverage;

public enum CoverageEventType {
  ENTRY,
  EXIT
}
