package com.skycomm.planner.rules;

public enum Severity {
  INFO,
  WARNING,
  CRITICAL,
  SAFETY
}
