package com.statusio.aggregator.model;

public enum PremiumState {
  ACTIVE,
  INACTIVE,
  UNKNOWN
}
