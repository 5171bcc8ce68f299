package com.lob.protocol;

/** Aggregated depth at one price: the sum of remaining quantity of every order resting there. */
public record LevelInfo(long price, long quantity) {}
