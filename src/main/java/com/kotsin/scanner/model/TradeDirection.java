package com.kotsin.scanner.model;

public enum TradeDirection {
    LONG,
    SHORT
}
