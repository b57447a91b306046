package com.changelab.mentor.strategy;

public enum OutputMode {
    FEEDBACK,
    ITEMS
}
