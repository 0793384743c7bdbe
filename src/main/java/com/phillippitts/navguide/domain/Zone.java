package com.phillippitts.navguide.domain;

/**
 * One of three equal-width horizontal thirds of the frame.
 */
public enum Zone {
    LEFT,
    CENTER,
    RIGHT
}
