package com.phillippitts.navguide.domain;

/**
 * User-facing horizontal direction of an object relative to the camera center.
 *
 * <p>Same partition as {@link Zone}; kept separate because it is spoken to the user.
 */
public enum Direction {
    LEFT,
    CENTER,
    RIGHT;

    public static Direction of(Zone zone) {
        return switch (zone) {
            case LEFT -> LEFT;
            case CENTER -> CENTER;
            case RIGHT -> RIGHT;
        };
    }
}
