package com.photoraces.model;

/**
 * How a player proves they reached a checkpoint.
 */
public enum ValidationType {
    PHOTO_ONLY,
    GPS_RADIUS,
    QR_CODE,
    MANUAL
}
