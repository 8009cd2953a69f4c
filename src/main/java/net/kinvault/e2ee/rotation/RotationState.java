package net.kinvault.e2ee.rotation;

public enum RotationState {
    NO_KEY,
    ACTIVE,
    /**
     * The active key expires within the pre-rotation warning window.
     */
    WARNING,
    ROTATING
}
