package net.kinvault.e2ee.rotation;

public interface KeyRotationListener {
    void onRotationEvent(KeyRotationEvent event);
}
