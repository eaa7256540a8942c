package com.z254.forge.vigil.stream;

/**
 * Connection state of the ingestion loop.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    LISTENING
}
