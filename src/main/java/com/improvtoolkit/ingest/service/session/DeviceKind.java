package com.improvtoolkit.ingest.service.session;

/** Hardware category supervised by a session. */
public enum DeviceKind {
    MICROPHONE,
    BUTTON
}
