/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.improvtoolkit.ingest.exception.IngestException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.improvtoolkit.ingest.exception.InvalidConfigurationException} - Configuration
 *       error detected at startup; aborts the process before any device is opened</li>
 *   <li>{@link com.improvtoolkit.ingest.exception.DeviceUnavailableException} - Transient hardware
 *       error; recovered locally by the device session retry policy</li>
 *   <li>{@link com.improvtoolkit.ingest.exception.QueueShutdownException} - Queue terminated;
 *       callers stop cleanly</li>
 *   <li>{@link com.improvtoolkit.ingest.exception.QueueEmptyException} - Non-blocking get found
 *       nothing</li>
 *   <li>{@link com.improvtoolkit.ingest.exception.InvalidAudioException} - PCM payload does not
 *       match its declared format</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and support exception chaining via {@code cause}.
 *
 * @since 1.0
 */
package com.improvtoolkit.ingest.exception;
