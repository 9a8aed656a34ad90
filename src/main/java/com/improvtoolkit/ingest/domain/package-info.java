/**
 * Immutable data model flowing through the ingest pipeline: captured and tagged audio frames,
 * button events, and the priority envelopes used for dispatch.
 *
 * @since 1.0
 */
package com.improvtoolkit.ingest.domain;
