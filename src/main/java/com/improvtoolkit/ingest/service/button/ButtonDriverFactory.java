package com.improvtoolkit.ingest.service.button;

import com.improvtoolkit.ingest.config.properties.ButtonProperties;
import com.improvtoolkit.ingest.service.session.DeviceDriver;

/**
 * Creates the driver for one configured button device, according to the selected backend.
 */
@FunctionalInterface
public interface ButtonDriverFactory {

    DeviceDriver<ButtonDevice> create(ButtonProperties.Device device);
}
