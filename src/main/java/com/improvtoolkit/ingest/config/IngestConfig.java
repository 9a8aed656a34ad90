package com.improvtoolkit.ingest.config;

import com.improvtoolkit.ingest.config.properties.AudioCaptureProperties;
import com.improvtoolkit.ingest.config.properties.ButtonProperties;
import com.improvtoolkit.ingest.service.audio.capture.CaptureLine;
import com.improvtoolkit.ingest.service.audio.capture.JavaSoundCaptureDriver;
import com.improvtoolkit.ingest.service.button.ButtonDriverFactory;
import com.improvtoolkit.ingest.service.button.DeviceRegistry;
import com.improvtoolkit.ingest.service.button.evdev.EvdevButtonDriver;
import com.improvtoolkit.ingest.service.button.nativehook.JNativeHookKeyboardHook;
import com.improvtoolkit.ingest.service.button.nativehook.KeyboardHook;
import com.improvtoolkit.ingest.service.button.nativehook.NativeHookButtonDriver;
import com.improvtoolkit.ingest.service.dispatch.LoggingTransportPublisher;
import com.improvtoolkit.ingest.service.dispatch.TransportPublisher;
import com.improvtoolkit.ingest.service.session.DeviceDriver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Device drivers and collaborators of the ingest pipeline. Each bean backs off when a test or an
 * integration supplies its own.
 */
@Configuration
public class IngestConfig {

    private static final Logger LOG = LogManager.getLogger(IngestConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public DeviceDriver<CaptureLine> microphoneDriver(AudioCaptureProperties props) {
        return new JavaSoundCaptureDriver(props);
    }

    @Bean
    @ConditionalOnMissingBean
    public KeyboardHook keyboardHook() {
        return new JNativeHookKeyboardHook();
    }

    @Bean
    @ConditionalOnMissingBean
    public ButtonDriverFactory buttonDriverFactory(ButtonProperties props, ObjectProvider<KeyboardHook> hook) {
        LOG.info("Button backend: {}", props.getBackend());
        return switch (props.getBackend()) {
            case EVDEV -> device -> new EvdevButtonDriver(device.getId(), device.getPath(), device.isGrab());
            case NATIVE_HOOK -> device -> new NativeHookButtonDriver(device.getId(), device.getPath(),
                    hook.getObject());
        };
    }

    @Bean
    public DeviceRegistry deviceRegistry() {
        return new DeviceRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public TransportPublisher transportPublisher() {
        return new LoggingTransportPublisher();
    }
}
