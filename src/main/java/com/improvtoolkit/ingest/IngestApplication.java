package com.improvtoolkit.ingest;

import com.improvtoolkit.ingest.config.properties.AudioCaptureProperties;
import com.improvtoolkit.ingest.config.properties.AudioProcessingProperties;
import com.improvtoolkit.ingest.config.properties.ButtonProperties;
import com.improvtoolkit.ingest.config.properties.DeviceSessionProperties;
import com.improvtoolkit.ingest.config.properties.PipelineProperties;
import com.improvtoolkit.ingest.config.properties.ShowProperties;
import com.improvtoolkit.ingest.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        ShowProperties.class,
        DeviceSessionProperties.class,
        AudioCaptureProperties.class,
        AudioProcessingProperties.class,
        ButtonProperties.class,
        ThreadPoolProperties.class,
        PipelineProperties.class
})
public class IngestApplication {

    public static void main(String[] args) {
        SpringApplication.run(IngestApplication.class, args);
    }

}
