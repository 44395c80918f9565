package com.phillippitts.selfspy;

import com.phillippitts.selfspy.config.properties.BufferProperties;
import com.phillippitts.selfspy.config.properties.EncryptionProperties;
import com.phillippitts.selfspy.config.properties.FlushProperties;
import com.phillippitts.selfspy.config.properties.MonitorProperties;
import com.phillippitts.selfspy.config.properties.PrivacyProperties;
import com.phillippitts.selfspy.config.properties.ReportingProperties;
import com.phillippitts.selfspy.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        MonitorProperties.class,
        BufferProperties.class,
        FlushProperties.class,
        EncryptionProperties.class,
        PrivacyProperties.class,
        ReportingProperties.class,
        ThreadPoolProperties.class
})
public class SelfspyApplication {

    public static void main(String[] args) {
        SpringApplication.run(SelfspyApplication.class, args);
    }

}
