package com.phillippitts.callengine;

import com.phillippitts.callengine.config.properties.CallEventProperties;
import com.phillippitts.callengine.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        CallEventProperties.class,
        ThreadPoolProperties.class
})
public class CallEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CallEngineApplication.class, args);
    }

}
