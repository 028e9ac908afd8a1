package com.yuzhi.spl.gateway;

import com.yuzhi.spl.gateway.config.GuardrailProperties;
import com.yuzhi.spl.gateway.config.SplunkProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({ SplunkProperties.class, GuardrailProperties.class })
public class SplGatewayApp {

    public static void main(String[] args) {
        SpringApplication.run(SplGatewayApp.class, args);
    }
}
