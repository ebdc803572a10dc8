package com.overflowgrid.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.boot.web.servlet.server.ConfigurableServletWebServerFactory;
import org.springframework.stereotype.Component;

@Component
public class BindAddressCustomizer implements WebServerFactoryCustomizer<ConfigurableServletWebServerFactory> {

    private static final Logger log = LoggerFactory.getLogger(BindAddressCustomizer.class);

    private final AppProperties properties;

    public BindAddressCustomizer(AppProperties properties) {
        this.properties = properties;
    }

    @Override
    public void customize(ConfigurableServletWebServerFactory factory) {
        factory.setAddress(properties.getBindAddress());
        factory.setPort(properties.getBindPort());
        log.info("Binding simulation endpoint to {}:{}", properties.getBindHost(), properties.getBindPort());
    }
}
