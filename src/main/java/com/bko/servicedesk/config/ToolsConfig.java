package com.bko.servicedesk.config;

import com.bko.servicedesk.tools.CustomerServiceTools;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ToolsConfig {

    @Bean
    public ToolCallbackProvider customerServiceToolCallbacks(CustomerServiceTools customerServiceTools) {
        return MethodToolCallbackProvider.builder()
                .toolObjects(customerServiceTools)
                .build();
    }
}
