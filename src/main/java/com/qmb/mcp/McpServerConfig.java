package com.qmb.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Publishes the model builder tools to the MCP server.
 */
@Configuration
public class McpServerConfig {

    @Bean
    public ToolCallbackProvider modelBuilderTools(ModelBuilderMcpTools tools) {
        return MethodToolCallbackProvider.builder().toolObjects(tools).build();
    }
}
