package org.ftpmcp.mcp;

import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.List;

/**
 * MCP 工具注册配置。
 * <p>
 * Spring AI MCP Server 从容器中收集 {@link ToolCallback}，把 {@link FtpMcpTools} 上的 {@code @Tool} 方法暴露为 MCP 工具。
 */
@Configuration
public class McpToolConfiguration {

    @Bean
    public List<ToolCallback> ftpToolCallbacks(FtpMcpTools tools) {
        return Arrays.asList(ToolCallbacks.from(tools));
    }
}
