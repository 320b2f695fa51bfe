package com.synclab.laddersim.config;

import com.synclab.laddersim.opcua.RungCommandHandler;
import com.synclab.laddersim.opcua.RungNamespace;
import com.synclab.laddersim.opcua.UaNodeManager;
import com.synclab.laddersim.simulation.SimulationSessionRegistry;
import org.eclipse.milo.opcua.sdk.server.OpcUaServer;
import org.eclipse.milo.opcua.sdk.server.api.config.OpcUaServerConfig;
import org.eclipse.milo.opcua.stack.core.security.SecurityPolicy;
import org.eclipse.milo.opcua.stack.core.types.builtin.LocalizedText;
import org.eclipse.milo.opcua.stack.server.EndpointConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Set;

@Configuration
@EnableConfigurationProperties({SimulationProperties.class, OpcUaProperties.class})
public class LadderSimServerConfig {

    private static final Logger log = LoggerFactory.getLogger(LadderSimServerConfig.class);

    @Bean(destroyMethod = "shutdown")
    public SimulationSessionRegistry simulationSessionRegistry(SimulationProperties properties) {
        return new SimulationSessionRegistry(properties);
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnProperty(prefix = "ladder.opcua", name = "enabled", havingValue = "true", matchIfMissing = true)
    public OpcUaServer opcUaServer(OpcUaProperties properties) throws Exception {

        EndpointConfiguration endpoint = new EndpointConfiguration.Builder()
                .setBindAddress(properties.getBindAddress())
                .setHostname(properties.getHostname())
                .setPath(properties.getPath())
                .setSecurityPolicy(SecurityPolicy.None)
                .setBindPort(properties.getPort())
                .build();

        OpcUaServerConfig config = OpcUaServerConfig.builder()
                .setApplicationUri(properties.getApplicationUri())
                .setProductUri("urn:synclab:ladder-sim:product")
                .setApplicationName(LocalizedText.english("SyncLab Ladder Simulator"))
                .setEndpoints(Set.of(endpoint))
                .build();

        OpcUaServer server = new OpcUaServer(config);
        server.startup().get();
        log.info("Milo OPC UA server started at opc.tcp://{}:{}{}",
                properties.getHostname(), properties.getPort(), properties.getPath());
        return server;
    }

    @Bean
    @ConditionalOnProperty(prefix = "ladder.opcua", name = "enabled", havingValue = "true", matchIfMissing = true)
    public UaNodeManager nodeManager() {
        return new UaNodeManager();
    }

    @Bean
    @ConditionalOnProperty(prefix = "ladder.opcua", name = "enabled", havingValue = "true", matchIfMissing = true)
    public RungNamespace rungNamespace(OpcUaServer server,
                                       OpcUaProperties opcUaProperties,
                                       SimulationProperties simulationProperties,
                                       UaNodeManager nodeManager,
                                       SimulationSessionRegistry registry) {
        RungNamespace namespace = new RungNamespace(server, opcUaProperties.getNamespaceUri(), nodeManager,
                new RungCommandHandler(simulationProperties.getScanIntervalMs()));
        namespace.startup();
        registry.addListener(namespace);
        return namespace;
    }
}
