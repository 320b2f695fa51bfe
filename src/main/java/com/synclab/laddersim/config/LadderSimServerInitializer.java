package com.synclab.laddersim.config;

import com.synclab.laddersim.opcua.RungNamespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "ladder.opcua", name = "enabled", havingValue = "true", matchIfMissing = true)
public class LadderSimServerInitializer {

    private static final Logger log = LoggerFactory.getLogger(LadderSimServerInitializer.class);

    private final RungNamespace namespace;

    public LadderSimServerInitializer(RungNamespace namespace) {
        this.namespace = namespace;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void initAfterSpringContext() {
        namespace.initializeNodes();
        log.info("Sessions folder linked under Objects");
    }
}
