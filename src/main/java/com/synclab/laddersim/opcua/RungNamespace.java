package com.synclab.laddersim.opcua;

import com.synclab.laddersim.engine.eval.PowerFlowResult;
import com.synclab.laddersim.simulation.SessionListener;
import com.synclab.laddersim.simulation.SessionSnapshot;
import com.synclab.laddersim.simulation.SimulationSession;
import org.eclipse.milo.opcua.sdk.core.AccessLevel;
import org.eclipse.milo.opcua.sdk.core.Reference;
import org.eclipse.milo.opcua.sdk.core.ValueRanks;
import org.eclipse.milo.opcua.sdk.server.OpcUaServer;
import org.eclipse.milo.opcua.sdk.server.api.DataItem;
import org.eclipse.milo.opcua.sdk.server.api.ManagedNamespaceWithLifecycle;
import org.eclipse.milo.opcua.sdk.server.api.MonitoredItem;
import org.eclipse.milo.opcua.sdk.server.nodes.UaFolderNode;
import org.eclipse.milo.opcua.sdk.server.nodes.UaVariableNode;
import org.eclipse.milo.opcua.sdk.server.nodes.filters.AttributeFilter;
import org.eclipse.milo.opcua.sdk.server.nodes.filters.AttributeFilterContext;
import org.eclipse.milo.opcua.sdk.server.util.SubscriptionModel;
import org.eclipse.milo.opcua.stack.core.AttributeId;
import org.eclipse.milo.opcua.stack.core.Identifiers;
import org.eclipse.milo.opcua.stack.core.types.builtin.DataValue;
import org.eclipse.milo.opcua.stack.core.types.builtin.DateTime;
import org.eclipse.milo.opcua.stack.core.types.builtin.LocalizedText;
import org.eclipse.milo.opcua.stack.core.types.builtin.NodeId;
import org.eclipse.milo.opcua.stack.core.types.builtin.QualifiedName;
import org.eclipse.milo.opcua.stack.core.types.builtin.StatusCode;
import org.eclipse.milo.opcua.stack.core.types.builtin.Variant;
import org.eclipse.milo.opcua.stack.core.types.builtin.unsigned.UShort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Publishes every simulation session under {@code Sessions/<id>}: one variable per tag, numeric
 * value and timer/counter member, the rung state, and a writable {@code <id>.command} node.
 * Values are pushed after each scan or operator change; nodes for newly seen tags are created on
 * the fly.
 */
public class RungNamespace extends ManagedNamespaceWithLifecycle implements SessionListener {

    private static final Logger log = LoggerFactory.getLogger(RungNamespace.class);

    private final SubscriptionModel subscriptionModel;
    private final AtomicInteger nodeCounter = new AtomicInteger(1);
    private final UaFolderNode rootFolder;
    private final UaNodeManager nodes;
    private final RungCommandHandler commandHandler;
    private final Map<String, SessionNodes> sessionNodes = new ConcurrentHashMap<>();

    private static final class SessionNodes {
        private final UaFolderNode folder;
        private final Reference rootReference;
        private final UaVariableNode commandNode;

        private SessionNodes(UaFolderNode folder, Reference rootReference, UaVariableNode commandNode) {
            this.folder = folder;
            this.rootReference = rootReference;
            this.commandNode = commandNode;
        }
    }

    private static NodeId dataTypeIdFor(Object v) {
        if (v instanceof Boolean) return Identifiers.Boolean;
        if (v instanceof Byte || v instanceof Short || v instanceof Integer) return Identifiers.Int32;
        if (v instanceof Long) return Identifiers.Int64;
        if (v instanceof Float || v instanceof Double) return Identifiers.Double;
        if (v instanceof String) return Identifiers.String;
        return Identifiers.BaseDataType;
    }

    public RungNamespace(OpcUaServer server, String namespaceUri, UaNodeManager nodes, RungCommandHandler commandHandler) {
        super(server, namespaceUri);
        this.nodes = nodes;
        this.commandHandler = commandHandler;
        this.subscriptionModel = new SubscriptionModel(server, this);
        getLifecycleManager().addLifecycle(subscriptionModel);

        UShort nsIdx = getNamespaceIndex();
        rootFolder = new UaFolderNode(
                getNodeContext(),
                new NodeId(nsIdx, "Sessions"),
                new QualifiedName(nsIdx, "Sessions"),
                LocalizedText.english("Sessions")
        );
        getNodeContext().getNodeManager().addNode(rootFolder);
    }

    /** Links the Sessions folder under the server's Objects folder. */
    public void initializeNodes() {
        getNodeContext().getNodeManager().addReference(new Reference(
                Identifiers.ObjectsFolder,
                Identifiers.Organizes,
                rootFolder.getNodeId().expanded(),
                true
        ));
        log.info("OPC UA namespace {} ready (index {})", getNamespaceUri(), getNamespaceIndex());
    }

    private int nextNodeId() {
        return nodeCounter.getAndIncrement();
    }

    @Override
    public void sessionCreated(SimulationSession session) {
        String id = session.getId();
        UaFolderNode folder = new UaFolderNode(
                getNodeContext(),
                new NodeId(getNamespaceIndex(), nextNodeId()),
                new QualifiedName(getNamespaceIndex(), id),
                LocalizedText.english(id + " (" + session.getRungId() + ")")
        );
        getNodeContext().getNodeManager().addNode(folder);
        Reference rootReference = new Reference(rootFolder.getNodeId(), Identifiers.Organizes, folder.getNodeId().expanded(), true);
        rootFolder.addReference(rootReference);

        UaVariableNode commandNode = addCommandNode(folder, session);
        sessionNodes.put(id, new SessionNodes(folder, rootReference, commandNode));
        publish(session);
        log.info("Session {} published under Sessions/{}", id, id);
    }

    @Override
    public void sessionScanned(SimulationSession session, PowerFlowResult powerFlow) {
        publish(session);
    }

    @Override
    public void sessionChanged(SimulationSession session) {
        publish(session);
    }

    @Override
    public void sessionRemoved(SimulationSession session) {
        SessionNodes removed = sessionNodes.remove(session.getId());
        if (removed == null) {
            return;
        }
        for (UaVariableNode node : nodes.unregisterSession(session.getId())) {
            getNodeContext().getNodeManager().removeNode(node.getNodeId());
        }
        getNodeContext().getNodeManager().removeNode(removed.commandNode.getNodeId());
        rootFolder.removeReference(removed.rootReference);
        getNodeContext().getNodeManager().removeNode(removed.folder.getNodeId());
        log.info("Session {} unpublished", session.getId());
    }

    private void publish(SimulationSession session) {
        SessionNodes owner = sessionNodes.get(session.getId());
        if (owner == null) {
            return;
        }
        SessionSnapshot snapshot = session.snapshot();
        String id = snapshot.getId();
        updateVariable(owner.folder, id, "rungEnergized", snapshot.isRungEnergized());
        updateVariable(owner.folder, id, "scanCount", snapshot.getScanCount());
        snapshot.getTags().forEach((tag, value) -> updateVariable(owner.folder, id, tag, value));
        snapshot.getNumerics().forEach((tag, value) -> updateVariable(owner.folder, id, tag, value));
        snapshot.getTimers().forEach((tag, timer) -> {
            updateVariable(owner.folder, id, tag + ".ACC", timer.getAcc());
            updateVariable(owner.folder, id, tag + ".PRE", timer.getPre());
            updateVariable(owner.folder, id, tag + ".EN", timer.isEn());
            updateVariable(owner.folder, id, tag + ".TT", timer.isTt());
            updateVariable(owner.folder, id, tag + ".DN", timer.isDn());
        });
        snapshot.getCounters().forEach((tag, counter) -> {
            updateVariable(owner.folder, id, tag + ".ACC", counter.getAcc());
            updateVariable(owner.folder, id, tag + ".PRE", counter.getPre());
            updateVariable(owner.folder, id, tag + ".CU", counter.isCu());
            updateVariable(owner.folder, id, tag + ".CD", counter.isCd());
            updateVariable(owner.folder, id, tag + ".DN", counter.isDn());
            updateVariable(owner.folder, id, tag + ".OV", counter.isOv());
            updateVariable(owner.folder, id, tag + ".UN", counter.isUn());
        });
    }

    private void updateVariable(UaFolderNode folder, String sessionId, String name, Object value) {
        String key = sessionId + "." + name;
        UaVariableNode node = nodes.find(key);
        if (node == null) {
            nodes.register(key, addVariableNode(folder, name, value));
            return;
        }
        node.setValue(new DataValue(new Variant(value), StatusCode.GOOD, DateTime.now(), DateTime.now()));
    }

    private UaVariableNode addVariableNode(UaFolderNode parent, String name, Object initialValue) {
        UaVariableNode node = UaVariableNode.builder(getNodeContext())
                .setNodeId(new NodeId(getNamespaceIndex(), nextNodeId()))
                .setBrowseName(new QualifiedName(getNamespaceIndex(), name))
                .setDisplayName(LocalizedText.english(name))
                .setTypeDefinition(Identifiers.BaseDataVariableType)
                .setValueRank(ValueRanks.Scalar)
                .setMinimumSamplingInterval(100.0)
                .setAccessLevel(AccessLevel.toValue(EnumSet.of(AccessLevel.CurrentRead)))
                .setUserAccessLevel(AccessLevel.toValue(EnumSet.of(AccessLevel.CurrentRead)))
                .setDataType(dataTypeIdFor(initialValue))
                .setValue(new DataValue(new Variant(initialValue), StatusCode.GOOD, DateTime.now(), DateTime.now()))
                .build();

        getNodeContext().getNodeManager().addNode(node);
        parent.addReference(new Reference(parent.getNodeId(), Identifiers.Organizes, node.getNodeId().expanded(), true));
        log.debug("[Telemetry-Init] {} = {}", name, initialValue);
        return node;
    }

    private UaVariableNode addCommandNode(UaFolderNode folder, SimulationSession session) {
        UaVariableNode commandNode = UaVariableNode.builder(getNodeContext())
                .setNodeId(new NodeId(getNamespaceIndex(), nextNodeId()))
                .setBrowseName(new QualifiedName(getNamespaceIndex(), session.getId() + ".command"))
                .setDisplayName(LocalizedText.english(session.getId() + " Command"))
                .setTypeDefinition(Identifiers.BaseDataVariableType)
                .setValueRank(ValueRanks.Scalar)
                .setDataType(Identifiers.String)
                .setMinimumSamplingInterval(0.0)
                .setAccessLevel(AccessLevel.toValue(EnumSet.of(AccessLevel.CurrentRead, AccessLevel.CurrentWrite)))
                .setUserAccessLevel(AccessLevel.toValue(EnumSet.of(AccessLevel.CurrentRead, AccessLevel.CurrentWrite)))
                .setValue(new DataValue(new Variant(""), StatusCode.GOOD, DateTime.now(), DateTime.now()))
                .build();

        // a client write lands here and is turned into a session call
        commandNode.getFilterChain().addLast(new AttributeFilter() {
            @Override
            public void setAttribute(AttributeFilterContext.SetAttributeContext ctx, AttributeId attributeId, Object value) {
                ctx.setAttribute(attributeId, value);

                if (attributeId == AttributeId.Value && value instanceof DataValue) {
                    Variant raw = ((DataValue) value).getValue();
                    String command = raw != null && raw.getValue() != null ? raw.getValue().toString().trim() : "";
                    if (!command.isEmpty()) {
                        commandHandler.handle(session, command);
                    }
                }
            }
        });

        getNodeContext().getNodeManager().addNode(commandNode);
        folder.addReference(new Reference(folder.getNodeId(), Identifiers.Organizes, commandNode.getNodeId().expanded(), true));
        return commandNode;
    }

    @Override
    public void onDataItemsCreated(List<DataItem> items) {
        items.forEach(item -> log.debug("[SubscriptionModel] onDataItemsCreated: id={} sampling={}",
                item.getId(), item.getSamplingInterval()));
        subscriptionModel.onDataItemsCreated(items);
    }

    @Override
    public void onDataItemsModified(List<DataItem> items) {
        subscriptionModel.onDataItemsModified(items);
    }

    @Override
    public void onDataItemsDeleted(List<DataItem> items) {
        subscriptionModel.onDataItemsDeleted(items);
    }

    @Override
    public void onMonitoringModeChanged(List<MonitoredItem> items) {
        subscriptionModel.onMonitoringModeChanged(items);
    }
}
