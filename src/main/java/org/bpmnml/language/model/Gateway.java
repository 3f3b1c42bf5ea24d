package org.bpmnml.language.model;

public final class Gateway extends Node {
    private final GatewayType gatewayType; // null when the source omits it

    public Gateway(String name, GatewayType gatewayType) {
        super(name);
        this.gatewayType = gatewayType;
    }

    public GatewayType getGatewayType() {
        return gatewayType;
    }

    /**
     * @return the declared type, or {@link GatewayType#EXCLUSIVE} when none was declared
     */
    public GatewayType getEffectiveGatewayType() {
        return gatewayType != null ? gatewayType : GatewayType.EXCLUSIVE;
    }

    @Override
    public ElementKind kind() {
        return ElementKind.GATEWAY;
    }
}
