package net.keygate.core.model;

public record ProductPayload(long productId, String name, String payload, String downloadFilename) {
    @Override
    public String toString() {
        return "ProductPayload{productId=" + productId + ", name='" + name + "'}";
    }
}
