package net.keygate.core.error;

public class ResourceNotFoundException extends KeygateException {

    public ResourceNotFoundException(String kind, Object id) {
        super(kind + " not found: " + id);
    }
}
