package com.secma.core.global.error;

public class PermissionDeniedException extends SecmaException {

    public static final String CODE = "no-permission";

    private final String permission;
    private final String traceId;

    public PermissionDeniedException(String permission, String traceId) {
        super(ErrorKind.PERMISSION_DENIED, CODE, "Not enough permissions (trace ID: " + traceId + ").");
        this.permission = permission;
        this.traceId = traceId;
    }

    public String getPermission() {
        return permission;
    }

    public String getTraceId() {
        return traceId;
    }
}
