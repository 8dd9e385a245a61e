package com.ryuqq.bay.core.error;

/**
 * 리소스가 없거나 호출자에게 보이지 않음 (soft delete 포함).
 *
 * @author Bay Team
 * @since 1.0.0
 */
public class NotFoundException extends BayException {

    public NotFoundException(String resource, String id) {
        super(ErrorCode.NOT_FOUND, resource + " not found: " + id, details("resource", resource, "id", id));
    }
}
