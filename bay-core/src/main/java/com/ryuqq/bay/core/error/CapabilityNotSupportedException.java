package com.ryuqq.bay.core.error;

import java.util.List;

/**
 * 런타임이 선언하지 않은 capability 요청 (디스패치 전에 fail-fast).
 *
 * @author Bay Team
 * @since 1.0.0
 */
public class CapabilityNotSupportedException extends BayException {

    public CapabilityNotSupportedException(String capability, List<String> available) {
        super(ErrorCode.CAPABILITY_NOT_SUPPORTED, "Runtime does not support capability: " + capability,
            details("capability", capability, "available", available));
    }
}
